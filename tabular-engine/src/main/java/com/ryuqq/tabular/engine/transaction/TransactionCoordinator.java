package com.ryuqq.tabular.engine.transaction;

import com.ryuqq.tabular.core.exception.TransactionStateException;
import com.ryuqq.tabular.core.spi.EditSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Edit session 기반 트랜잭션 조정자.
 *
 * <p>쓰기 작업을 edit session + edit operation으로 감싸고, 실패 시 반드시 rollback 합니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>begin(): 이미 편집 중이면 기존 세션을 먼저 commit (중첩 없음)</li>
 *   <li>commit(): operation 종료 후 저장하며 세션 종료, 열린 세션이 없으면 no-op</li>
 *   <li>rollback(): operation 취소 후 저장 없이 세션 종료, 보조 실패는 로그만 남김</li>
 *   <li>execute(): 예외 발생 시 rollback 후 원래 예외를 그대로 다시 던짐</li>
 * </ul>
 *
 * <p><strong>비활성 모드:</strong> {@link #disabled()}로 만든 조정자는 세션 없이 동작하며
 * begin/commit/rollback을 무시합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (TransactionCoordinator tx = new TransactionCoordinator(store.newEditSession())) {
 *     tx.execute(() -&gt; orders.updateWhere("supplier='Acme'", Map.of("total", 0)), false);
 * } // close()는 commit
 * </pre>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class TransactionCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransactionCoordinator.class);

    private final EditSession session;

    /**
     * TransactionCoordinator 생성.
     *
     * @param session edit session
     * @throws IllegalArgumentException session이 null인 경우
     */
    public TransactionCoordinator(EditSession session) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        this.session = session;
    }

    private TransactionCoordinator() {
        this.session = null;
    }

    /**
     * 세션 없이 동작하는 조정자.
     *
     * @return begin/commit/rollback을 무시하는 조정자
     */
    public static TransactionCoordinator disabled() {
        return new TransactionCoordinator();
    }

    public boolean isEnabled() {
        return session != null;
    }

    /**
     * 편집 세션이 열려 있는지 확인.
     *
     * @return 활성 상태면 true
     */
    public boolean isActive() {
        return session != null && session.isEditing();
    }

    /**
     * 트랜잭션 시작.
     *
     * <p>이미 편집 중이면 기존 세션을 먼저 commit 합니다.</p>
     */
    public void begin() {
        if (session == null) {
            log.debug("Transactions disabled, begin() ignored");
            return;
        }
        if (session.isEditing()) {
            log.debug("Session on {} already editing, committing before begin()", session.workspace());
            commit();
        }
        session.startEditing();
        session.startOperation();
    }

    /**
     * 트랜잭션 commit. 열린 세션이 없으면 아무것도 하지 않습니다.
     */
    public void commit() {
        if (session == null || !session.isEditing()) {
            return;
        }
        if (session.isOperationOpen()) {
            session.stopOperation();
        }
        session.stopEditing(true);
    }

    /**
     * 트랜잭션 rollback. 열린 세션이 없으면 아무것도 하지 않습니다.
     *
     * <p>rollback 자체의 실패는 원래 예외를 가리지 않도록 경고 로그만 남깁니다.</p>
     */
    public void rollback() {
        if (session == null || !session.isEditing()) {
            return;
        }
        if (session.isOperationOpen()) {
            try {
                session.abortOperation();
            } catch (RuntimeException e) {
                log.warn("abortOperation failed on workspace {}", session.workspace(), e);
            }
        }
        try {
            session.stopEditing(false);
        } catch (RuntimeException e) {
            log.warn("stopEditing(false) failed on workspace {}", session.workspace(), e);
        }
    }

    /**
     * 작업을 트랜잭션 안에서 실행.
     *
     * @param work 실행할 작업
     * @param autoCommit true면 begin → work → commit
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws RuntimeException work가 던진 예외 (rollback 후 그대로 전파)
     */
    public <T> T execute(Supplier<T> work, boolean autoCommit) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (autoCommit) {
            begin();
        }
        try {
            T result = work.get();
            if (autoCommit) {
                commit();
            }
            return result;
        } catch (RuntimeException | Error e) {
            log.debug("Rolling back after {}", e.toString());
            rollback();
            throw e;
        }
    }

    /**
     * 결과 없는 작업을 트랜잭션 안에서 실행.
     *
     * @param work 실행할 작업
     * @param autoCommit true면 begin → work → commit
     */
    public void run(Runnable work, boolean autoCommit) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        execute(() -> {
            work.run();
            return null;
        }, autoCommit);
    }

    /**
     * 편집 세션이 열려 있어야 하는 작업 전 검사.
     *
     * @param action 작업 이름 (오류 메시지용)
     * @throws TransactionStateException 열린 세션이 없는 경우
     */
    public void requireActive(String action) {
        if (!isActive()) {
            throw new TransactionStateException(
                action + " requires an open edit session"
                    + (session == null ? " but transactions are disabled" : " on workspace " + session.workspace())
            );
        }
    }

    /**
     * commit 후 종료.
     */
    @Override
    public void close() {
        close(true);
    }

    /**
     * 종료.
     *
     * @param commit true면 commit, false면 rollback
     */
    public void close(boolean commit) {
        if (commit) {
            commit();
        } else {
            rollback();
        }
    }
}
