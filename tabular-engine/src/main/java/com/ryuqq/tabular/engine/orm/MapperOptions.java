package com.ryuqq.tabular.engine.orm;

import com.ryuqq.tabular.engine.audit.AuditOptions;

/**
 * RecordMapper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enableTransactions: 쓰기를 edit session으로 감쌈 (기본 true)</li>
 *   <li>enableLog: update/delete 전 감사 로그 기록 (기본 false)</li>
 *   <li>updateReadCheck: read() 성공 전 update() 금지 (기본 true)</li>
 *   <li>requireEditSession: 쓰기 시점에 열린 edit session 필수 (기본 false)</li>
 *   <li>audit: 감사 로그 설정</li>
 * </ul>
 *
 * <p><strong>updateReadCheck를 끄는 경우:</strong> 읽지 않은 멤버가 null로 기록되어
 * 기존 값을 지울 수 있습니다. 모든 멤버를 직접 채운 경우에만 끄십시오.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 * @param enableTransactions 트랜잭션 사용 여부
 * @param enableLog 감사 로그 사용 여부
 * @param updateReadCheck update 전 read 필수 여부
 * @param requireEditSession 쓰기 시 edit session 필수 여부
 * @param audit 감사 로그 설정
 */
public record MapperOptions(
    boolean enableTransactions,
    boolean enableLog,
    boolean updateReadCheck,
    boolean requireEditSession,
    AuditOptions audit
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: enableTransactions=true, enableLog=false, updateReadCheck=true,
     * requireEditSession=false, audit=기본 AuditOptions</p>
     */
    public MapperOptions() {
        this(true, false, true, false, new AuditOptions());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException audit이 null인 경우
     */
    public MapperOptions {
        if (audit == null) {
            throw new IllegalArgumentException("audit cannot be null");
        }
    }

    public MapperOptions withEnableTransactions(boolean enableTransactions) {
        return new MapperOptions(enableTransactions, enableLog, updateReadCheck, requireEditSession, audit);
    }

    public MapperOptions withEnableLog(boolean enableLog) {
        return new MapperOptions(enableTransactions, enableLog, updateReadCheck, requireEditSession, audit);
    }

    public MapperOptions withUpdateReadCheck(boolean updateReadCheck) {
        return new MapperOptions(enableTransactions, enableLog, updateReadCheck, requireEditSession, audit);
    }

    public MapperOptions withRequireEditSession(boolean requireEditSession) {
        return new MapperOptions(enableTransactions, enableLog, updateReadCheck, requireEditSession, audit);
    }

    public MapperOptions withAudit(AuditOptions audit) {
        return new MapperOptions(enableTransactions, enableLog, updateReadCheck, requireEditSession, audit);
    }
}
