package com.ryuqq.tabular.adapter.inmemory.store;

import com.ryuqq.tabular.core.session.EditSessionState;
import com.ryuqq.tabular.core.session.SessionTransition;
import com.ryuqq.tabular.core.spi.EditSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * In-memory implementation of {@link EditSession} backed by workspace snapshots.
 *
 * <p><strong>Snapshot Points:</strong></p>
 * <ul>
 *   <li>{@code startEditing()}: snapshot restored by {@code stopEditing(false)}</li>
 *   <li>{@code startOperation()}: snapshot restored by {@code abortOperation()}</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class InMemoryEditSession implements EditSession {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEditSession.class);

    private final InMemoryTabularStore store;
    private EditSessionState state;
    private Map<String, InMemoryTable> sessionSnapshot;
    private Map<String, InMemoryTable> operationSnapshot;

    InMemoryEditSession(InMemoryTabularStore store) {
        this.store = store;
        this.state = EditSessionState.CLOSED;
    }

    @Override
    public String workspace() {
        return store.workspace();
    }

    @Override
    public synchronized void startEditing() {
        state = SessionTransition.transition(state, EditSessionState.EDITING);
        sessionSnapshot = store.snapshot();
        log.debug("Started editing workspace {}", store.workspace());
    }

    @Override
    public synchronized void startOperation() {
        state = SessionTransition.transition(state, EditSessionState.OPERATION);
        operationSnapshot = store.snapshot();
    }

    @Override
    public synchronized void stopOperation() {
        requireOperation("stopOperation");
        state = SessionTransition.transition(state, EditSessionState.EDITING);
        operationSnapshot = null;
    }

    @Override
    public synchronized void abortOperation() {
        requireOperation("abortOperation");
        state = SessionTransition.transition(state, EditSessionState.EDITING);
        store.restore(operationSnapshot);
        operationSnapshot = null;
        log.debug("Aborted edit operation on workspace {}", store.workspace());
    }

    @Override
    public synchronized void stopEditing(boolean save) {
        state = SessionTransition.transition(state, EditSessionState.CLOSED);
        if (!save) {
            store.restore(sessionSnapshot);
        }
        sessionSnapshot = null;
        operationSnapshot = null;
        log.debug("Stopped editing workspace {} (save: {})", store.workspace(), save);
    }

    @Override
    public synchronized EditSessionState state() {
        return state;
    }

    private void requireOperation(String action) {
        if (state != EditSessionState.OPERATION) {
            throw new IllegalStateException(action + " requires an open operation (current: " + state + ")");
        }
    }
}
