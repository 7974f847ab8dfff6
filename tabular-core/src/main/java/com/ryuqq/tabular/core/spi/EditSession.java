package com.ryuqq.tabular.core.spi;

import com.ryuqq.tabular.core.session.EditSessionState;

/**
 * Edit Session SPI: the transaction primitive of a tabular store.
 *
 * <p>An edit session brackets a group of writes. Inside it, an edit operation is the
 * unit that can be undone with {@link #abortOperation()}.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * startEditing()   CLOSED    → EDITING
 * startOperation() EDITING   → OPERATION
 * stopOperation()  OPERATION → EDITING   (keep the operation's writes)
 * abortOperation() OPERATION → EDITING   (undo the operation's writes)
 * stopEditing(s)   *         → CLOSED    (save or discard every write of the session)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>At most one open operation; nesting is an {@link IllegalStateException}</li>
 *   <li>Transitions are validated with {@link com.ryuqq.tabular.core.session.SessionTransition}</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public interface EditSession {

    /**
     * @return the workspace this session edits
     */
    String workspace();

    /**
     * Opens the session.
     *
     * @throws IllegalStateException if the session is already editing
     */
    void startEditing();

    /**
     * Opens an edit operation.
     *
     * @throws IllegalStateException if the session is not editing or an operation is open
     */
    void startOperation();

    /**
     * Closes the current operation, keeping its writes.
     *
     * @throws IllegalStateException if no operation is open
     */
    void stopOperation();

    /**
     * Closes the current operation, undoing its writes.
     *
     * @throws IllegalStateException if no operation is open
     */
    void abortOperation();

    /**
     * Closes the session.
     *
     * @param save true to persist the session's writes, false to discard them
     * @throws IllegalStateException if the session is not editing
     */
    void stopEditing(boolean save);

    /**
     * @return the current state
     */
    EditSessionState state();

    default boolean isEditing() {
        return state().isEditing();
    }

    default boolean isOperationOpen() {
        return state() == EditSessionState.OPERATION;
    }
}
