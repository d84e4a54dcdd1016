package dev.dettmer.vnitype.core;

/**
 * Interface that every host integration must implement.
 *
 * <p>This is the contract between the engine and the text field it keeps in
 * sync. The engine never touches the field directly; it hands each
 * {@link EditOperation} to the adapter in order.</p>
 *
 * <p>Commit contract: unless the engine was built with
 * {@link VniOptions#hostCommitsTriggerKey} set to false, the adapter must have
 * committed the key that caused the edits (trigger digit included) to the
 * field before {@link VniEngine#processKey} delivers them.</p>
 *
 * <p>Lifecycle: the adapter is passed to {@link VniEngine#init} and retained
 * for the lifetime of the engine. All calls happen on the thread that called
 * {@link VniEngine#processKey}.</p>
 */
public interface VniTypeAdapter {

    /**
     * Delete characters immediately before the cursor.
     *
     * @param count Number of characters, at least 1
     * @return true on success, false if the field could not delete them
     */
    boolean deleteBeforeCursor(int count);

    /**
     * Insert one character at the cursor and move the cursor after it.
     *
     * @return true on success, false if the field refused the insert
     */
    boolean insert(char character);

    /**
     * Called when an edit could not be delivered.
     *
     * @param error The error that occurred. Never null.
     */
    void onError(VniTypeError error);
}
