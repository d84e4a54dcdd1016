package dev.dettmer.vnitype.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a single-position buffer rewrite into backspace/insert operations.
 *
 * <p>The host field cannot be edited in the middle, so a rewrite at
 * {@code index} deletes everything from {@code index} to the end of the word
 * and retypes the new character followed by the unchanged suffix.</p>
 *
 * <p>On the first edit of a trigger, and when the host commits trigger keys
 * to the field before the engine sees them, one extra character is deleted:
 * the trigger digit itself.</p>
 */
public final class EditSynthesizer {

    private final boolean hostCommitsTriggerKey;

    /**
     * @param hostCommitsTriggerKey true if the trigger digit is already in the
     *                              host field when operations are applied
     */
    public EditSynthesizer(boolean hostCommitsTriggerKey) {
        this.hostCommitsTriggerKey = hostCommitsTriggerKey;
    }

    /**
     * Compute the operations for replacing {@code buffer[index]} with
     * {@code newChar}. The buffer is not modified.
     *
     * @param buffer    Buffer before the rewrite
     * @param index     Position being rewritten
     * @param newChar   Replacement character
     * @param firstEdit True for the first rewrite caused by a trigger key
     * @return delete, insert of {@code newChar}, inserts of the suffix
     */
    public List<EditOperation> synthesize(CompositionBuffer buffer, int index,
                                          char newChar, boolean firstEdit) {
        int length = buffer.length();
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index " + index + " outside buffer of length " + length);
        }

        int deleteCount = length - index;
        if (firstEdit && hostCommitsTriggerKey) {
            deleteCount++;
        }

        List<EditOperation> ops = new ArrayList<>(2 + length - index - 1);
        ops.add(EditOperation.delete(deleteCount));
        ops.add(EditOperation.insert(newChar));
        for (int i = index + 1; i < length; i++) {
            ops.add(EditOperation.insert(buffer.charAt(i)));
        }
        return ops;
    }

    /**
     * Synthesize the operations for a rewrite, then apply it to the buffer.
     * The buffer length does not change.
     */
    public List<EditOperation> rewrite(CompositionBuffer buffer, int index,
                                       char newChar, boolean firstEdit) {
        List<EditOperation> ops = synthesize(buffer, index, newChar, firstEdit);
        buffer.set(index, newChar);
        return ops;
    }
}
