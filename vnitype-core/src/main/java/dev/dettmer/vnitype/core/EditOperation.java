package dev.dettmer.vnitype.core;

/**
 * A single edit against the host text field.
 *
 * <p>Either "delete {@link #count} characters immediately before the cursor"
 * or "insert {@link #character} at the cursor". The operations produced for
 * one key event must be applied in order.</p>
 *
 * <p>This is an immutable value type.</p>
 */
public final class EditOperation {

    /** Kind of edit. */
    public enum Type {
        /** Delete characters before the cursor. */
        DELETE,
        /** Insert one character at the cursor. */
        INSERT
    }

    public final Type type;

    /** Number of characters to delete. 0 for inserts. */
    public final int count;

    /** Character to insert. {@link LogicalKey#NO_CHAR} for deletes. */
    public final char character;

    private EditOperation(Type type, int count, char character) {
        this.type = type;
        this.count = count;
        this.character = character;
    }

    /**
     * @param count Characters to delete, at least 1
     * @return a delete operation
     */
    public static EditOperation delete(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Delete count must be positive: " + count);
        }
        return new EditOperation(Type.DELETE, count, LogicalKey.NO_CHAR);
    }

    /**
     * @param character Character to insert
     * @return an insert operation
     */
    public static EditOperation insert(char character) {
        return new EditOperation(Type.INSERT, 0, character);
    }

    public boolean isDelete() {
        return type == Type.DELETE;
    }

    public boolean isInsert() {
        return type == Type.INSERT;
    }

    @Override
    public String toString() {
        return isDelete() ? "Delete(" + count + ")" : "Insert('" + character + "')";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EditOperation)) return false;
        EditOperation that = (EditOperation) o;
        return type == that.type && count == that.count && character == that.character;
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();
        result = 31 * result + count;
        result = 31 * result + Character.hashCode(character);
        return result;
    }
}
