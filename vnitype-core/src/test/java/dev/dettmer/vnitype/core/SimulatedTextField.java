package dev.dettmer.vnitype.core;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory stand-in for a host text field.
 *
 * <p>Behaves like a host that commits every key to the field first and then
 * applies the engine's operations, with the cursor always at the end.</p>
 */
final class SimulatedTextField implements VniTypeAdapter {

    private final StringBuilder text = new StringBuilder();
    final List<VniTypeError> errors = new ArrayList<>();

    /** Commit the raw key the way a host does before the engine runs. */
    void commit(LogicalKey key) {
        if (!key.isPress()) return;
        if (key.backspace) {
            if (text.length() > 0) text.setLength(text.length() - 1);
        } else if (key.hasCharacter() && !key.navigation) {
            text.append(key.shifted ? Character.toUpperCase(key.character) : key.character);
        }
    }

    /** Commit the key, run it through the engine, apply the returned operations. */
    void type(VniEngine engine, LogicalKey key) {
        commit(key);
        apply(engine.handleKey(key));
    }

    /** Type a string; spaces are whitespace keys, everything else a plain press. */
    void typeAll(VniEngine engine, String keys) {
        for (int i = 0; i < keys.length(); i++) {
            char c = keys.charAt(i);
            type(engine, c == ' ' ? LogicalKey.whitespace(c) : LogicalKey.press(c));
        }
    }

    void apply(List<EditOperation> ops) {
        for (EditOperation op : ops) {
            boolean ok = op.isDelete() ? deleteBeforeCursor(op.count) : insert(op.character);
            if (!ok) throw new AssertionError("Field rejected " + op + " on \"" + text + "\"");
        }
    }

    @Override
    public boolean deleteBeforeCursor(int count) {
        if (count > text.length()) return false;
        text.setLength(text.length() - count);
        return true;
    }

    @Override
    public boolean insert(char character) {
        text.append(character);
        return true;
    }

    @Override
    public void onError(VniTypeError error) {
        errors.add(error);
    }

    String text() {
        return text.toString();
    }
}
