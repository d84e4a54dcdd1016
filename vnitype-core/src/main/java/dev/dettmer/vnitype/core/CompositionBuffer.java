package dev.dettmer.vnitype.core;

import java.util.ArrayList;
import java.util.List;

/**
 * The word currently being composed.
 *
 * <p>Holds exactly the characters typed since the last reset (whitespace,
 * navigation or {@link #clear()}), minus those removed by backspace. The
 * sequence only grows or shrinks at its tail; trigger keys rewrite
 * characters in place with {@link #set(int, char)}.</p>
 *
 * <p>Not thread-safe. Owned by a single {@link VniEngine}.</p>
 */
public final class CompositionBuffer {

    private final List<Character> chars = new ArrayList<>();

    public void append(char c) {
        chars.add(c);
    }

    /**
     * Remove the last character.
     *
     * @return true if a character was removed, false if the buffer was empty
     */
    public boolean pop() {
        if (chars.isEmpty()) return false;
        chars.remove(chars.size() - 1);
        return true;
    }

    public void clear() {
        chars.clear();
    }

    /**
     * Replace the character at {@code index} without changing the length.
     *
     * @throws IndexOutOfBoundsException if index is outside the buffer
     */
    public void set(int index, char c) {
        chars.set(index, c);
    }

    public char charAt(int index) {
        return chars.get(index);
    }

    public int length() {
        return chars.size();
    }

    public boolean isEmpty() {
        return chars.isEmpty();
    }

    /** @return the buffer contents as a string. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(chars.size());
        for (char c : chars) {
            sb.append(c);
        }
        return sb.toString();
    }
}
