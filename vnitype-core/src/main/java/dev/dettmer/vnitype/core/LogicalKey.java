package dev.dettmer.vnitype.core;

/**
 * A classified keyboard event as delivered by the host's key layer.
 *
 * <p>The host decides which physical keys count as navigation, whitespace or
 * backspace; the engine only reads these flags. Keys that produce no
 * character (pure modifiers, arrows) carry {@link #NO_CHAR}.</p>
 *
 * <p>This is an immutable value type.</p>
 */
public final class LogicalKey {

    /** Sentinel for keys that produce no character. */
    public static final char NO_CHAR = '\0';

    /** Produced character, or {@link #NO_CHAR}. */
    public final char character;

    /** Press or release. */
    public final KeyState state;

    /** True if a case-shifting modifier (Shift, Caps Lock) is active. */
    public final boolean shifted;

    /** Arrow, Home, End and similar keys that move the cursor. */
    public final boolean navigation;

    /** Space, Enter, Tab. */
    public final boolean whitespace;

    /** Backspace. */
    public final boolean backspace;

    /**
     * Create a new logical key.
     *
     * @param character  Produced character, or {@link #NO_CHAR}
     * @param state      Press or release. Must not be null.
     * @param shifted    Case-shifting modifier active
     * @param navigation Key moves the cursor
     * @param whitespace Key is a word separator
     * @param backspace  Key is backspace
     */
    public LogicalKey(char character, KeyState state, boolean shifted,
                      boolean navigation, boolean whitespace, boolean backspace) {
        if (state == null) {
            throw new IllegalArgumentException("KeyState must not be null");
        }
        this.character = character;
        this.state = state;
        this.shifted = shifted;
        this.navigation = navigation;
        this.whitespace = whitespace;
        this.backspace = backspace;
    }

    /** A plain character key press. */
    public static LogicalKey press(char character) {
        return new LogicalKey(character, KeyState.PRESS, false, false, false, false);
    }

    /** A character key press with Shift or Caps Lock active. */
    public static LogicalKey pressShifted(char character) {
        return new LogicalKey(character, KeyState.PRESS, true, false, false, false);
    }

    /** A character key release. */
    public static LogicalKey release(char character) {
        return new LogicalKey(character, KeyState.RELEASE, false, false, false, false);
    }

    /** A whitespace key press producing the given character. */
    public static LogicalKey whitespace(char character) {
        return new LogicalKey(character, KeyState.PRESS, false, false, true, false);
    }

    /** A navigation key press (arrows, Home, End). */
    public static LogicalKey navigation() {
        return new LogicalKey(NO_CHAR, KeyState.PRESS, false, true, false, false);
    }

    /** A backspace press. */
    public static LogicalKey backspace() {
        return new LogicalKey(NO_CHAR, KeyState.PRESS, false, false, false, true);
    }

    /** A press of a key that produces no character, such as a bare modifier. */
    public static LogicalKey modifier() {
        return new LogicalKey(NO_CHAR, KeyState.PRESS, false, false, false, false);
    }

    /** @return true if this is a press transition. */
    public boolean isPress() {
        return state == KeyState.PRESS;
    }

    /** @return true if this key produces a character. */
    public boolean hasCharacter() {
        return character != NO_CHAR;
    }

    @Override
    public String toString() {
        return "LogicalKey{char=" + (hasCharacter() ? "'" + character + "'" : "none")
                + ", state=" + state
                + (shifted ? ", shifted" : "")
                + (navigation ? ", navigation" : "")
                + (whitespace ? ", whitespace" : "")
                + (backspace ? ", backspace" : "")
                + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicalKey)) return false;
        LogicalKey that = (LogicalKey) o;
        return character == that.character
                && state == that.state
                && shifted == that.shifted
                && navigation == that.navigation
                && whitespace == that.whitespace
                && backspace == that.backspace;
    }

    @Override
    public int hashCode() {
        int result = Character.hashCode(character);
        result = 31 * result + state.hashCode();
        result = 31 * result + Boolean.hashCode(shifted);
        result = 31 * result + Boolean.hashCode(navigation);
        result = 31 * result + Boolean.hashCode(whitespace);
        result = 31 * result + Boolean.hashCode(backspace);
        return result;
    }
}
