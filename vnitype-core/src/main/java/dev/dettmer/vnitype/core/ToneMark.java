package dev.dettmer.vnitype.core;

import java.util.Map;

/**
 * Tone marks and their VNI trigger digits.
 */
public enum ToneMark {

    /** Sắc. */
    ACUTE('1', AccentTables.ACUTE),

    /** Huyền. */
    GRAVE('2', AccentTables.GRAVE),

    /** Hỏi. */
    HOOK_ABOVE('3', AccentTables.HOOK_ABOVE),

    /** Ngã. */
    TILDE('4', AccentTables.TILDE),

    /** Nặng. */
    DOT('5', AccentTables.DOT);

    /** Returned by {@link #apply(char)} when the table has no entry. */
    public static final char NO_MAPPING = LogicalKey.NO_CHAR;

    /** Digit that fires this tone. */
    public final char trigger;

    private final Map<Character, Character> table;

    ToneMark(char trigger, Map<Character, Character> table) {
        this.trigger = trigger;
        this.table = table;
    }

    /**
     * Add this tone to a toneless vowel.
     *
     * @param toneless A vowel without tone, possibly with circumflex, breve or horn
     * @return the toned vowel, or {@link #NO_MAPPING} if {@code toneless} is not a vowel
     */
    public char apply(char toneless) {
        Character toned = table.get(toneless);
        return toned != null ? toned : NO_MAPPING;
    }

    /**
     * Look up a ToneMark by its trigger digit.
     *
     * @return matching tone, or null if {@code trigger} fires no tone
     */
    public static ToneMark fromTrigger(char trigger) {
        for (ToneMark t : values()) {
            if (t.trigger == trigger) return t;
        }
        return null;
    }
}
