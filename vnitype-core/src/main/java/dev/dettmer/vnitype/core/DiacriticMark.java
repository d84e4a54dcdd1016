package dev.dettmer.vnitype.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Shape diacritics and the crossed d, with their VNI trigger digits and
 * pairing rules.
 */
public enum DiacriticMark {

    CIRCUMFLEX('6',
            new DiacriticRule('a', "unmptcy", 'â', 'Â'),
            new DiacriticRule('e', "unmptcy", 'ê', 'Ê'),
            new DiacriticRule('o', "inmptcy", 'ô', 'Ô')),

    HORN('7',
            new DiacriticRule('u', "oinmaptc", 'ư', 'Ư'),
            new DiacriticRule('o', "inmptcy", 'ơ', 'Ơ')),

    BREVE('8',
            new DiacriticRule('a', "pnmtc", 'ă', 'Ă')),

    CROSSED_D('9',
            new DiacriticRule('d', "aceimnoptuy", 'đ', 'Đ'));

    /** Digit that fires this mark. */
    public final char trigger;

    /** Rules tried at every buffer position, in order. */
    public final List<DiacriticRule> rules;

    DiacriticMark(char trigger, DiacriticRule... rules) {
        this.trigger = trigger;
        this.rules = Collections.unmodifiableList(Arrays.asList(rules));
    }

    /**
     * Look up a DiacriticMark by its trigger digit.
     *
     * @return matching mark, or null if {@code trigger} fires no diacritic
     */
    public static DiacriticMark fromTrigger(char trigger) {
        for (DiacriticMark m : values()) {
            if (m.trigger == trigger) return m;
        }
        return null;
    }
}
