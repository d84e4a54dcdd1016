package dev.dettmer.vnitype.core;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Pairs a base letter with the letters allowed to follow it and the
 * letter it turns into.
 *
 * <p>{@code a} with followers {@code u n m p t c y} and replacement
 * {@code â/Â} turns "au" into "âu" but leaves "aq" alone. A base letter at
 * the end of the buffer always matches.</p>
 *
 * <p>This is an immutable value type.</p>
 */
public final class DiacriticRule {

    /** Lower-case, accent-stripped letter to match. */
    public final char base;

    /** Lower-case, accent-stripped letters that may follow {@link #base}. */
    public final Set<Character> followers;

    /** Replacement when the matched character is lower case. */
    public final char lower;

    /** Replacement when the matched character is upper case. */
    public final char upper;

    /**
     * @param base      Letter to match, lower case
     * @param followers Permitted following letters, lower case
     * @param lower     Lower-case replacement
     * @param upper     Upper-case replacement
     */
    public DiacriticRule(char base, String followers, char lower, char upper) {
        this.base = base;
        Set<Character> set = new HashSet<>();
        for (int i = 0; i < followers.length(); i++) {
            set.add(followers.charAt(i));
        }
        this.followers = Collections.unmodifiableSet(set);
        this.lower = lower;
        this.upper = upper;
    }

    /** @return true if {@code folded} is the base letter of this rule. */
    public boolean matchesBase(char folded) {
        return base == folded;
    }

    /** @return true if {@code folded} may follow the base letter. */
    public boolean acceptsFollower(char folded) {
        return followers.contains(folded);
    }

    /** @return the replacement in the case of {@code original}. */
    public char replacementFor(char original) {
        return Character.isUpperCase(original) ? upper : lower;
    }

    @Override
    public String toString() {
        return "DiacriticRule{" + base + " -> " + lower + "/" + upper + ", followers=" + followers + "}";
    }
}
