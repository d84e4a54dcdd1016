package dev.dettmer.vnitype.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies circumflex, horn, breve and crossed-d triggers.
 *
 * <p>Scans the buffer left to right. A position matches a rule when its
 * folded letter is the rule's base and the next folded letter is one of the
 * rule's followers, or when it is the last position. Every matching position
 * is rewritten, so "uo" with the horn trigger gives "ươ". Only the first
 * rewrite of a call compensates for the trigger key.</p>
 */
public final class DiacriticMatcher {

    private final EditSynthesizer synthesizer;

    public DiacriticMatcher(EditSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    /**
     * Rewrite every matching position of {@code buffer} in place.
     *
     * @return edit operations for all rewrites, empty if nothing matched
     */
    public List<EditOperation> apply(CompositionBuffer buffer, List<DiacriticRule> rules) {
        List<EditOperation> ops = new ArrayList<>();
        boolean firstEdit = true;
        int length = buffer.length();

        for (int i = 0; i < length; i++) {
            char ch = buffer.charAt(i);
            char folded = VietChars.fold(ch);
            boolean last = i + 1 == length;
            char next = last ? LogicalKey.NO_CHAR : VietChars.fold(buffer.charAt(i + 1));

            for (DiacriticRule rule : rules) {
                if (!rule.matchesBase(folded)) continue;
                if (last || rule.acceptsFollower(next)) {
                    char replacement = rule.replacementFor(ch);
                    ops.addAll(synthesizer.rewrite(buffer, i, replacement, firstEdit));
                    firstEdit = false;
                }
            }
        }
        return ops;
    }
}
