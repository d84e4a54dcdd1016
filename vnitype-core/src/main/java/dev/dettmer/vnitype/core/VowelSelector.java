package dev.dettmer.vnitype.core;

/**
 * Picks the vowel a tone mark attaches to.
 *
 * <p>Rules, highest precedence first:</p>
 * <ol>
 *   <li>{@code ơ} wins outright; the first one found is returned.</li>
 *   <li>Otherwise the last vowel carrying a circumflex, breve or horn
 *       ({@code ê â ô ă ư}).</li>
 *   <li>{@code o} followed by {@code a e o y} puts the tone on the follower
 *       ("hoà", "khoẻ", "xoóng", "hoỳ"), returning as soon as it is seen.</li>
 *   <li>{@code gi} followed by anything puts the tone on the third letter
 *       ("giá"), returning as soon as it is seen.</li>
 *   <li>Otherwise the plain vowel ranked highest in a &gt; e &gt; i &gt; o
 *       &gt; u &gt; y, earliest on ties.</li>
 * </ol>
 *
 * <p>Rules 3 and 4 return during the scan, so they beat a rule 2 vowel that
 * only appears later in the word.</p>
 */
public final class VowelSelector {

    /**
     * A selected vowel: the tone-stripped character and its buffer index.
     */
    public static final class Selection {

        /** Selected character with its tone removed. */
        public final char vowel;

        /** Position of the vowel in the buffer. */
        public final int index;

        public Selection(char vowel, int index) {
            this.vowel = vowel;
            this.index = index;
        }

        @Override
        public String toString() {
            return "Selection{vowel='" + vowel + "', index=" + index + "}";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Selection)) return false;
            Selection that = (Selection) o;
            return vowel == that.vowel && index == that.index;
        }

        @Override
        public int hashCode() {
            return 31 * Character.hashCode(vowel) + index;
        }
    }

    private static final String MARKED_VOWELS = "êâôăưÊÂÔĂƯ";
    private static final String PAIRS_WITH_O = "aeoyAEOY";

    /**
     * Select the tone position in {@code buffer}.
     *
     * @return the selection, or null if the buffer has no vowel to carry a tone
     */
    public Selection select(CompositionBuffer buffer) {
        int length = buffer.length();
        Selection marked = null;
        int bestRank = -1;
        int bestIndex = -1;

        for (int i = 0; i < length; i++) {
            char ch = VietChars.stripTone(buffer.charAt(i));
            boolean hasNext = i + 1 < length;

            if (ch == 'ơ' || ch == 'Ơ') {
                return new Selection(ch, i);
            } else if (MARKED_VOWELS.indexOf(ch) >= 0) {
                marked = new Selection(ch, i);
            } else if ((ch == 'o' || ch == 'O') && hasNext
                    && PAIRS_WITH_O.indexOf(VietChars.stripTone(buffer.charAt(i + 1))) >= 0) {
                return new Selection(VietChars.stripTone(buffer.charAt(i + 1)), i + 1);
            } else if ((ch == 'g' || ch == 'G') && i + 2 < length) {
                char next = VietChars.stripTone(buffer.charAt(i + 1));
                if (next == 'i' || next == 'I') {
                    return new Selection(VietChars.stripTone(buffer.charAt(i + 2)), i + 2);
                }
            } else {
                int rank = rank(ch);
                if (rank > bestRank) {
                    bestRank = rank;
                    bestIndex = i;
                }
            }
        }

        if (marked != null) {
            return marked;
        }
        if (bestIndex >= 0) {
            return new Selection(VietChars.stripTone(buffer.charAt(bestIndex)), bestIndex);
        }
        return null;
    }

    // a=5 e=4 i=3 o=2 u=1 y=0, -1 for anything else
    private static int rank(char ch) {
        switch (Character.toLowerCase(ch)) {
            case 'a': return 5;
            case 'e': return 4;
            case 'i': return 3;
            case 'o': return 2;
            case 'u': return 1;
            case 'y': return 0;
            default: return -1;
        }
    }
}
