package dev.dettmer.vnitype.core;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Case and accent folding for Vietnamese letters.
 */
public final class VietChars {

    // grave, acute, tilde, hook above, dot below
    private static final Pattern TONE_PATTERN = Pattern.compile("[\\u0300\\u0301\\u0303\\u0309\\u0323]");
    private static final Pattern MARK_PATTERN = Pattern.compile("\\p{M}");

    private VietChars() {
    }

    /**
     * Remove the tone mark from a character, keeping circumflex, breve and
     * horn. {@code 'ế'} becomes {@code 'ê'}, {@code 'Ợ'} becomes {@code 'Ơ'}.
     * Characters without a tone are returned unchanged.
     */
    public static char stripTone(char c) {
        if (c < 0x80) return c;
        String decomposed = Normalizer.normalize(String.valueOf(c), Normalizer.Form.NFD);
        String toneless = TONE_PATTERN.matcher(decomposed).replaceAll("");
        String recomposed = Normalizer.normalize(toneless, Normalizer.Form.NFC);
        return recomposed.length() == 1 ? recomposed.charAt(0) : c;
    }

    /**
     * Remove every mark from a character and fold the crossed d, giving the
     * bare Latin letter: {@code 'ự'} becomes {@code 'u'}, {@code 'Đ'}
     * becomes {@code 'D'}. Case is preserved.
     */
    public static char stripAll(char c) {
        if (c < 0x80) return c;
        if (c == 'đ') return 'd';
        if (c == 'Đ') return 'D';
        String decomposed = Normalizer.normalize(String.valueOf(c), Normalizer.Form.NFD);
        String bare = MARK_PATTERN.matcher(decomposed).replaceAll("");
        return bare.length() == 1 ? bare.charAt(0) : c;
    }

    /** @return the accent-stripped, lower-cased form used for rule matching. */
    public static char fold(char c) {
        return Character.toLowerCase(stripAll(c));
    }
}
