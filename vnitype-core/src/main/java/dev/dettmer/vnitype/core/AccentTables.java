package dev.dettmer.vnitype.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The five tone tables.
 *
 * <p>Each table maps the twelve toneless vowels, lower and upper case, to
 * the same vowel carrying one tone mark. Tables are built once and never
 * mutated.</p>
 */
final class AccentTables {

    /** Toneless vowels, in the column order of the rows below. */
    static final String TONELESS = "aăâeêioôơuưyAĂÂEÊIOÔƠUƯY";

    static final Map<Character, Character> ACUTE =
            table("áắấéếíóốớúứýÁẮẤÉẾÍÓỐỚÚỨÝ");
    static final Map<Character, Character> GRAVE =
            table("àằầèềìòồờùừỳÀẰẦÈỀÌÒỒỜÙỪỲ");
    static final Map<Character, Character> HOOK_ABOVE =
            table("ảẳẩẻểỉỏổởủửỷẢẲẨẺỂỈỎỔỞỦỬỶ");
    static final Map<Character, Character> TILDE =
            table("ãẵẫẽễĩõỗỡũữỹÃẴẪẼỄĨÕỖỠŨỮỸ");
    static final Map<Character, Character> DOT =
            table("ạặậẹệịọộợụựỵẠẶẬẸỆỊỌỘỢỤỰỴ");

    private AccentTables() {
    }

    private static Map<Character, Character> table(String toned) {
        if (toned.length() != TONELESS.length()) {
            throw new IllegalStateException("Tone row has " + toned.length()
                    + " entries, expected " + TONELESS.length());
        }
        Map<Character, Character> map = new HashMap<>();
        for (int i = 0; i < TONELESS.length(); i++) {
            map.put(TONELESS.charAt(i), toned.charAt(i));
        }
        return Collections.unmodifiableMap(map);
    }
}
