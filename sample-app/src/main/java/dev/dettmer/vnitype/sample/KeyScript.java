package dev.dettmer.vnitype.sample;

import dev.dettmer.vnitype.core.LogicalKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses a line of text into key presses.
 *
 * <p>Ordinary characters are character keys and a space is a whitespace key.
 * Named keys are written in angle brackets: {@code <BS>}, {@code <LEFT>},
 * {@code <RIGHT>}, {@code <UP>}, {@code <DOWN>}, {@code <ENTER>},
 * {@code <TAB>}. An unknown bracket token is typed as literal characters.</p>
 *
 * <pre>
 *   "Vie65t Nam"    Việt Nam
 *   "tiex&lt;BS&gt;61ng" tiếng
 * </pre>
 */
public final class KeyScript {

    private KeyScript() {
    }

    /**
     * @param line Script line. Must not be null.
     * @return key presses in typing order
     */
    public static List<LogicalKey> parse(String line) {
        if (line == null) {
            throw new IllegalArgumentException("Key script must not be null");
        }
        List<LogicalKey> keys = new ArrayList<>(line.length());
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '<') {
                int end = line.indexOf('>', i + 1);
                if (end > i) {
                    LogicalKey named = namedKey(line.substring(i + 1, end));
                    if (named != null) {
                        keys.add(named);
                        i = end + 1;
                        continue;
                    }
                }
            }
            keys.add(Character.isWhitespace(c) ? LogicalKey.whitespace(c) : LogicalKey.press(c));
            i++;
        }
        return keys;
    }

    private static LogicalKey namedKey(String name) {
        switch (name.toUpperCase(Locale.ROOT)) {
            case "BS":
                return LogicalKey.backspace();
            case "LEFT":
            case "RIGHT":
            case "UP":
            case "DOWN":
                return LogicalKey.navigation();
            case "ENTER":
                return LogicalKey.whitespace('\n');
            case "TAB":
                return LogicalKey.whitespace('\t');
            default:
                return null;
        }
    }
}
