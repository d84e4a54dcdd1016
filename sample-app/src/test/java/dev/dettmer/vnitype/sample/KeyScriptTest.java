package dev.dettmer.vnitype.sample;

import dev.dettmer.vnitype.core.LogicalKey;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link KeyScript}.
 */
@RunWith(JUnit4.class)
public class KeyScriptTest {

    @Test
    public void plainCharactersAndSpace() {
        List<LogicalKey> keys = KeyScript.parse("a1 b");
        assertEquals(4, keys.size());
        assertEquals(LogicalKey.press('a'), keys.get(0));
        assertEquals(LogicalKey.press('1'), keys.get(1));
        assertTrue(keys.get(2).whitespace);
        assertEquals(LogicalKey.press('b'), keys.get(3));
    }

    @Test
    public void namedKeys() {
        List<LogicalKey> keys = KeyScript.parse("x<BS><left><ENTER><Tab>");
        assertEquals(5, keys.size());
        assertTrue(keys.get(1).backspace);
        assertTrue(keys.get(2).navigation);
        assertTrue(keys.get(3).whitespace);
        assertEquals('\t', keys.get(4).character);
    }

    @Test
    public void unknownTokenIsLiteral() {
        List<LogicalKey> keys = KeyScript.parse("<b>");
        assertEquals(3, keys.size());
        assertEquals(LogicalKey.press('<'), keys.get(0));
        assertEquals(LogicalKey.press('>'), keys.get(2));
    }

    @Test
    public void unclosedBracketIsLiteral() {
        assertEquals(3, KeyScript.parse("<BS").size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullLineThrows() {
        KeyScript.parse(null);
    }
}
