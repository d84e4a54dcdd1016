package dev.dettmer.vnitype.sample;

import dev.dettmer.vnitype.core.VniOptions;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.*;

/**
 * End-to-end typing through {@link SampleConsole}.
 */
@RunWith(JUnit4.class)
public class SampleConsoleTest {

    private SampleConsole console;

    @Before
    public void setUp() {
        console = new SampleConsole(VniOptions.defaults());
    }

    @Test
    public void typesVietnamese() {
        assertEquals("Tiếng Việt", console.typeLine("Tie61ng Vie65t"));
        assertEquals("Trường học", console.typeLine("Tru7o7ng2 ho5c"));
        assertEquals("Đà Nẵng", console.typeLine("D9a2 Na8ng4"));
    }

    @Test
    public void eachLineStartsEmpty() {
        console.typeLine("abc");
        assertEquals("o", console.typeLine("o"));
    }

    @Test
    public void backspaceInsideWord() {
        assertEquals("tiếng", console.typeLine("tiex<BS>61ng"));
    }

    @Test
    public void triggerWithoutMatchStaysLiteral() {
        assertEquals("aq6 b1", console.typeLine("aq6 b1"));
    }

    @Test
    public void navigationEndsComposition() {
        // after <LEFT> the next trigger has no vowel in its composition
        assertEquals("1ba", console.typeLine("ba<LEFT>1"));
    }

    @Test
    public void fieldSuppressingTriggersStaysInSync() {
        SampleConsole suppressing = new SampleConsole(
                VniOptions.builder().hostCommitsTriggerKey(false).build());
        assertEquals("â", suppressing.typeLine("a6"));
        assertEquals("Trường học", suppressing.typeLine("Tru7o7ng2 ho5c"));
        assertEquals("aq6 b1", suppressing.typeLine("aq6 b1"));
    }

    @Test
    public void loadOptionsReadsClasspathFile() {
        assertTrue(SampleConsole.loadOptions().hostCommitsTriggerKey);
    }
}
