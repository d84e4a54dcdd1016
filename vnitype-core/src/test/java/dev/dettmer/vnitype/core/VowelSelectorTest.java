package dev.dettmer.vnitype.core;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static dev.dettmer.vnitype.core.BufferFixtures.bufferOf;
import static org.junit.Assert.*;

/**
 * Unit tests for {@link VowelSelector}.
 */
@RunWith(JUnit4.class)
public class VowelSelectorTest {

    private final VowelSelector selector = new VowelSelector();

    private VowelSelector.Selection select(String text) {
        return selector.select(bufferOf(text));
    }

    // ----- Marked vowels -----

    @Test
    public void hornedOBeatsEarlierHornedU() {
        assertEquals(new VowelSelector.Selection('ơ', 3), select("thương"));
    }

    @Test
    public void markedVowelBeatsHigherRankedPlainVowel() {
        assertEquals(new VowelSelector.Selection('ê', 2), select("tiên"));
    }

    @Test
    public void lastMarkedVowelWins() {
        assertEquals(new VowelSelector.Selection('ê', 1), select("ưê"));
    }

    // ----- Clusters -----

    @Test
    public void oClusterPutsToneOnFollower() {
        assertEquals(new VowelSelector.Selection('a', 2), select("hoa"));
        assertEquals(new VowelSelector.Selection('A', 2), select("HOA"));
        assertEquals(new VowelSelector.Selection('e', 3), select("khoe"));
    }

    @Test
    public void oClusterSeesThroughExistingTone() {
        assertEquals(new VowelSelector.Selection('a', 2), select("hoá"));
    }

    @Test
    public void giPutsToneOnThirdLetter() {
        assertEquals(new VowelSelector.Selection('a', 2), select("gia"));
    }

    @Test
    public void shortGiFallsBackToRanking() {
        assertEquals(new VowelSelector.Selection('i', 1), select("gi"));
    }

    // ----- Ranking -----

    @Test
    public void higherRankWins() {
        assertEquals(new VowelSelector.Selection('a', 1), select("mai"));
        assertEquals(new VowelSelector.Selection('u', 1), select("tuy"));
    }

    @Test
    public void earliestWinsOnTie() {
        assertEquals(new VowelSelector.Selection('a', 0), select("anna"));
    }

    @Test
    public void tonedVowelIsReturnedToneless() {
        assertEquals(new VowelSelector.Selection('a', 1), select("há"));
    }

    @Test
    public void noVowelGivesNull() {
        assertNull(select("bcd"));
        assertNull(select(""));
    }
}
