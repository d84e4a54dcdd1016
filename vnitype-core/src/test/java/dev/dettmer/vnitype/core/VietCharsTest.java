package dev.dettmer.vnitype.core;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link VietChars}.
 */
@RunWith(JUnit4.class)
public class VietCharsTest {

    @Test
    public void stripToneKeepsShapeDiacritics() {
        assertEquals('ê', VietChars.stripTone('ế'));
        assertEquals('ơ', VietChars.stripTone('ợ'));
        assertEquals('Ă', VietChars.stripTone('Ắ'));
        assertEquals('ư', VietChars.stripTone('ữ'));
    }

    @Test
    public void stripToneLeavesToneless() {
        assertEquals('a', VietChars.stripTone('a'));
        assertEquals('â', VietChars.stripTone('â'));
        assertEquals('đ', VietChars.stripTone('đ'));
        assertEquals('7', VietChars.stripTone('7'));
    }

    @Test
    public void stripToneOnPlainTonedVowel() {
        assertEquals('a', VietChars.stripTone('à'));
        assertEquals('Y', VietChars.stripTone('Ỹ'));
    }

    @Test
    public void stripAllGivesBareLetter() {
        assertEquals('u', VietChars.stripAll('ự'));
        assertEquals('A', VietChars.stripAll('Ấ'));
        assertEquals('o', VietChars.stripAll('ơ'));
        assertEquals('D', VietChars.stripAll('Đ'));
        assertEquals('d', VietChars.stripAll('đ'));
    }

    @Test
    public void foldLowerCases() {
        assertEquals('u', VietChars.fold('Ư'));
        assertEquals('q', VietChars.fold('Q'));
    }
}
