package dev.dettmer.vnitype.core;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link CompositionBuffer}.
 */
@RunWith(JUnit4.class)
public class CompositionBufferTest {

    private CompositionBuffer buffer;

    @Before
    public void setUp() {
        buffer = new CompositionBuffer();
        buffer.append('v');
        buffer.append('i');
        buffer.append('e');
    }

    @Test
    public void appendKeepsTypingOrder() {
        assertEquals("vie", buffer.toString());
        assertEquals(3, buffer.length());
        assertEquals('i', buffer.charAt(1));
    }

    @Test
    public void popRemovesLast() {
        assertTrue(buffer.pop());
        assertEquals("vi", buffer.toString());
    }

    @Test
    public void popOnEmptyIsNoOp() {
        buffer.clear();
        assertTrue(buffer.isEmpty());
        assertFalse(buffer.pop());
        assertEquals(0, buffer.length());
    }

    @Test
    public void setReplacesInPlace() {
        buffer.set(2, 'ê');
        assertEquals("viê", buffer.toString());
        assertEquals(3, buffer.length());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void setOutsideBufferThrows() {
        buffer.set(3, 'x');
    }
}
