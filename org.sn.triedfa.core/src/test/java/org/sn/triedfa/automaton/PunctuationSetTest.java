package org.sn.triedfa.automaton;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.sn.triedfa.testutils.TestUtil.assertExceptionFromCallable;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.sn.triedfa.testutils.TestBase;


public class PunctuationSetTest extends TestBase {
    @ParameterizedTest
    @ValueSource(chars = { '!', '"', '#', '$', '%', '&', '\'', '(', ')', '*', '+', ',', '-', '.', '/', ':',
                           ';', '<', '=', '>', '?', '@', '[', '\\', ']', '^', '_', '`', '{', '|', '}', '~' })
    void testAsciiContainsPunctuation(char symbol) {
        assertTrue(PunctuationSet.ascii().contains(symbol));
        assertFalse(PunctuationSet.none().contains(symbol));
    }

    @ParameterizedTest
    @ValueSource(chars = { 'a', 'Z', '0', ' ', '\t', '\n', '\u00e9', '\u00bf' })
    void testAsciiExcludesOtherSymbols(char symbol) {
        assertFalse(PunctuationSet.ascii().contains(symbol));
    }

    @Test
    void testSize() {
        assertEquals(32, PunctuationSet.ascii().size());
        assertEquals(0, PunctuationSet.none().size());
        assertEquals(2, PunctuationSet.of("..!").size());
        assertEquals(0, PunctuationSet.of("").size());
    }

    @Test
    void testUnion() {
        PunctuationSet spaces = PunctuationSet.of(" \t");
        PunctuationSet union = PunctuationSet.ascii().union(spaces);
        assertEquals(34, union.size());
        assertTrue(union.contains(' '));
        assertTrue(union.contains('!'));
        assertEquals(spaces, spaces.union(PunctuationSet.none()));
    }

    @Test
    void testEqualsAndToString() {
        assertEquals(PunctuationSet.of("?!."), PunctuationSet.of(".!?"));
        assertEquals(PunctuationSet.of("?!.").hashCode(), PunctuationSet.of(".!?").hashCode());
        assertNotEquals(PunctuationSet.of("?!."), PunctuationSet.of("?!"));
        assertNotEquals(PunctuationSet.none(), "");
        assertEquals("PunctuationSet[!.?]", PunctuationSet.of("?!.").toString());
        assertEquals("PunctuationSet[]", PunctuationSet.none().toString());
    }

    @Test
    void testNull() {
        assertExceptionFromCallable(() -> PunctuationSet.of(null), NullPointerException.class);
        assertExceptionFromCallable(() -> PunctuationSet.ascii().union(null), NullPointerException.class);
    }
}
