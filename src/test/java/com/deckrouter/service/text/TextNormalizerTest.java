package com.deckrouter.service.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TextNormalizer.
 */
class TextNormalizerTest {

    @Test
    void testNormalize() {
        assertEquals("usina angra1", TextNormalizer.normalize("  Usina   Angra-1 "));
        assertEquals("cubatao", TextNormalizer.normalize("CUBATÃO"));
        assertEquals("sao jose do rio preto", TextNormalizer.normalize("São José do Rio Preto!"));
        assertEquals("", TextNormalizer.normalize(null));
        assertEquals("", TextNormalizer.normalize("   "));
    }

    @Test
    void testFoldKeepsPunctuation() {
        assertEquals("st.cruz nova", TextNormalizer.fold("ST.CRUZ NOVA"));
        assertEquals("potencia minima?", TextNormalizer.fold("Potência Mínima?"));
    }

    @Test
    void testStripDiacritics() {
        assertEquals("Inflexibilidade media da usina Piratininga", TextNormalizer.stripDiacritics("Inflexibilidade média da usina Piratininga"));
        assertEquals("acao", TextNormalizer.stripDiacritics("ação"));
    }

    @Test
    void testStripPunctuation() {
        assertEquals("Qual o CVU de Angra 1", TextNormalizer.stripPunctuation("Qual o CVU de Angra 1?"));
        assertEquals("a-b", TextNormalizer.stripPunctuation("a-b;"));
    }

    @Test
    void testContainsWholeWords() {
        assertTrue(TextNormalizer.containsWholeWords("usina de santa clara", "santa clara"));
        assertFalse(TextNormalizer.containsWholeWords("usina de santa clara", "anta"));
        assertTrue(TextNormalizer.containsWholeWords("angra 1", "angra 1"));
        assertFalse(TextNormalizer.containsWholeWords("angra 12", "angra 1"));
        assertTrue(TextNormalizer.containsWholeWords("cvu de são paulo?", "são paulo"));
        assertFalse(TextNormalizer.containsWholeWords("anything", ""));
    }

    @Test
    void testReplaceWholeWords() {
        assertEquals("cvu de santa cruz nova",
                TextNormalizer.replaceWholeWords("cvu de st.cruz nova", "st.cruz nova", "santa cruz nova"));
        assertEquals("termopernambuco", TextNormalizer.replaceWholeWords("termopernambuco", "termope", "x"));
        assertEquals("custo $1", TextNormalizer.replaceWholeWords("custo x", "x", "$1"));
    }

    @Test
    void testTokens() {
        assertEquals(List.of("cvu", "de", "angra", "1"), TextNormalizer.tokens("CVU de Angra 1?"));
        assertTrue(TextNormalizer.tokens("  ").isEmpty());
    }
}
