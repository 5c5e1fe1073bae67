package com.deckrouter.service.routing;

import com.deckrouter.config.DeckRouterProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QueryExpander.
 */
class QueryExpanderTest {

    private static final List<SynonymRule> CVU_RULES = List.of(
            new SynonymRule("\\bcvu\\b", List.of("custo variável unitário", "custo operacional")));

    @Test
    void testSynonymVariantsFollowOriginal() {
        String expanded = QueryExpander.expand("Qual o CVU?", CVU_RULES);

        assertEquals("Qual o CVU? qual o custo variável unitário? qual o custo operacional? Qual o CVU", expanded);
    }

    @Test
    void testAccentFreeVariant() {
        assertEquals("potência mínima potencia minima", QueryExpander.expand("potência mínima", List.of()));
    }

    @Test
    void testVariantsAreDeduplicatedIgnoringCase() {
        List<SynonymRule> rules = List.of(new SynonymRule("\\bmostre\\b", List.of("MOSTRE", "me dê")));

        assertEquals("mostre dados me dê dados", QueryExpander.expand("mostre dados", rules));
    }

    @Test
    void testUnmatchedQueryIsUnchanged() {
        assertEquals("carga", QueryExpander.expand("carga", CVU_RULES));
    }

    @Test
    void testWordBoundariesRespectAccents() {
        List<SynonymRule> rules = List.of(new SynonymRule("\\btérmica\\b", List.of("ute")));

        String expanded = QueryExpander.expand("termoelétrica térmicas", rules);

        assertEquals("termoelétrica térmicas termoeletrica termicas", expanded);
    }

    @Test
    void testExpansionIsDeterministic() {
        QueryExpander expander = new QueryExpander(CVU_RULES, true);

        assertEquals(expander.expand("cvu de angra 1, patamar pesada"), expander.expand("cvu de angra 1, patamar pesada"));
    }

    @Test
    void testDisabledExpansionReturnsQuery() {
        QueryExpander expander = new QueryExpander(CVU_RULES, false);

        assertEquals("Qual o CVU?", expander.expand("Qual o CVU?"));
        assertFalse(expander.isEnabled());
    }

    @Test
    void testLoadsBundledRules() {
        DeckRouterProperties properties = new DeckRouterProperties();
        QueryExpander expander = new QueryExpander(new DefaultResourceLoader(), new ObjectMapper(), properties);

        assertFalse(expander.getRules().isEmpty());
        assertEquals("\\bme dê\\b", expander.getRules().get(0).getPattern().pattern());

        String expanded = expander.expand("qual o cvu?");
        assertTrue(expanded.startsWith("qual o cvu?"));
        assertTrue(expanded.contains("custo variável unitário"));
    }

    @Test
    void testMissingRulesFile() {
        DeckRouterProperties properties = new DeckRouterProperties();
        properties.getRouting().setExpansionsLocation("classpath:routing/does-not-exist.json");

        QueryExpander expander = new QueryExpander(new DefaultResourceLoader(), new ObjectMapper(), properties);

        assertTrue(expander.getRules().isEmpty());
        assertEquals("carga", expander.expand("carga"));
    }
}
