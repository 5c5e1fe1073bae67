package com.deckrouter.service.matching;

import com.deckrouter.config.DeckRouterProperties;
import com.deckrouter.model.DeckEntity;
import com.deckrouter.model.EntityKind;
import com.deckrouter.model.MatchStrategy;
import com.deckrouter.model.PlantAliasRecord;
import com.deckrouter.model.ResolutionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Duration;
import java.util.AbstractList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AliasExpandingEntityMatcher.
 */
class AliasExpandingEntityMatcherTest {

    private ExecutorService executor;
    private AliasTableLoader loader;
    private AliasExpandingEntityMatcher matcher;

    @BeforeEach
    void setUp() {
        DeckRouterProperties properties = new DeckRouterProperties();
        properties.getMatching().setAliasDelimiter(';');
        properties.getMatching().getAliasTables().put("PLANT", "classpath:aliases/plants-test.csv");
        loader = new AliasTableLoader(new DefaultResourceLoader(), properties);
        executor = Executors.newFixedThreadPool(2);
        matcher = new AliasExpandingEntityMatcher(new EntityNameResolver(), loader, executor, Duration.ofSeconds(2), 0.5);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static DeckEntity entity(int code, String name) {
        return new DeckEntity(code, name);
    }

    private static List<DeckEntity> unreadableDeck() {
        return new AbstractList<DeckEntity>() {
            @Override
            public DeckEntity get(int index) {
                throw new IllegalStateException("deck snapshot unavailable");
            }

            @Override
            public int size() {
                return 1;
            }
        };
    }

    private static AliasTable aliases(PlantAliasRecord... records) {
        return AliasTable.of(List.of(records));
    }

    @Test
    void testNumericCodeWithoutAliases() {
        Optional<Integer> code = matcher.extractCode("cvu da usina 97", List.of(entity(97, "GNA II")),
                AliasTable.empty(), EntityKind.PLANT, 0.5);

        assertEquals(Optional.of(97), code);
    }

    @Test
    void testNumericCodeStrategy() {
        ResolutionResult result = matcher.resolve("Qual o CVU da usina térmica 97?", List.of(entity(97, "GNA II")),
                AliasTable.empty(), EntityKind.PLANT, 0.5).orElseThrow();

        assertEquals(97, result.getCode());
        assertEquals("GNA II", result.getMatchedName());
        assertEquals(MatchStrategy.NUMERIC_CODE, result.getStrategy());
        assertEquals(1.0, result.getConfidence());
    }

    @Test
    void testCuratedAliasResolvesToLiveCode() {
        Optional<ResolutionResult> result = matcher.resolve("cvu de gna dois", List.of(entity(97, "GNA II")),
                aliases(new PlantAliasRecord(97, "GNA II", "GNA Dois")), EntityKind.PLANT, 0.5);

        assertEquals(97, result.orElseThrow().getCode());
        assertEquals("GNA Dois", result.get().getMatchedName());
        assertEquals(MatchStrategy.NAME_IN_QUERY, result.get().getStrategy());
    }

    @Test
    void testAliasForEntityMissingFromDeckIsNotUsed() {
        ResolutionResult result = matcher.resolve("cvu de gna dois", List.of(entity(12, "ANGRA 1")),
                aliases(new PlantAliasRecord(97, "GNA II", "GNA Dois")), EntityKind.PLANT, 0.5).orElseThrow();

        // only the keyword fallback answers, and with a live code
        assertEquals(12, result.getCode());
        assertEquals("ANGRA 1", result.getMatchedName());
        assertEquals(MatchStrategy.KEYWORD, result.getStrategy());
    }

    @Test
    void testCodeComesFromDeckNotAliasTable() {
        Optional<Integer> code = matcher.extractCode("cvu de gna dois", List.of(entity(97, "GNA II")),
                aliases(new PlantAliasRecord(50, "GNA II", "GNA Dois")), EntityKind.PLANT, 0.5);

        assertEquals(Optional.of(97), code);
    }

    @Test
    void testNumericCodeAbsentFromDeck() {
        Optional<Integer> code = matcher.extractCode("usina 50", List.of(entity(97, "GNA II")),
                AliasTable.empty(), EntityKind.PLANT, 0.5);

        assertTrue(code.isEmpty());
    }

    @Test
    void testLaterNumericMatchIsTried() {
        Optional<Integer> code = matcher.extractCode("usina 999 ou usina 97", List.of(entity(97, "GNA II")),
                AliasTable.empty(), EntityKind.PLANT, 0.5);

        assertEquals(Optional.of(97), code);
    }

    @Test
    void testNumericCodeInRawQuerySurvivesExpansion() {
        AliasTable table = aliases(new PlantAliasRecord(5, "USINA 5", "Porto Cinco"));

        ResolutionResult result = matcher.resolve("cvu da usina 5", List.of(entity(5, "USINA 5")),
                table, EntityKind.PLANT, 0.5).orElseThrow();

        assertEquals("cvu da porto cinco", matcher.expandAliases("cvu da usina 5", table));
        assertEquals(5, result.getCode());
        assertEquals(MatchStrategy.NUMERIC_CODE, result.getStrategy());
    }

    @Test
    void testAliasExpansionFromConfiguredTable() {
        AliasTable table = loader.forKind(EntityKind.PLANT);

        assertEquals("disponibilidade santa cruz nova", matcher.expandAliases("disponibilidade st.cruz nova", table));

        ResolutionResult result = matcher.resolve("Disponibilidade ST.CRUZ NOVA",
                List.of(entity(15, "ST.CRUZ NOVA"), entity(16, "SANTA CRUZ")), EntityKind.PLANT).orElseThrow();
        assertEquals(15, result.getCode());
        assertEquals("Santa Cruz Nova", result.getMatchedName());
    }

    @Test
    void testAliasExpansionIsWholeWordOnly() {
        AliasTable table = loader.forKind(EntityKind.PLANT);

        assertEquals("termopernambuco", matcher.expandAliases("termopernambuco", table));
        assertEquals("cvu termopernambuco", matcher.expandAliases("cvu termope", table));
    }

    @Test
    void testExactName() {
        ResolutionResult result = matcher.resolve("Angra 1", List.of(entity(1, "ANGRA 1"), entity(13, "ANGRA 2")),
                AliasTable.empty(), EntityKind.PLANT, 0.5).orElseThrow();

        assertEquals(1, result.getCode());
        assertEquals(MatchStrategy.EXACT_NAME, result.getStrategy());
        assertEquals(1.0, result.getConfidence());
    }

    @Test
    void testLongestNameInQueryWins() {
        ResolutionResult result = matcher.resolve("cvu de angra nova", List.of(entity(1, "ANGRA"), entity(2, "ANGRA NOVA")),
                AliasTable.empty(), EntityKind.PLANT, 0.5).orElseThrow();

        assertEquals(2, result.getCode());
        assertEquals(MatchStrategy.NAME_IN_QUERY, result.getStrategy());
        assertTrue(result.getConfidence() >= 0.7);
    }

    @Test
    void testShortNamesAreNotMatchedInsideQuery() {
        ResolutionResult result = matcher.resolve("cvu de uma usina qualquer", List.of(entity(3, "UMA")),
                AliasTable.empty(), EntityKind.PLANT, 0.9).orElseThrow();

        // only the keyword fallback picks it up
        assertEquals(3, result.getCode());
        assertEquals(MatchStrategy.KEYWORD, result.getStrategy());
        assertEquals(1.0 / 3.0, result.getConfidence(), 1e-9);
    }

    @Test
    void testFuzzyName() {
        ResolutionResult result = matcher.resolve("termopernanbuco", List.of(entity(211, "TERMOPERNAMBUCO"), entity(1, "ANGRA 1")),
                AliasTable.empty(), EntityKind.PLANT, 0.5).orElseThrow();

        assertEquals(211, result.getCode());
        assertEquals(MatchStrategy.FUZZY_NAME, result.getStrategy());
    }

    @Test
    void testKeywordFallback() {
        ResolutionResult result = matcher.resolve("dados da termo norte", List.of(entity(6, "TERMO SUL"), entity(5, "TERMO NORTE II")),
                AliasTable.empty(), EntityKind.PLANT, 0.9).orElseThrow();

        assertEquals(5, result.getCode());
        assertEquals(MatchStrategy.KEYWORD, result.getStrategy());
        assertEquals(1.0, result.getConfidence());
    }

    @Test
    void testKeywordFallbackWithoutSharedToken() {
        ResolutionResult result = matcher.resolve("dados de furnas", List.of(entity(6, "TERMO SUL")),
                AliasTable.empty(), EntityKind.PLANT, 0.99).orElseThrow();

        assertEquals(6, result.getCode());
        assertEquals(MatchStrategy.KEYWORD, result.getStrategy());
        assertEquals(new EntityNameResolver().ratio("dados de furnas", "termo sul"), result.getConfidence(), 1e-9);
        assertTrue(result.getConfidence() < 1.0);
    }

    @Test
    void testKeywordFallbackPrefersSharedTokens() {
        ResolutionResult result = matcher.resolve("cvu de furnas", List.of(entity(6, "TERMO SUL"), entity(7, "FURNAS NOVA")),
                AliasTable.empty(), EntityKind.PLANT, 0.99).orElseThrow();

        assertEquals(7, result.getCode());
        assertEquals(MatchStrategy.KEYWORD, result.getStrategy());
        assertEquals(0.5, result.getConfidence(), 1e-9);
    }

    @Test
    void testKeywordFallbackNeedsSignificantQueryTokens() {
        Optional<ResolutionResult> result = matcher.resolve("informações da usina", List.of(entity(6, "TERMO SUL")),
                AliasTable.empty(), EntityKind.PLANT, 0.9);

        assertTrue(result.isEmpty());
    }

    @Test
    void testThermalClassCode() {
        Optional<Integer> code = matcher.extractCode("dados da classe térmica 3", List.of(entity(3, "CLASSE A"), entity(4, "CLASSE B")),
                AliasTable.empty(), EntityKind.CLASS, 0.5);

        assertEquals(Optional.of(3), code);
    }

    @Test
    void testMissingEntitiesInDeckAreSkipped() {
        ResolutionResult result = matcher.resolve("cvu da usina 97", Arrays.asList(null, entity(97, "GNA II")),
                AliasTable.empty(), EntityKind.PLANT, 0.5).orElseThrow();

        assertEquals(97, result.getCode());
        assertTrue(matcher.resolve("cvu da usina 97", Arrays.asList((DeckEntity) null),
                AliasTable.empty(), EntityKind.PLANT, 0.5).isEmpty());
    }

    @Test
    void testBlankInputs() {
        assertTrue(matcher.resolve("  ", List.of(entity(1, "ANGRA 1")), AliasTable.empty(), EntityKind.PLANT, 0.5).isEmpty());
        assertTrue(matcher.resolve("angra 1", List.of(), AliasTable.empty(), EntityKind.PLANT, 0.5).isEmpty());
    }

    @Test
    void testResolveAcrossSnapshots() {
        Map<String, List<DeckEntity>> decks = new LinkedHashMap<>();
        decks.put("deck-a", List.of(entity(97, "GNA II")));
        decks.put("deck-b", List.of(entity(12, "ANGRA 1")));
        decks.put("deck-c", unreadableDeck());
        decks.put("deck-d", List.of(entity(97, "GNA II NOVA")));

        Map<String, ResolutionResult> results = matcher.resolveAcrossSnapshots("usina 97", decks, EntityKind.PLANT, 0.5);

        assertEquals(List.of("deck-a", "deck-d"), List.copyOf(results.keySet()));
        assertEquals(97, results.get("deck-a").getCode());
        assertEquals("GNA II NOVA", results.get("deck-d").getMatchedName());
    }
}
