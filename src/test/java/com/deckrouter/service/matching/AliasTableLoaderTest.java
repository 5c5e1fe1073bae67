package com.deckrouter.service.matching;

import com.deckrouter.config.DeckRouterProperties;
import com.deckrouter.model.EntityKind;
import com.deckrouter.model.PlantAliasRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AliasTableLoader and AliasTable.
 */
class AliasTableLoaderTest {

    private static final String FIXTURE = "classpath:aliases/plants-test.csv";

    private DeckRouterProperties properties;
    private AliasTableLoader loader;

    @BeforeEach
    void setUp() {
        properties = new DeckRouterProperties();
        properties.getMatching().setAliasDelimiter(';');
        properties.getMatching().getAliasTables().put("PLANT", FIXTURE);
        loader = new AliasTableLoader(new DefaultResourceLoader(), properties);
    }

    @Test
    void testMalformedRowsAreSkipped() {
        AliasTable table = loader.load(FIXTURE);

        // bad code and short row dropped
        assertEquals(8, table.getRecords().size());
        assertTrue(table.getRecords().stream().noneMatch(r -> r.getDatasetName().equals("BAD ROW")));
    }

    @Test
    void testLongerCuratedNameWins() {
        AliasTable table = loader.load(FIXTURE);

        assertEquals("Santa Cruz Nova", table.fullNameFor("ST.CRUZ NOVA"));
        assertEquals("Santa Cruz Nova", table.fullNameFor("st.cruz  nova"));
    }

    @Test
    void testFirstCuratedNameWinsOnEqualLength() {
        AliasTable table = loader.load(FIXTURE);

        assertEquals("Alpha", table.fullNameFor("UTE X"));
    }

    @Test
    void testIdentityAliasesAreIgnored() {
        AliasTable table = loader.load(FIXTURE);

        assertNull(table.fullNameFor("SAME"));
        assertEquals(5, table.size());
    }

    @Test
    void testAliasesLongestNativeNameFirst() {
        AliasTable table = loader.load(FIXTURE);

        assertEquals(List.of("st.cruz nova", "n.venecia 2", "termope", "gna ii", "ute x"),
                new ArrayList<>(table.aliases().keySet()));
    }

    @Test
    void testMissingFileYieldsEmptyTable() {
        AliasTable table = loader.load("classpath:aliases/missing.csv");

        assertTrue(table.isEmpty());
        assertTrue(loader.load("classpath:aliases/missing.csv").isEmpty());
    }

    @Test
    void testTablesAreCachedPerKind() {
        AliasTable plants = loader.forKind(EntityKind.PLANT);

        assertSame(plants, loader.forKind(EntityKind.PLANT));
        assertFalse(plants.isEmpty());
        assertTrue(loader.forKind(EntityKind.CLASS).isEmpty());

        loader.reload();
        assertNotSame(plants, loader.forKind(EntityKind.PLANT));
    }

    @Test
    void testQuotedFields() {
        properties.getMatching().setAliasDelimiter(',');
        AliasTableLoader commaLoader = new AliasTableLoader(new DefaultResourceLoader(), properties);

        assertEquals(List.of("1", "A, B", "say \"hi\""), commaLoader.splitLine("1,\"A, B\",\"say \"\"hi\"\"\""));
        assertEquals(List.of("", "x", ""), commaLoader.splitLine(",x,"));
    }

    @Test
    void testLoadedRecordsAreReadOnly() {
        AliasTable table = loader.load(FIXTURE);

        assertTrue(Arrays.stream(PlantAliasRecord.class.getMethods()).noneMatch(m -> m.getName().startsWith("set")));
        assertThrows(UnsupportedOperationException.class, () -> table.getRecords().clear());
    }
}
