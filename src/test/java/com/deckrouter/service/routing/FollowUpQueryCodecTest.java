package com.deckrouter.service.routing;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FollowUpQueryCodec.
 */
class FollowUpQueryCodecTest {

    @Test
    void testDisambiguationRoundTrip() {
        String synthetic = FollowUpQueryCodec.disambiguation("CTUsinasTermeletricasTool", "cvu de angra 1");

        assertEquals("__DISAMBIG__:CTUsinasTermeletricasTool:cvu de angra 1", synthetic);
        FollowUpQuery parsed = FollowUpQueryCodec.parse(synthetic).orElseThrow();
        assertEquals("CTUsinasTermeletricasTool", parsed.getToolName());
        assertEquals("cvu de angra 1", parsed.getOriginalQuery());
        assertFalse(parsed.hasForcedCode());
    }

    @Test
    void testOriginalQueryMayContainColons() {
        FollowUpQuery parsed = FollowUpQueryCodec.parse("__DISAMBIG__:DPCargaSubsistemasTool:carga: sudeste 10:00").orElseThrow();

        assertEquals("DPCargaSubsistemasTool", parsed.getToolName());
        assertEquals("carga: sudeste 10:00", parsed.getOriginalQuery());
    }

    @Test
    void testPlantCorrection() {
        String synthetic = FollowUpQueryCodec.plantCorrection("InflexibilidadeUsinaTool", 97, "inflexibilidade de gna");

        FollowUpQuery parsed = FollowUpQueryCodec.parse(synthetic).orElseThrow();
        assertEquals("InflexibilidadeUsinaTool", parsed.getToolName());
        assertEquals(Integer.valueOf(97), parsed.getForcedCode());
        assertEquals("inflexibilidade de gna", parsed.getOriginalQuery());
    }

    @Test
    void testMalformedFollowUps() {
        assertEquals(Optional.empty(), FollowUpQueryCodec.parse("__DISAMBIG__:NoQuery"));
        assertEquals(Optional.empty(), FollowUpQueryCodec.parse("__PLANT_CORR__:Tool:abc:query"));
        assertEquals(Optional.empty(), FollowUpQueryCodec.parse("qual o cvu de angra 1"));
        assertEquals(Optional.empty(), FollowUpQueryCodec.parse(null));
    }

    @Test
    void testIsFollowUp() {
        assertTrue(FollowUpQueryCodec.isFollowUp("__DISAMBIG__:A:b"));
        assertTrue(FollowUpQueryCodec.isFollowUp("__PLANT_CORR__:A:1:b"));
        assertFalse(FollowUpQueryCodec.isFollowUp("cvu"));
    }
}
