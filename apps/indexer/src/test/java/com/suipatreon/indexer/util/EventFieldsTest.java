package com.suipatreon.indexer.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventFieldsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsSuiEncodedFields() throws Exception {
        JsonNode json = objectMapper.readTree("""
                {
                  "name": [104, 105],
                  "price": "18446744073709551615",
                  "topic": "4",
                  "created_at": "1700000000000",
                  "is_public": true,
                  "tier_ids": ["0xa", "0xb"],
                  "avatar_url": "  "
                }
                """);

        assertEquals("hi", EventFields.requireText(json, "name"));
        assertEquals(new BigInteger("18446744073709551615"), EventFields.requireBigInteger(json, "price"));
        assertEquals(4, EventFields.intValue(json, "topic", 0));
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), EventFields.instant(json, "created_at"));
        assertTrue(EventFields.bool(json, "is_public", false));
        assertEquals(List.of("0xa", "0xb"), EventFields.textList(json, "tier_ids"));
        assertNull(EventFields.optionalText(json, "avatar_url"));
    }

    @Test
    void absentFieldsFallBack() throws Exception {
        JsonNode json = objectMapper.readTree("{\"topic\": \"music\", \"bio\": null}");

        assertNull(EventFields.text(json, "bio"));
        assertNull(EventFields.instant(json, "created_at"));
        assertEquals(0, EventFields.intValue(json, "topic", 0));
        assertFalse(EventFields.bool(json, "is_public", false));
        assertTrue(EventFields.textList(json, "tier_ids").isEmpty());
    }

    @Test
    void missingOrMalformedRequiredFieldsAreRejected() throws Exception {
        JsonNode json = objectMapper.readTree("{\"price\": \"12abc\"}");

        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
                () -> EventFields.requireText(json, "tier_id"));
        assertEquals("Missing event field: tier_id", missing.getMessage());
        assertThrows(IllegalArgumentException.class, () -> EventFields.requireBigInteger(json, "price"));
    }

    @Test
    void formatsBaseUnitsAsUsdc() {
        assertEquals(new BigDecimal("5.000000"), CurrencyUnits.toStandardUnit(BigInteger.valueOf(5_000_000)));
        assertEquals("5.00 USDC", CurrencyUnits.format(BigInteger.valueOf(5_000_000)));
        assertEquals("0.01 USDC", CurrencyUnits.format(BigInteger.valueOf(10_000)));
    }
}
