package com.p14n.eventbroker.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConversionsTest {

    @Test
    void asIntShouldPassNullThrough() {
        assertNull(Conversions.asInt(null));
        assertEquals(42, Conversions.asInt(" 42 "));
        assertThrows(NumberFormatException.class, () -> Conversions.asInt("forty-two"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "true", " Yes ", "ON", "y", "t", "1" })
    void asBoolShouldRecogniseTrueStrings(String value) {
        assertTrue(Conversions.asBool(value));
    }

    @ParameterizedTest
    @ValueSource(strings = { "false", "No", " off", "N", "f", "0" })
    void asBoolShouldRecogniseFalseStrings(String value) {
        assertFalse(Conversions.asBool(value));
    }

    @Test
    void asBoolShouldRejectUnknownStrings() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Conversions.asBool("maybe"));
        assertTrue(e.getMessage().contains("maybe"));
    }

    @Test
    void asBoolShouldUseTruthinessForOtherValues() {
        assertFalse(Conversions.asBool(null));
        assertTrue(Conversions.asBool(Boolean.TRUE));
        assertFalse(Conversions.asBool(0));
        assertTrue(Conversions.asBool(2.5));
        assertTrue(Conversions.asBool(new Object()));
    }

    @Test
    void subconfigShouldStripPrefix() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("broker.name", "jobs");
        config.put("broker.thread-name-format", "jobs-%d");
        config.put("store.url", "jdbc:h2:mem:");

        Map<String, Object> sub = Conversions.subconfig(config, "broker.");

        assertEquals(Map.of("name", "jobs", "thread-name-format", "jobs-%d"), sub);
    }
}
