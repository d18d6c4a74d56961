package com.acme.events.core;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonsTest {

    @Test
    void testErrorBody() {
        assertEquals("{\"error\":\"something went wrong\"}", Jsons.error("something went wrong"));
        assertEquals("{\"error\":\"\"}", Jsons.error(null));
    }

    @Test
    void testDatesAreIsoStrings() {
        assertEquals("{\"date\":\"2025-10-20\"}", Jsons.toJson(Map.of("date", LocalDate.of(2025, 10, 20))));
    }

    @Test
    void testUnknownPropertiesAreIgnored() throws Exception {
        var batch = Jsons.read("{\"events\":[],\"source\":\"sdk\"}", EventBatch.class);
        assertTrue(batch.events().isEmpty());
    }
}
