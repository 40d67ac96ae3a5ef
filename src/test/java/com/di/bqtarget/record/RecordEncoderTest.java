package com.di.bqtarget.record;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordEncoder Tests")
class RecordEncoderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final RecordEncoder encoder = new RecordEncoder();

    @Test
    @DisplayName("Should write decimals as exact plain strings")
    void testDecimalsAsStrings() throws Exception {
        JsonNode record = MAPPER.readTree("{\"id\":1,\"price\":12.50,\"tiny\":1E-7,\"name\":\"a\"}");

        assertEquals("{\"id\":1,\"price\":\"12.50\",\"tiny\":\"0.0000001\",\"name\":\"a\"}",
                encoder.encodeLine(record));
    }

    @Test
    @DisplayName("Should sanitize keys at every depth")
    void testSanitizedKeys() throws Exception {
        JsonNode record = MAPPER.readTree("{\"user-id\":1,\"addr\":{\"zip.code\":\"x\"},\"lines\":[{\"1st\":true}]}");

        assertEquals("{\"user_id\":1,\"addr\":{\"zip_code\":\"x\"},\"lines\":[{\"_1st\":true}]}",
                encoder.encodeLine(record));
    }

    @Test
    @DisplayName("Should build insert row content from an object")
    void testRowContent() throws Exception {
        Map<String, Object> row = encoder.toRowContent(MAPPER.readTree("{\"id\":3,\"amount\":0.1,\"tags\":[\"a\"]}"));

        assertEquals(3, row.get("id"));
        assertEquals("0.1", row.get("amount"));
        assertEquals(List.of("a"), row.get("tags"));
    }

    @Test
    @DisplayName("Should reject row content that is not an object")
    void testRowContentNotObject() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> encoder.toRowContent(MAPPER.readTree("[1,2]")));
    }
}
