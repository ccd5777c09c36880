package com.configline.backend.configs;

import com.configline.backend.error.BadRequestException;
import com.configline.backend.error.ErrorCode;
import com.configline.backend.override.OverrideCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SchemaValidatorTest {

    private final ObjectMapper om = new ObjectMapper();
    private final SchemaValidator validator = new SchemaValidator();

    @Test
    void validate_checksValueAndEveryOverrideValue() throws Exception {
        var schema = om.readTree("{\"type\":\"object\",\"properties\":{\"count\":{\"type\":\"integer\"}},\"required\":[\"count\"]}");
        var overrides = OverrideCodec.decodeLenient(om.readTree("""
                [{"name":"o","conditions":[],"value":{"count":"many"}}]
                """));

        assertDoesNotThrow(() -> validator.validate(schema, om.readTree("{\"count\":1}"), List.of()));

        var ex = assertThrows(BadRequestException.class,
                () -> validator.validate(schema, om.readTree("{\"count\":1}"), overrides));
        assertEquals(ErrorCode.SCHEMA_VIOLATION, ex.getCode());
        assertTrue(ex.getDetails().stream().allMatch(d -> d.startsWith("overrides[0].value")));
    }

    @Test
    void validate_skipsWhenNoSchema() throws Exception {
        assertDoesNotThrow(() -> validator.validate(null, om.readTree("\"anything\""), List.of()));
    }

    @Test
    void checkSchema_rejectsNonObjectSchemas() throws Exception {
        var ex = assertThrows(BadRequestException.class, () -> validator.checkSchema(om.readTree("[1,2]")));
        assertEquals(ErrorCode.SCHEMA_VIOLATION, ex.getCode());
    }
}
