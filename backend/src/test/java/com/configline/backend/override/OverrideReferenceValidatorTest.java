package com.configline.backend.override;

import com.configline.backend.error.BadRequestException;
import com.configline.backend.error.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OverrideReferenceValidatorTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void validate_rejectsReferencesToOtherProjects_evenWhenNested() throws Exception {
        var overrides = OverrideCodec.decodeLenient(om.readTree("""
                [{"name":"x","conditions":[{"operator":"and","conditions":[
                   {"operator":"equals","property":"u","value":{"type":"reference","projectId":"B","configName":"c","path":[]}}]}],
                  "value":1}]
                """));

        var ex = assertThrows(BadRequestException.class, () -> OverrideReferenceValidator.validate("A", overrides));
        assertEquals(ErrorCode.INVALID_REFERENCE, ex.getCode());
        assertTrue(ex.getMessage().contains("same project ID"));
        assertTrue(ex.getMessage().contains("Override \"x\" references project B"));
    }

    @Test
    void validate_acceptsSameProjectReferences() throws Exception {
        var overrides = OverrideCodec.decodeLenient(om.readTree("""
                [{"name":"x","conditions":[{"operator":"equals","property":"u","value":{"type":"reference","projectId":"A","configName":"c","path":[]}}],"value":1}]
                """));

        assertDoesNotThrow(() -> OverrideReferenceValidator.validate("A", overrides));
    }
}
