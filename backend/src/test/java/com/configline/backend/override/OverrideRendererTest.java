package com.configline.backend.override;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OverrideRendererTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void render_replacesReferencesWithLiterals_andUnresolvedWithInvalid() throws Exception {
        var overrides = OverrideCodec.decodeLenient(om.readTree("""
                [{"name":"o","conditions":[
                   {"operator":"in","property":"u","value":{"type":"reference","projectId":"p","configName":"lists","path":["beta"]}},
                   {"operator":"not","condition":{"operator":"equals","property":"u","value":{"type":"reference","projectId":"p","configName":"missing","path":[]}}}
                 ],"value":1}]
                """));
        var lists = om.readTree("{\"beta\":[\"u1\",\"u2\"]}");
        ReferenceResolver resolver = (p, n) -> n.equals("lists") ? Optional.of(lists) : Optional.empty();

        var rendered = OverrideRenderer.render(overrides, resolver);
        var first = assertInstanceOf(Condition.Comparison.class, rendered.get(0).conditions().get(0));
        var lit = assertInstanceOf(Operand.Literal.class, first.operand());
        assertEquals(om.readTree("[\"u1\",\"u2\"]"), lit.value());

        var not = assertInstanceOf(Condition.Not.class, rendered.get(0).conditions().get(1));
        var invalid = assertInstanceOf(Condition.Invalid.class, not.condition());
        assertTrue(invalid.reason().contains("missing"));
    }
}
