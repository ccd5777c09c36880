package com.configline.backend.override;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class OverrideEvaluatorTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void evaluate_returnsFirstMatchingOverride_evenWhenLaterOnesMatchToo() throws Exception {
        var overrides = overrides("""
                [
                  {"name":"pro","conditions":[{"operator":"equals","property":"tier","value":{"type":"literal","value":"pro"}}],"value":"A"},
                  {"name":"any","conditions":[],"value":"B"}
                ]
                """);

        var r = OverrideEvaluator.evaluateWithTrace(text("base"), overrides, ctx("tier", text("pro")), ReferenceResolver.NONE);
        assertEquals(text("A"), r.value());
        assertEquals("pro", r.matchedOverride());
        // evaluation stops at the winner
        assertEquals(1, r.overrides().size());

        var other = OverrideEvaluator.evaluate(text("base"), overrides, ctx("tier", text("free")), ReferenceResolver.NONE);
        assertEquals(text("B"), other);
    }

    @Test
    void evaluate_fallsBackToBase_whenNothingMatches() throws Exception {
        var overrides = overrides("""
                [{"name":"pro","conditions":[{"operator":"equals","property":"tier","value":{"type":"literal","value":"pro"}}],"value":"A"}]
                """);

        var r = OverrideEvaluator.evaluateWithTrace(text("base"), overrides, ctx("tier", text("free")), null);
        assertEquals(text("base"), r.value());
        assertNull(r.matchedOverride());
        assertEquals(ConditionResult.NOT_MATCHED, r.overrides().get(0).result());
    }

    @Test
    void evaluate_missingProperty_isUnknownAndDoesNotMatch() throws Exception {
        var overrides = overrides("""
                [{"name":"o","conditions":[{"operator":"not","condition":{"operator":"equals","property":"tier","value":{"type":"literal","value":"pro"}}}],"value":1}]
                """);

        var r = OverrideEvaluator.evaluateWithTrace(IntNode.valueOf(0), overrides, Map.of(), ReferenceResolver.NONE);
        // not(UNKNOWN) stays UNKNOWN
        assertEquals(ConditionResult.UNKNOWN, r.overrides().get(0).result());
        assertEquals(IntNode.valueOf(0), r.value());
    }

    @Test
    void evaluate_andShortCircuitsOnNotMatched_orOnMatched() throws Exception {
        var overrides = overrides("""
                [
                  {"name":"and","conditions":[{"operator":"and","conditions":[
                      {"operator":"equals","property":"a","value":{"type":"literal","value":1}},
                      {"operator":"equals","property":"missing","value":{"type":"literal","value":1}}]}],"value":"and"},
                  {"name":"or","conditions":[{"operator":"or","conditions":[
                      {"operator":"equals","property":"missing","value":{"type":"literal","value":1}},
                      {"operator":"equals","property":"a","value":{"type":"literal","value":2}}]}],"value":"or"}
                ]
                """);

        var r = OverrideEvaluator.evaluateWithTrace(text("base"), overrides, ctx("a", IntNode.valueOf(2)), ReferenceResolver.NONE);
        var andTrace = r.overrides().get(0).conditions().get(0);
        assertEquals(ConditionResult.NOT_MATCHED, andTrace.result());
        assertEquals(1, andTrace.nested().size());
        assertEquals("or", r.matchedOverride());
    }

    @Test
    void evaluate_doesNotCoerceTypes() throws Exception {
        var overrides = overrides("""
                [
                  {"name":"eq","conditions":[{"operator":"equals","property":"n","value":{"type":"literal","value":"5"}}],"value":"eq"},
                  {"name":"gt","conditions":[{"operator":"greater_than","property":"n","value":{"type":"literal","value":"1"}}],"value":"gt"}
                ]
                """);

        var r = OverrideEvaluator.evaluateWithTrace(text("base"), overrides, ctx("n", IntNode.valueOf(5)), ReferenceResolver.NONE);
        assertEquals(ConditionResult.NOT_MATCHED, r.overrides().get(0).result());
        assertEquals(ConditionResult.UNKNOWN, r.overrides().get(1).result());
        assertEquals(text("base"), r.value());
    }

    @Test
    void evaluate_comparesNumbersNumerically() throws Exception {
        var overrides = overrides("""
                [
                  {"name":"eq","conditions":[{"operator":"equals","property":"n","value":{"type":"literal","value":1.0}}],"value":"eq"}
                ]
                """);
        assertEquals(text("eq"), OverrideEvaluator.evaluate(text("base"), overrides, ctx("n", IntNode.valueOf(1)), null));

        var ordering = overrides("""
                [{"name":"lte","conditions":[{"operator":"less_than_or_equal","property":"n","value":{"type":"literal","value":10}}],"value":"small"}]
                """);
        assertEquals(text("small"), OverrideEvaluator.evaluate(text("base"), ordering, ctx("n", IntNode.valueOf(9)), null));
        assertEquals(text("base"), OverrideEvaluator.evaluate(text("base"), ordering, ctx("n", IntNode.valueOf(11)), null));
    }

    @Test
    void evaluate_inWithNonArrayOperand_isUnknown() throws Exception {
        var overrides = overrides("""
                [
                  {"name":"bad","conditions":[{"operator":"not_in","property":"c","value":{"type":"literal","value":"US"}}],"value":1},
                  {"name":"good","conditions":[{"operator":"in","property":"c","value":{"type":"literal","value":["US","CA"]}}],"value":2}
                ]
                """);

        var r = OverrideEvaluator.evaluateWithTrace(IntNode.valueOf(0), overrides, ctx("c", text("CA")), null);
        assertEquals(ConditionResult.UNKNOWN, r.overrides().get(0).result());
        assertEquals(IntNode.valueOf(2), r.value());
    }

    @Test
    void evaluate_resolvesReferencesOncePerEvaluation() throws Exception {
        var overrides = overrides("""
                [
                  {"name":"first","conditions":[{"operator":"in","property":"user","value":{"type":"reference","projectId":"p1","configName":"lists","path":["blocked"]}}],"value":"blocked"},
                  {"name":"second","conditions":[{"operator":"in","property":"user","value":{"type":"reference","projectId":"p1","configName":"lists","path":["beta"]}}],"value":"beta"}
                ]
                """);
        CountingResolver resolver = new CountingResolver();
        resolver.values.put("lists", om.readTree("{\"blocked\":[\"x\"],\"beta\":[\"u1\"]}"));

        var value = OverrideEvaluator.evaluate(text("base"), overrides, ctx("user", text("u1")), resolver);
        assertEquals(text("beta"), value);
        assertEquals(1, resolver.calls);
    }

    @Test
    void evaluate_unresolvableOrFailingReference_isUnknown() throws Exception {
        var overrides = overrides("""
                [{"name":"r","conditions":[{"operator":"equals","property":"x","value":{"type":"reference","projectId":"p1","configName":"gone","path":[]}}],"value":"hit"}]
                """);

        ReferenceResolver failing = (p, n) -> { throw new IllegalStateException("db down"); };
        var r = OverrideEvaluator.evaluateWithTrace(text("base"), overrides, ctx("x", text("hit")), failing);
        assertEquals(ConditionResult.UNKNOWN, r.overrides().get(0).result());
        assertEquals(text("base"), r.value());
    }

    @Test
    void evaluate_segmentation_fullRangeMatchesAndEmptyRangeNeverDoes() throws Exception {
        var full = overrides("""
                [{"name":"all","conditions":[{"operator":"segmentation","property":"userId","fromPercentage":0,"toPercentage":100,"seed":"s"}],"value":true}]
                """);
        var none = overrides("""
                [{"name":"none","conditions":[{"operator":"segmentation","property":"userId","fromPercentage":0,"toPercentage":0,"seed":"s"}],"value":true}]
                """);

        for (String user : List.of("a", "b", "user-42", "")) {
            assertEquals(om.readTree("true"), OverrideEvaluator.evaluate(om.readTree("false"), full, ctx("userId", text(user)), null));
            assertEquals(om.readTree("false"), OverrideEvaluator.evaluate(om.readTree("false"), none, ctx("userId", text(user)), null));
        }
    }

    @Test
    void evaluate_segmentation_nullContextValueIsUnknown() throws Exception {
        var seg = overrides("""
                [{"name":"all","conditions":[{"operator":"segmentation","property":"userId","fromPercentage":0,"toPercentage":100,"seed":"s"}],"value":true}]
                """);

        var r = OverrideEvaluator.evaluateWithTrace(om.readTree("false"), seg, ctx("userId", NullNode.getInstance()), null);
        assertEquals(ConditionResult.UNKNOWN, r.overrides().get(0).result());
    }

    @Test
    void evaluate_invalidConditionNeverMatches() throws Exception {
        var overrides = overrides("""
                [{"name":"weird","conditions":[{"operator":"matches_regex","property":"x","value":{"type":"literal","value":".*"}}],"value":"hit"}]
                """);

        var r = OverrideEvaluator.evaluateWithTrace(text("base"), overrides, ctx("x", text("y")), null);
        assertEquals(ConditionResult.UNKNOWN, r.overrides().get(0).result());
        assertEquals(text("base"), r.value());
    }

    private List<ConfigOverride> overrides(String json) throws Exception {
        return OverrideCodec.decodeLenient(om.readTree(json));
    }

    private static Map<String, JsonNode> ctx(String key, JsonNode value) {
        Map<String, JsonNode> m = new HashMap<>();
        m.put(key, value);
        return m;
    }

    private static JsonNode text(String s) {
        return TextNode.valueOf(s);
    }

    static class CountingResolver implements ReferenceResolver {
        final Map<String, JsonNode> values = new HashMap<>();
        int calls;

        @Override
        public Optional<JsonNode> resolve(String projectId, String configName) {
            calls++;
            return Optional.ofNullable(values.get(configName));
        }
    }
}
