package com.configline.backend.override;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replaces reference operands with the literal they currently resolve to, so clients can
 * evaluate overrides without access to other configs. A reference that does not resolve turns
 * its comparison into {@link Condition.Invalid}, keeping it non-matching on the client too.
 */
public final class OverrideRenderer {
    private OverrideRenderer() {}

    public static List<ConfigOverride> render(List<ConfigOverride> overrides, ReferenceResolver resolver) {
        Map<String, Optional<JsonNode>> memo = new HashMap<>();
        ReferenceResolver cached = (projectId, configName) ->
                memo.computeIfAbsent(projectId + '\u0000' + configName, k -> safeResolve(resolver, projectId, configName));

        List<ConfigOverride> out = new ArrayList<>(overrides.size());
        for (ConfigOverride o : overrides) {
            List<Condition> conds = new ArrayList<>(o.conditions().size());
            for (Condition c : o.conditions()) {
                conds.add(renderCondition(c, cached));
            }
            out.add(new ConfigOverride(o.name(), conds, o.value()));
        }
        return out;
    }

    static Condition renderCondition(Condition c, ReferenceResolver resolver) {
        if (c instanceof Condition.Comparison cmp && cmp.operand() instanceof Operand.Reference ref) {
            Optional<JsonNode> v = resolver.resolve(ref.projectId(), ref.configName())
                    .flatMap(root -> JsonPath.get(root, ref.path()));
            if (v.isEmpty()) {
                return new Condition.Invalid("unresolved reference " + ref.configName()
                        + (ref.path().isEmpty() ? "" : "." + JsonPath.format(ref.path())));
            }
            return new Condition.Comparison(cmp.op(), cmp.property(), new Operand.Literal(v.get()));
        }
        if (c instanceof Condition.All all) {
            return new Condition.All(all.conditions().stream().map(x -> renderCondition(x, resolver)).toList());
        }
        if (c instanceof Condition.Any any) {
            return new Condition.Any(any.conditions().stream().map(x -> renderCondition(x, resolver)).toList());
        }
        if (c instanceof Condition.Not not) {
            return new Condition.Not(renderCondition(not.condition(), resolver));
        }
        return c;
    }

    private static Optional<JsonNode> safeResolve(ReferenceResolver resolver, String projectId, String configName) {
        try {
            Optional<JsonNode> v = resolver.resolve(projectId, configName);
            return v == null ? Optional.empty() : v;
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }
}
