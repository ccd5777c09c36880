package com.configline.backend.override;

import com.configline.backend.error.BadRequestException;
import com.configline.backend.error.ErrorCode;

import java.util.ArrayList;
import java.util.List;

/** References may only point at configs of the same project. */
public final class OverrideReferenceValidator {
    private OverrideReferenceValidator() {}

    public record Violation(String overrideName, Operand.Reference reference) {}

    public static List<Operand.Reference> references(Condition c) {
        List<Operand.Reference> out = new ArrayList<>();
        collect(c, out);
        return out;
    }

    public static List<Violation> violations(String projectId, List<ConfigOverride> overrides) {
        List<Violation> out = new ArrayList<>();
        if (overrides == null) return out;
        for (ConfigOverride o : overrides) {
            for (Condition c : o.conditions()) {
                for (Operand.Reference ref : references(c)) {
                    if (!ref.projectId().equals(projectId)) {
                        out.add(new Violation(o.name(), ref));
                    }
                }
            }
        }
        return out;
    }

    /** Throws with every violating override listed, not just the first. */
    public static void validate(String projectId, List<ConfigOverride> overrides) {
        List<Violation> bad = violations(projectId, overrides);
        if (bad.isEmpty()) return;

        List<String> details = bad.stream()
                .map(v -> "Override \"" + v.overrideName() + "\" references project " + v.reference().projectId())
                .toList();
        throw new BadRequestException(
                ErrorCode.INVALID_REFERENCE,
                "Override references must use the same project ID as the config. " + String.join("; ", details),
                details
        );
    }

    private static void collect(Condition c, List<Operand.Reference> out) {
        if (c instanceof Condition.Comparison cmp) {
            if (cmp.operand() instanceof Operand.Reference ref) out.add(ref);
        } else if (c instanceof Condition.All all) {
            all.conditions().forEach(x -> collect(x, out));
        } else if (c instanceof Condition.Any any) {
            any.conditions().forEach(x -> collect(x, out));
        } else if (c instanceof Condition.Not not) {
            collect(not.condition(), out);
        }
    }
}
