package com.configline.backend.configs;

import com.configline.backend.error.BadRequestException;
import com.configline.backend.error.ErrorCode;
import com.configline.backend.permission.ConfigMemberRole;
import com.configline.backend.project.Emails;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Per-config editor and maintainer lists. An email may appear once across both lists. */
public record ConfigMembers(List<String> editorEmails, List<String> maintainerEmails) {

    public static final ConfigMembers EMPTY = new ConfigMembers(List.of(), List.of());

    public ConfigMembers {
        editorEmails = editorEmails == null ? List.of() : List.copyOf(editorEmails);
        maintainerEmails = maintainerEmails == null ? List.of() : List.copyOf(maintainerEmails);
    }

    /** Normalizes emails and sorts both lists; rejects duplicates and blanks. */
    public ConfigMembers validated() {
        Set<String> seen = new HashSet<>();
        List<String> dups = new ArrayList<>();
        List<String> editors = normalizeInto(editorEmails, seen, dups);
        List<String> maintainers = normalizeInto(maintainerEmails, seen, dups);
        if (!dups.isEmpty()) {
            throw new BadRequestException(ErrorCode.DUPLICATE_MEMBER,
                    "Each member may appear only once: " + String.join(", ", dups), dups);
        }
        editors.sort(null);
        maintainers.sort(null);
        return new ConfigMembers(editors, maintainers);
    }

    public static ConfigMembers fromEntities(List<ConfigMemberEntity> members) {
        List<String> editors = new ArrayList<>();
        List<String> maintainers = new ArrayList<>();
        for (ConfigMemberEntity m : members) {
            if (m.getRole() == ConfigMemberRole.MAINTAINER) maintainers.add(m.getEmail());
            else editors.add(m.getEmail());
        }
        editors.sort(null);
        maintainers.sort(null);
        return new ConfigMembers(editors, maintainers);
    }

    /** Stored form: [{"email": "...", "role": "editor"}, ...]. */
    public JsonNode toJson() {
        ArrayNode arr = JsonNodeFactory.instance.arrayNode();
        editorEmails.forEach(e -> add(arr, e, ConfigMemberRole.EDITOR));
        maintainerEmails.forEach(e -> add(arr, e, ConfigMemberRole.MAINTAINER));
        return arr;
    }

    public static ConfigMembers fromJson(JsonNode node) {
        if (node == null || !node.isArray()) return EMPTY;
        List<String> editors = new ArrayList<>();
        List<String> maintainers = new ArrayList<>();
        for (JsonNode m : node) {
            String email = m.path("email").asText("");
            if ("maintainer".equals(m.path("role").asText())) maintainers.add(email);
            else editors.add(email);
        }
        return new ConfigMembers(editors, maintainers);
    }

    private static void add(ArrayNode arr, String email, ConfigMemberRole role) {
        ObjectNode n = arr.addObject();
        n.put("email", email);
        n.put("role", role.wireName());
    }

    private static List<String> normalizeInto(List<String> raw, Set<String> seen, List<String> dups) {
        List<String> out = new ArrayList<>();
        for (String r : raw) {
            String e = Emails.normalize(r);
            if (e.isEmpty()) {
                throw new BadRequestException("Member email must not be blank");
            }
            if (!seen.add(e)) {
                dups.add(e);
                continue;
            }
            out.add(e);
        }
        return out;
    }
}
