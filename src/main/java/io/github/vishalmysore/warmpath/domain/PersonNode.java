package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A person in the relationship graph. One node per real-world person as
 * currently known to the tenant; identity is the {@code id}.
 */
@Value
@Builder
public class PersonNode {
    String id;
    String displayName;

    @Builder.Default
    NodeAttributes attributes = NodeAttributes.EMPTY;

    public boolean isSelf() {
        return attributes != null && attributes.isSelf();
    }

    /**
     * Converts this node to a schema.org Person representation.
     */
    public Map<String, Object> toJsonLd() {
        Map<String, Object> jsonLd = new LinkedHashMap<>();
        jsonLd.put("@type", "schema:Person");
        jsonLd.put("@id", "urn:warmpath:person:" + id);
        jsonLd.put("name", displayName);
        if (attributes.hasOrganization()) {
            jsonLd.put("worksFor", Map.of("@type", "schema:Organization", "name", attributes.getOrganizationName()));
        }
        if (attributes.getTitle() != null) {
            jsonLd.put("jobTitle", attributes.getTitle());
        }
        if (attributes.isSelf()) {
            jsonLd.put("warmpath:searchOrigin", true);
        }
        return jsonLd;
    }
}
