package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Typed attributes of a person node. The fields the search and resolution
 * logic reads are explicit; anything else an import adapter attaches lands
 * in {@link #extensions}.
 */
@Value
@Builder(toBuilder = true)
public class NodeAttributes {
    public static final NodeAttributes EMPTY = NodeAttributes.builder().build();

    // Marks the searching user's own node (search origin)
    boolean self;
    String organizationName;
    String title;

    @Builder.Default
    Map<String, String> extensions = Map.of();

    public static NodeAttributes selfNode() {
        return NodeAttributes.builder().self(true).build();
    }

    public boolean hasOrganization() {
        return organizationName != null && !organizationName.isBlank();
    }
}
