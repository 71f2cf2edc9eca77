package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Person row handed over by the storage layer, already scoped to one tenant.
 */
@Value
@Builder
public class PersonRecord {
    String id;

    @Builder.Default
    List<String> displayNames = List.of();

    @Builder.Default
    NodeAttributes attributes = NodeAttributes.EMPTY;

    public String primaryName() {
        if (displayNames == null || displayNames.isEmpty())
            return "Unknown";
        String first = displayNames.get(0);
        return first == null || first.isBlank() ? "Unknown" : first;
    }

    public PersonNode toNode() {
        return PersonNode.builder()
                .id(id)
                .displayName(primaryName())
                .attributes(attributes == null ? NodeAttributes.EMPTY : attributes)
                .build();
    }
}
