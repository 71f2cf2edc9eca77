package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity-bearing view of a stored person, as compared by the entity
 * resolver. A single person may carry several name variants, emails and
 * phone numbers collected from different import sources.
 */
@Data
@Builder
public class PersonProfile {
    private String id;

    @Builder.Default
    private List<String> names = new ArrayList<>();

    @Builder.Default
    private List<String> emails = new ArrayList<>();

    @Builder.Default
    private List<String> phones = new ArrayList<>();

    // Platform key (linkedin, twitter, github, ...) to handle
    @Builder.Default
    private Map<String, String> socialHandles = new HashMap<>();

    private String organizationName;

    // Soft-delete marker; deleted profiles are never match candidates
    private Instant deletedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean hasOrganization() {
        return organizationName != null && !organizationName.isBlank();
    }
}
