package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Raw interaction history of one relationship, as produced by the import
 * adapters (LinkedIn archives, mailbox metadata, CSV).
 */
@Value
@Builder
public class InteractionSignals {
    Instant firstSeenAt;
    Instant lastSeenAt;
    long interactionCount;
    long sentCount;
    long receivedCount;

    @Builder.Default
    Set<String> channels = Set.of();
}
