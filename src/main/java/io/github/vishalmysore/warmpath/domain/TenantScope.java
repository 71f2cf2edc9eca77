package io.github.vishalmysore.warmpath.domain;

import lombok.Value;

/**
 * Opaque tenant boundary passed through to the data provider. The core never
 * interprets it; isolation is the provider's job.
 */
@Value(staticConstructor = "of")
public class TenantScope {
    String tenantId;
}
