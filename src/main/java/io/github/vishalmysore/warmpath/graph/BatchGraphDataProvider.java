package io.github.vishalmysore.warmpath.graph;

import io.github.vishalmysore.warmpath.domain.PersonRecord;
import io.github.vishalmysore.warmpath.domain.RelationshipRecord;
import io.github.vishalmysore.warmpath.domain.TenantScope;

import java.util.Collection;
import java.util.List;

/**
 * A {@link GraphDataProvider} that can also fetch by id, so that a search
 * can pull one frontier level at a time instead of the whole graph.
 */
public interface BatchGraphDataProvider extends GraphDataProvider {

    List<PersonRecord> findPersons(TenantScope scope, Collection<String> personIds);

    /**
     * Relationships having either endpoint among the given ids.
     */
    List<RelationshipRecord> findRelationships(TenantScope scope, Collection<String> personIds);
}
