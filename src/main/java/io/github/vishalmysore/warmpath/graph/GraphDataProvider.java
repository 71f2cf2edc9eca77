package io.github.vishalmysore.warmpath.graph;

import io.github.vishalmysore.warmpath.domain.PersonRecord;
import io.github.vishalmysore.warmpath.domain.RelationshipRecord;
import io.github.vishalmysore.warmpath.domain.TenantScope;

import java.util.List;

/**
 * Storage-side source of person and relationship records. Implementations
 * must return only records that belong to the given tenant scope; the graph
 * builder does not re-check isolation.
 */
public interface GraphDataProvider {

    List<PersonRecord> listPersons(TenantScope scope);

    List<RelationshipRecord> listRelationships(TenantScope scope);
}
