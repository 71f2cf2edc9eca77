package io.github.vishalmysore.warmpath.graph;

import io.github.vishalmysore.warmpath.domain.PersonRecord;
import io.github.vishalmysore.warmpath.domain.RelationshipRecord;
import io.github.vishalmysore.warmpath.domain.TenantScope;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Map-backed provider holding records per tenant. Used by the demo runner
 * and as a stand-in for the storage layer.
 */
public class InMemoryGraphDataProvider implements BatchGraphDataProvider {

    private final Map<TenantScope, List<PersonRecord>> persons = new ConcurrentHashMap<>();
    private final Map<TenantScope, List<RelationshipRecord>> relationships = new ConcurrentHashMap<>();

    public InMemoryGraphDataProvider addPerson(TenantScope scope, PersonRecord person) {
        persons.computeIfAbsent(scope, k -> Collections.synchronizedList(new ArrayList<>())).add(person);
        return this;
    }

    public InMemoryGraphDataProvider addRelationship(TenantScope scope, RelationshipRecord relationship) {
        relationships.computeIfAbsent(scope, k -> Collections.synchronizedList(new ArrayList<>())).add(relationship);
        return this;
    }

    @Override
    public List<PersonRecord> listPersons(TenantScope scope) {
        return List.copyOf(persons.getOrDefault(scope, List.of()));
    }

    @Override
    public List<RelationshipRecord> listRelationships(TenantScope scope) {
        return List.copyOf(relationships.getOrDefault(scope, List.of()));
    }

    @Override
    public List<PersonRecord> findPersons(TenantScope scope, Collection<String> personIds) {
        Set<String> wanted = new HashSet<>(personIds);
        return listPersons(scope).stream()
                .filter(p -> wanted.contains(p.getId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<RelationshipRecord> findRelationships(TenantScope scope, Collection<String> personIds) {
        Set<String> wanted = new HashSet<>(personIds);
        return listRelationships(scope).stream()
                .filter(r -> wanted.contains(r.getFromId()) || wanted.contains(r.getToId()))
                .collect(Collectors.toList());
    }
}
