package io.github.vishalmysore.warmpath.retrieval;

import io.github.vishalmysore.warmpath.domain.IntroPath;
import io.github.vishalmysore.warmpath.domain.PersonNode;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Paths found by a search plus what the search saw along the way.
 * A truncated outcome stopped on its budget; its paths are still valid.
 */
@Value
public class SearchOutcome {
    List<IntroPath> paths;
    Map<String, PersonNode> discoveredNodes;
    boolean truncated;
    int expansions;

    public static SearchOutcome empty() {
        return new SearchOutcome(List.of(), Map.of(), false, 0);
    }

    public Map<String, String> nodeNames() {
        Map<String, String> names = new LinkedHashMap<>();
        discoveredNodes.forEach((id, node) -> names.put(id, node.getDisplayName()));
        return names;
    }
}
