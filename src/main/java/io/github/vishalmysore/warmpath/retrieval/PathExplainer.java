package io.github.vishalmysore.warmpath.retrieval;

import io.github.vishalmysore.warmpath.domain.RankedPath;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders one-line rationales for ranked paths, e.g.
 * "Connect through Bob → Carol to reach Dave (moderate path)".
 */
public class PathExplainer {

    public static final double STRONG_THRESHOLD = 0.8;
    public static final double MODERATE_THRESHOLD = 0.5;

    public String explain(RankedPath rankedPath, Map<String, String> nodeNames) {
        List<String> ids = rankedPath.getPath().getNodeIds();
        if (ids.size() < 2)
            return "Invalid path";

        List<String> names = ids.stream()
                .map(id -> displayName(id, nodeNames))
                .collect(Collectors.toList());
        String target = names.get(names.size() - 1);
        String strength = strengthWord(rankedPath.getScore());

        if (ids.size() == 2)
            return "Direct " + strength + " connection to " + target;

        String intermediaries = String.join(" → ", names.subList(1, names.size() - 1));
        return "Connect through " + intermediaries + " to reach " + target + " (" + strength + " path)";
    }

    private static String displayName(String id, Map<String, String> nodeNames) {
        String name = nodeNames.get(id);
        return name == null || name.isBlank() ? id : name;
    }

    public List<RankedPath> explainAll(List<RankedPath> rankedPaths, Map<String, String> nodeNames) {
        return rankedPaths.stream()
                .map(path -> path.withExplanation(explain(path, nodeNames)))
                .collect(Collectors.toList());
    }

    public static String strengthWord(double score) {
        if (score >= STRONG_THRESHOLD)
            return "strong";
        if (score >= MODERATE_THRESHOLD)
            return "moderate";
        return "weak";
    }
}
