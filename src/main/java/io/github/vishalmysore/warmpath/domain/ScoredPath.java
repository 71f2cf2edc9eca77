package io.github.vishalmysore.warmpath.domain;

import lombok.Value;

/**
 * A path with its combined score in [0,1].
 */
@Value(staticConstructor = "of")
public class ScoredPath {
    IntroPath path;
    double score;
}
