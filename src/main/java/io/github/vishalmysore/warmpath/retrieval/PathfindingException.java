package io.github.vishalmysore.warmpath.retrieval;

/**
 * A search could not be carried out, typically because a data provider
 * failed. Distinct from an empty result, which means no warm path exists.
 */
public class PathfindingException extends RuntimeException {

    public PathfindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
