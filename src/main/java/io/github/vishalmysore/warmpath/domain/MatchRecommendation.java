package io.github.vishalmysore.warmpath.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the review workflow should do with a match.
 */
public enum MatchRecommendation {
    AUTO_MERGE("auto_merge"),
    REVIEW_QUEUE("review_queue"),
    // Still emitted; consumers decide whether to discard it
    REJECT("reject");

    private final String code;

    MatchRecommendation(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
