package io.github.vishalmysore.warmpath.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How two person records were found to be the same individual, in
 * decreasing order of confidence.
 */
public enum MatchMethod {
    EMAIL("email", "Exact email address match"),
    PHONE("phone", "Exact phone number match"),
    SOCIAL_HANDLE("social_handle", "Social media profile match"),
    NAME_AND_ORGANIZATION("name_and_organization", "Name and organization similarity");

    private final String code;
    private final String description;

    MatchMethod(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
