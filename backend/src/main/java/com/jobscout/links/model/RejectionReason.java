package com.jobscout.links.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RejectionReason {
    NOT_NAVIGABLE("not-navigable"),
    MALFORMED_URL("malformed-url"),
    SELF_LINK("self-link"),
    NOT_POSTING_SHAPED("not-posting-shaped"),
    DISALLOWED_LOCATION("disallowed-location"),
    NO_KEY("no-key"),
    DUPLICATE_SESSION("duplicate-session"),
    DUPLICATE_HISTORICAL("duplicate-historical");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
