package io.decisionflow.core.model;

/** Rule-matching strategy of a decision table. */
public enum HitPolicy {
    /** The first rule row whose conditions match wins; later rows are not consulted. */
    FIRST("first");

    private final String wireName;

    HitPolicy(String wireName) {
        this.wireName = wireName;
    }

    /** The name used in the serialized graph. */
    public String wireName() {
        return wireName;
    }
}
