package com.chainfeed.domain;

/**
 * Originating transaction feed. The wire name is the {@code type} tag sources put on each item.
 */
public enum SourceKind {
    BITCOIN("bitcoin"),
    STACKS("stacks"),
    STARKNET("starknet"),
    SPARK("spark");

    private final String wireName;

    SourceKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
