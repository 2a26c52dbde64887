package com.blockscope.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of an address transaction entry: funds received (in) or spent (out).
 */
public enum Direction {
    IN("in"),
    OUT("out");

    private final String code;

    Direction(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Direction fromCode(String code) {
        for (Direction d : values()) {
            if (d.code.equals(code)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown direction: " + code);
    }
}
