package com.authgate.backend.modules.ratelimit.domain;

import com.authgate.backend.global.error.ProblemException;

/**
 * What the rate-limit identifier refers to. The value is the key segment in the store.
 */
public enum KeyType {
    IP("ip"),
    USER("user");

    private final String value;

    KeyType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static KeyType fromValue(String value) {
        for (KeyType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw ProblemException.invalidArgument("Unknown key type: " + value);
    }
}
