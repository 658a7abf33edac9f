package com.dynamicdto.options;

import java.util.Arrays;
import java.util.Optional;

/**
 * Policy flags a Dto can carry, keyed by the names accepted in {@code setOptions}.
 */
public enum DtoOption {

    FORBIDS_OVERRIDES("forbids_overrides"),
    IGNORES_UNKNOWN("ignores_unknown"),
    READ_ONLY("read_only");

    private final String key;

    DtoOption(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<DtoOption> fromKey(String key) {
        return Arrays.stream(values())
                .filter(o -> o.key.equals(key))
                .findFirst();
    }
}
