package com.kendb3.submissions.model;

import java.util.Arrays;

/**
 * Families of Minecraft versions. Versions are only comparable within a family.
 */
public enum VersionFamily {
    JE(1),
    BE(2),
    OTHER(3);

    private final int code;

    VersionFamily(int code) {
        this.code = code;
    }

    /**
     * Stored and transported value.
     */
    public int getCode() {
        return code;
    }

    public static VersionFamily fromCode(int code) {
        return Arrays.stream(values())
                .filter(f -> f.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown version family code: " + code));
    }
}
