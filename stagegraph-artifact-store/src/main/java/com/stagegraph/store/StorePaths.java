package com.stagegraph.store;

import java.util.ArrayList;
import java.util.List;

/** Helpers for {@code /}-separated store paths. */
public final class StorePaths {

    private StorePaths() {
    }

    /**
     * Joins segments with {@code /}, dropping empty segments and duplicate separators.
     * {@code join("sessions/", "/a", "", "b")} is {@code sessions/a/b}.
     */
    public static String join(String... segments) {
        List<String> parts = new ArrayList<>();
        for (String segment : segments) {
            if (segment == null) continue;
            for (String part : segment.split("/")) {
                if (!part.isEmpty()) parts.add(part);
            }
        }
        return String.join("/", parts);
    }

    /** Normalized form of {@code path}: no leading, trailing or doubled separators. */
    public static String normalize(String path) {
        return join(path);
    }
}
