package com.al.graphsubscriptions.model.enums;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public enum ChangeType {
    CREATED,
    UPDATED,
    DELETED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the provider's comma-separated form, e.g. "created,updated".
     */
    public static Set<ChangeType> parse(String value) {
        Set<ChangeType> result = EnumSet.noneOf(ChangeType.class);
        if (value == null || value.isBlank()) {
            return result;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(ChangeType.valueOf(trimmed.toUpperCase(Locale.ROOT)));
            }
        }
        return result;
    }

    public static String format(Set<ChangeType> changeTypes) {
        return changeTypes.stream()
                .sorted()
                .map(ChangeType::wireName)
                .collect(Collectors.joining(","));
    }
}
