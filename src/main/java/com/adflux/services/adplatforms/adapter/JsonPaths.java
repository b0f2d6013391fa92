package com.adflux.services.adplatforms.adapter;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dotted-path reads over decoded JSON maps. Numeric segments index into lists:
 * {@code read(body, "campaigns.0.campaign.id")}.
 */
public final class JsonPaths {

    private JsonPaths() {
    }

    public static Optional<Object> read(Object root, String path) {
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map) {
                current = ((Map<?, ?>) current).get(segment);
            } else if (current instanceof List && isIndex(segment)) {
                List<?> list = (List<?>) current;
                int index = Integer.parseInt(segment);
                current = index < list.size() ? list.get(index) : null;
            } else {
                return Optional.empty();
            }
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public static Optional<String> readString(Object root, String path) {
        return read(root, path)
                .map(String::valueOf)
                .filter(value -> !value.isBlank());
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> readMap(Object root, String path) {
        return read(root, path)
                .filter(Map.class::isInstance)
                .map(value -> (Map<String, Object>) value)
                .orElse(Map.of());
    }

    @SuppressWarnings("unchecked")
    public static List<Object> readList(Object root, String path) {
        return read(root, path)
                .filter(List.class::isInstance)
                .map(value -> (List<Object>) value)
                .orElse(List.of());
    }

    private static boolean isIndex(String segment) {
        return !segment.isEmpty() && segment.chars().allMatch(Character::isDigit);
    }
}
