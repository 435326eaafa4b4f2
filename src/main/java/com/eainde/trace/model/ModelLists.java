package com.eainde.trace.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable list copies that drop {@code null} elements, which model output sometimes contains.
 */
final class ModelLists {

    private ModelLists() {
    }

    /** Empty list for {@code null}. */
    static <T> List<T> copyOrEmpty(List<T> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    /** Keeps {@code null} so a missing field stays detectable. */
    static <T> List<T> copyOrNull(List<T> values) {
        return values == null ? null : copyOrEmpty(values);
    }
}
