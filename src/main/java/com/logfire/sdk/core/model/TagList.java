package com.logfire.sdk.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable sequence of tags.
 * Merging is concatenation only: no de-duplication, call order is kept.
 */
public final class TagList {

    private static final TagList EMPTY = new TagList(List.of());

    private final List<String> tags;

    private TagList(List<String> tags) {
        this.tags = tags;
    }

    public static TagList empty() {
        return EMPTY;
    }

    public static TagList of(String... tags) {
        return EMPTY.concat(tags);
    }

    /**
     * Returns a new list with the given tags appended after this list's tags.
     */
    public TagList concat(String... more) {
        Objects.requireNonNull(more, "tags are required");
        if (more.length == 0) {
            return this;
        }
        List<String> combined = new ArrayList<>(tags.size() + more.length);
        combined.addAll(tags);
        for (String tag : Arrays.asList(more)) {
            combined.add(Objects.requireNonNull(tag, "tag must not be null"));
        }
        return new TagList(List.copyOf(combined));
    }

    public List<String> asList() {
        return tags;
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    public int size() {
        return tags.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof TagList other && tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return tags.toString();
    }
}
