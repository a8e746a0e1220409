package com.keysort.canonical;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Lexicographic key over a list of comparable components.
 * <p>
 * Components at the same position are expected to share a type; when they do not,
 * the type name decides so the order stays total.
 */
public final class CompositeKey implements Comparable<CompositeKey> {

    private final List<Comparable<?>> components;

    private CompositeKey(List<Comparable<?>> components) {
        this.components = Collections.unmodifiableList(components);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public int compareTo(CompositeKey other) {
        int n = Math.min(components.size(), other.components.size());
        for (int i = 0; i < n; i++) {
            Comparable a = components.get(i);
            Comparable b = other.components.get(i);
            int cmp = a.getClass() == b.getClass()
                    ? a.compareTo(b)
                    : a.getClass().getName().compareTo(b.getClass().getName());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(components.size(), other.components.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return components.equals(((CompositeKey) o).components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(components);
    }

    @Override
    public String toString() {
        return "CompositeKey" + components;
    }

    /**
     * Builder appending components in comparison order.
     */
    public static final class Builder {
        private final List<Comparable<?>> components = new ArrayList<>();

        private Builder() {
        }

        public Builder add(int value) {
            components.add(value);
            return this;
        }

        public Builder add(String value) {
            components.add(value == null ? "" : value);
            return this;
        }

        public Builder add(NaturalKey value) {
            components.add(Objects.requireNonNull(value, "value cannot be null"));
            return this;
        }

        public Builder addAll(CompositeKey key) {
            components.addAll(key.components);
            return this;
        }

        public CompositeKey build() {
            return new CompositeKey(new ArrayList<>(components));
        }
    }
}
