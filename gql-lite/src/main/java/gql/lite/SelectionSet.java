package gql.lite;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Requested fields at one level of a query: field name to nested selection, in request order.
/// An empty nested selection marks a leaf.
public record SelectionSet(Map<String, SelectionSet> fields) {

    private static final SelectionSet EMPTY = new SelectionSet(Map.of());

    public SelectionSet {
        Objects.requireNonNull(fields, "fields must not be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static SelectionSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    /// Nested selection of a requested field, or null when the field was not requested.
    public SelectionSet get(String fieldName) {
        return fields.get(fieldName);
    }

    /// Renders the canonical query form, e.g. `{ hello user { name } }`.
    @Override
    public String toString() {
        final var sb = new StringBuilder();
        render(this, sb);
        return sb.toString();
    }

    private static void render(SelectionSet selection, StringBuilder sb) {
        sb.append('{');
        for (var entry : selection.fields.entrySet()) {
            sb.append(' ').append(entry.getKey());
            if (!entry.getValue().isEmpty()) {
                sb.append(' ');
                render(entry.getValue(), sb);
            }
        }
        sb.append(" }");
    }

    /// Accumulates fields; a repeated name replaces the earlier selection in place.
    public static final class Builder {
        private final Map<String, SelectionSet> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder leaf(String fieldName) {
            return field(fieldName, EMPTY);
        }

        public Builder field(String fieldName, SelectionSet nested) {
            Objects.requireNonNull(fieldName, "fieldName must not be null");
            Objects.requireNonNull(nested, "nested must not be null");
            fields.put(fieldName, nested);
            return this;
        }

        public SelectionSet build() {
            return fields.isEmpty() ? EMPTY : new SelectionSet(fields);
        }
    }
}
