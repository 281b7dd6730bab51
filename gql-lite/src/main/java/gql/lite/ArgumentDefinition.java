package gql.lite;

import java.util.Objects;

/// Declared argument of a field. Stored on the schema but not consulted during execution.
public record ArgumentDefinition(GqlType type, String description, Object defaultValue) {
    public ArgumentDefinition {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static ArgumentDefinition of(GqlType type) {
        return new ArgumentDefinition(type, null, null);
    }
}
