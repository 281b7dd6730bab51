package gql.lite;

import java.util.Optional;

/// Built-in leaf types. Coercion is a total match over these constants.
public enum ScalarKind {
    STRING("String", "The `String` scalar type represents textual data, represented as UTF-8 character sequences."),
    INT("Int", "The `Int` scalar type represents a signed 32-bit integer."),
    BOOLEAN("Boolean", "The `Boolean` scalar type represents `true` or `false`."),
    FLOAT("Float", "The `Float` scalar type represents a signed double-precision fractional value."),
    ID("ID", "The `ID` scalar type represents a unique identifier, serialized as a string.");

    private final String typeName;
    private final String description;

    ScalarKind(String typeName, String description) {
        this.typeName = typeName;
        this.description = description;
    }

    /// Name used in queries and error messages, e.g. `Int`.
    public String typeName() {
        return typeName;
    }

    public String description() {
        return description;
    }

    /// Looks up a scalar by its type name (case-sensitive).
    public static Optional<ScalarKind> fromTypeName(String name) {
        for (ScalarKind kind : values()) {
            if (kind.typeName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
