package gql.lite;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/// Type descriptor: one of four kinds, immutable once built.
///
/// - [Scalar]: a built-in leaf type (String, Int, Boolean, Float, ID)
/// - [ObjectType]: a named, ordered map of field definitions
/// - [ListType]: a sequence of exactly one inner type, named `[Inner]`
/// - [NonNullType]: exactly one inner type that must not resolve to null, named `Inner!`
///
/// Types are compared by name. Accessors that only make sense for one kind fail with a
/// [GqlException] on the others.
public sealed interface GqlType permits
        GqlType.Scalar,
        GqlType.ObjectType,
        GqlType.ListType,
        GqlType.NonNullType {

    Scalar STRING = new Scalar(ScalarKind.STRING);
    Scalar INT = new Scalar(ScalarKind.INT);
    Scalar BOOLEAN = new Scalar(ScalarKind.BOOLEAN);
    Scalar FLOAT = new Scalar(ScalarKind.FLOAT);
    Scalar ID = new Scalar(ScalarKind.ID);

    /// Name of the type as it appears in error messages and in the schema type map.
    String name();

    TypeKind kind();

    default String description() {
        return null;
    }

    /// Returns the ordered field map of an object type.
    /// @throws GqlException if this is not an object type
    default Map<String, FieldDefinition> fields() {
        throw GqlException.of(GqlError.FIELDS_ON_NON_OBJECT, name());
    }

    /// Looks up one field of an object type.
    /// @throws GqlException if this is not an object type
    default Optional<FieldDefinition> field(String fieldName) {
        throw GqlException.of(GqlError.FIELD_ON_NON_OBJECT, fieldName, name());
    }

    /// Returns the wrapped type of a list or non-null type.
    /// @throws GqlException if this is a scalar or object type
    default GqlType ofType() {
        throw GqlException.of(GqlError.OF_TYPE_ON_UNWRAPPED, name());
    }

    static Scalar scalar(ScalarKind kind) {
        return switch (kind) {
            case STRING -> STRING;
            case INT -> INT;
            case BOOLEAN -> BOOLEAN;
            case FLOAT -> FLOAT;
            case ID -> ID;
        };
    }

    /// Resolves a scalar by name.
    /// @throws GqlException if the name is not one of the built-in scalars
    static Scalar scalar(String name) {
        return ScalarKind.fromTypeName(name)
                .map(GqlType::scalar)
                .orElseThrow(() -> GqlException.of(GqlError.UNKNOWN_SCALAR, name));
    }

    static ObjectType object(String name, Map<String, FieldDefinition> fields) {
        return object(name, null, fields);
    }

    static ObjectType object(String name, String description, Map<String, FieldDefinition> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        final var builder = objectBuilder(name).description(description);
        fields.forEach(builder::field);
        return builder.build();
    }

    /// Starts an object type whose fields may refer back to the type itself.
    static ObjectType.Builder objectBuilder(String name) {
        return new ObjectType.Builder(name);
    }

    static ListType listOf(GqlType ofType) {
        return new ListType(ofType);
    }

    /// Wraps a type as non-null. Wrapping an already non-null type returns it unchanged.
    static GqlType nonNull(GqlType ofType) {
        Objects.requireNonNull(ofType, "ofType must not be null");
        if (ofType instanceof NonNullType) {
            return ofType;
        }
        return new NonNullType(ofType);
    }

    /// Built-in leaf type
    record Scalar(ScalarKind scalarKind) implements GqlType {
        public Scalar {
            Objects.requireNonNull(scalarKind, "scalarKind must not be null");
        }

        @Override
        public String name() {
            return scalarKind.typeName();
        }

        @Override
        public TypeKind kind() {
            return TypeKind.SCALAR;
        }

        @Override
        public String description() {
            return scalarKind.description();
        }

        @Override
        public String toString() {
            return name();
        }
    }

    /// Named object type with an ordered field map.
    /// Not a record so that fields may reference the type under construction.
    final class ObjectType implements GqlType {
        private final String name;
        private volatile String description;
        private volatile Map<String, FieldDefinition> fields = Map.of();

        private ObjectType(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public TypeKind kind() {
            return TypeKind.OBJECT;
        }

        @Override
        public String description() {
            return description;
        }

        @Override
        public Map<String, FieldDefinition> fields() {
            return fields;
        }

        @Override
        public Optional<FieldDefinition> field(String fieldName) {
            return Optional.ofNullable(fields.get(fieldName));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ObjectType other && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }

        /// Collects fields for one object type; [#build()] freezes them.
        public static final class Builder {
            private final ObjectType type;
            private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
            private boolean built;

            private Builder(String name) {
                this.type = new ObjectType(name);
            }

            public Builder description(String description) {
                type.description = description;
                return this;
            }

            public Builder field(String fieldName, GqlType fieldType) {
                return field(fieldName, FieldDefinition.of(fieldType));
            }

            public Builder field(String fieldName, FieldDefinition definition) {
                Objects.requireNonNull(fieldName, "fieldName must not be null");
                Objects.requireNonNull(definition, "definition must not be null");
                if (built) {
                    throw new IllegalStateException("Object type " + type.name + " is already built");
                }
                if (fields.putIfAbsent(fieldName, definition) != null) {
                    throw new IllegalArgumentException("Duplicate field '" + fieldName + "' on type " + type.name);
                }
                return this;
            }

            /// Adds a field whose definition is derived from the object type being built,
            /// e.g. `selfField("children", self -> FieldDefinition.of(GqlType.listOf(self)))`.
            public Builder selfField(String fieldName, Function<ObjectType, FieldDefinition> definition) {
                return field(fieldName, definition.apply(type));
            }

            public ObjectType build() {
                if (!built) {
                    type.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
                    built = true;
                }
                return type;
            }
        }
    }

    /// Sequence of one inner type
    record ListType(GqlType ofType) implements GqlType {
        public ListType {
            Objects.requireNonNull(ofType, "ofType must not be null");
        }

        @Override
        public String name() {
            return "[" + ofType.name() + "]";
        }

        @Override
        public TypeKind kind() {
            return TypeKind.LIST;
        }

        @Override
        public String toString() {
            return name();
        }
    }

    /// Inner type that must not resolve to null. Use [GqlType#nonNull] to avoid double wrapping.
    record NonNullType(GqlType ofType) implements GqlType {
        public NonNullType {
            Objects.requireNonNull(ofType, "ofType must not be null");
            if (ofType instanceof NonNullType) {
                throw new IllegalArgumentException("NonNull cannot wrap another NonNull: " + ofType.name());
            }
        }

        @Override
        public String name() {
            return ofType.name() + "!";
        }

        @Override
        public TypeKind kind() {
            return TypeKind.NON_NULL;
        }

        @Override
        public String toString() {
            return name();
        }
    }
}
