package gql.lite;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Root query type, optional root mutation type, and the name to type map of every reachable type.
///
/// The map is filled once at construction by a depth-first walk that starts from the built-in
/// scalars and then the root types. A name already present is never revisited, so the first type
/// seen under a name wins and self-referential object types terminate the walk.
public final class Schema {

    private static final Logger LOG = Logger.getLogger(Schema.class.getName());

    private final GqlType.ObjectType queryType;
    private final GqlType.ObjectType mutationType;
    private final Map<String, GqlType> typeMap;

    public Schema(GqlType queryType) {
        this(queryType, null);
    }

    /// @param queryType root type for `query` operations, must be an object type
    /// @param mutationType root type for `mutation` operations, may be null, must be an object type otherwise
    /// @throws GqlException if either root is not an object type
    public Schema(GqlType queryType, GqlType mutationType) {
        Objects.requireNonNull(queryType, "queryType must not be null");
        if (!(queryType instanceof GqlType.ObjectType query)) {
            throw GqlException.of(GqlError.QUERY_TYPE_NOT_OBJECT);
        }
        if (mutationType != null && !(mutationType instanceof GqlType.ObjectType)) {
            throw GqlException.of(GqlError.MUTATION_TYPE_NOT_OBJECT);
        }
        this.queryType = query;
        this.mutationType = (GqlType.ObjectType) mutationType;

        final var types = new LinkedHashMap<String, GqlType>();
        for (ScalarKind scalar : ScalarKind.values()) {
            register(GqlType.scalar(scalar), types);
        }
        register(query, types);
        if (mutationType != null) {
            register(mutationType, types);
        }
        this.typeMap = Collections.unmodifiableMap(types);
        LOG.fine(() -> "Schema built with " + typeMap.size() + " types: " + typeMap.keySet());
    }

    private static void register(GqlType type, Map<String, GqlType> types) {
        if (types.containsKey(type.name())) {
            return;
        }
        types.put(type.name(), type);
        LOG.finer(() -> "Registered type " + type.name() + " (" + type.kind() + ")");

        switch (type.kind()) {
            case OBJECT -> {
                for (FieldDefinition field : type.fields().values()) {
                    register(field.type(), types);
                }
            }
            case LIST, NON_NULL -> register(type.ofType(), types);
            case SCALAR -> {
                // leaf
            }
        }
    }

    public GqlType.ObjectType queryType() {
        return queryType;
    }

    public Optional<GqlType.ObjectType> mutationType() {
        return Optional.ofNullable(mutationType);
    }

    /// Looks up a registered type by name, e.g. `User`, `[User]` or `String!`.
    public Optional<GqlType> type(String name) {
        return Optional.ofNullable(typeMap.get(name));
    }

    /// Every registered type in registration order.
    public Map<String, GqlType> types() {
        return typeMap;
    }

    /// Resolves the root object type for an operation.
    /// @throws GqlException if the operation is a mutation and no mutation type is defined
    public GqlType.ObjectType rootType(OperationType operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        return switch (operation) {
            case QUERY -> queryType;
            case MUTATION -> mutationType().orElseThrow(() -> GqlException.of(GqlError.NO_MUTATION_TYPE));
        };
    }
}
