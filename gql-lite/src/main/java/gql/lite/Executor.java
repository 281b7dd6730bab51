package gql.lite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Executes a selection tree against a schema and a root value.
///
/// Execution is one synchronous depth-first walk. Fields are resolved in selection order; the
/// first error aborts the whole request, so callers get either a complete result tree or a single
/// [GqlException]. The executor keeps no per-request state and may be shared between threads.
public final class Executor {

    private static final Logger LOG = Logger.getLogger(Executor.class.getName());

    private static final Map<String, Object> NO_ARGS = Map.of();

    private final Schema schema;
    private final FieldLookup lookup;

    public Executor(Schema schema) {
        this(schema, FieldLookups.defaults());
    }

    /// @param schema the schema to execute against
    /// @param lookup how fields without a resolver read their value from the parent value
    public Executor(Schema schema, FieldLookup lookup) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
    }

    public Schema schema() {
        return schema;
    }

    /// Executes a parsed query.
    /// @param query output of [QueryParser#parse]
    /// @param rootValue value handed to root field resolvers, may be null
    /// @return the result tree, keyed exactly like the selection tree
    /// @throws GqlException on the first failure
    public Map<String, Object> execute(ParsedQuery query, Object rootValue) {
        Objects.requireNonNull(query, "query must not be null");
        return execute(query.operation(), query.selections(), rootValue);
    }

    /// Executes a selection tree for an operation given by its keyword.
    /// @throws GqlException for an operation other than `query` or `mutation`, and on any execution failure
    public Map<String, Object> execute(String operationType, SelectionSet selections, Object rootValue) {
        return execute(OperationType.fromKeyword(operationType), selections, rootValue);
    }

    public Map<String, Object> execute(OperationType operation, SelectionSet selections, Object rootValue) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(selections, "selections must not be null");
        final var rootType = schema.rootType(operation);
        LOG.fine(() -> "Executing " + operation.keyword() + " on " + rootType.name() + ": " + selections);
        final var result = resolveSelections(selections, rootType, rootValue);
        LOG.fine(() -> "Executed " + operation.keyword() + " with " + result.size() + " root fields");
        return result;
    }

    /// Resolves every requested field of an object type against a source value.
    /// @throws GqlException if `type` is not an object type, a field does not exist on it, or
    ///         resolving or coercing any field fails
    public Map<String, Object> resolveSelections(SelectionSet selections, GqlType type, Object source) {
        if (!(type instanceof GqlType.ObjectType objectType)) {
            throw GqlException.of(GqlError.SELECTION_ON_NON_OBJECT, type.name());
        }

        final var result = new LinkedHashMap<String, Object>();
        for (var entry : selections.fields().entrySet()) {
            final var fieldName = entry.getKey();
            final var field = objectType.field(fieldName)
                    .orElseThrow(() -> GqlException.of(GqlError.FIELD_NOT_FOUND, fieldName, objectType.name()));
            LOG.finer(() -> "Resolving " + objectType.name() + "." + fieldName + ": " + field.type().name());

            final var outcome = fetch(fieldName, field, source);
            if (outcome instanceof FieldOutcome.Failure failure) {
                throw failure.error();
            }
            final Object raw = ((FieldOutcome.Value) outcome).raw();
            result.put(fieldName, complete(field.type(), entry.getValue(), raw));
        }
        return Collections.unmodifiableMap(result);
    }

    /// Obtains the raw value through the field's resolver, or the lookup when it has none.
    /// Our own errors pass through as they are; anything else is attributed to the field.
    private FieldOutcome fetch(String fieldName, FieldDefinition field, Object source) {
        if (field.hasResolver()) {
            try {
                return FieldOutcome.value(field.resolver().resolve(source, NO_ARGS));
            } catch (GqlException e) {
                return FieldOutcome.failure(e);
            } catch (Exception e) {
                LOG.warning(() -> "Resolver for field " + fieldName + " failed: " + e);
                return FieldOutcome.failure(GqlException.caused(e, GqlError.RESOLVER_FAILED, fieldName, e.getMessage()));
            }
        }
        try {
            return FieldOutcome.value(lookup.lookup(source, fieldName).orElse(null));
        } catch (GqlException e) {
            return FieldOutcome.failure(e);
        } catch (Exception e) {
            LOG.warning(() -> "Default resolution of field " + fieldName + " failed: " + e);
            return FieldOutcome.failure(GqlException.caused(e, GqlError.FIELD_LOOKUP_FAILED, fieldName, e.getMessage()));
        }
    }

    /// Recurses into object and list-of-object values, coerces everything else.
    private Object complete(GqlType type, SelectionSet selection, Object raw) {
        if (!descends(type, selection)) {
            return ValueCoercer.coerce(raw, type);
        }
        if (type instanceof GqlType.NonNullType nonNull) {
            final Object completed = complete(nonNull.ofType(), selection, raw);
            if (completed == null) {
                throw GqlException.of(GqlError.NON_NULL_VIOLATION, type.name());
            }
            return completed;
        }
        if (raw == null) {
            return null;
        }
        if (type instanceof GqlType.ListType list) {
            final List<Object> items = ValueCoercer.elements(raw);
            if (items == null) {
                throw GqlException.of(GqlError.NOT_ITERABLE, type.name(), GqlException.display(raw));
            }
            final var out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(completeListItem(list.ofType(), selection, item));
            }
            return Collections.unmodifiableList(out);
        }
        return resolveSelections(selection, type, raw);
    }

    private Object completeListItem(GqlType itemType, SelectionSet selection, Object item) {
        if (itemType instanceof GqlType.NonNullType nonNull) {
            final Object completed = completeListItem(nonNull.ofType(), selection, item);
            if (completed == null) {
                throw GqlException.of(GqlError.NON_NULL_VIOLATION, itemType.name());
            }
            return completed;
        }
        return item == null ? null : resolveSelections(selection, itemType, item);
    }

    /// Object types with a selection and lists of object types are walked field by field;
    /// a non-null wrapper is decided by what it wraps.
    private static boolean descends(GqlType type, SelectionSet selection) {
        if (type instanceof GqlType.NonNullType nonNull) {
            return descends(nonNull.ofType(), selection);
        }
        if (type instanceof GqlType.ObjectType) {
            return !selection.isEmpty();
        }
        if (type instanceof GqlType.ListType list) {
            return unwrapNonNull(list.ofType()) instanceof GqlType.ObjectType;
        }
        return false;
    }

    private static GqlType unwrapNonNull(GqlType type) {
        return type instanceof GqlType.NonNullType nonNull ? nonNull.ofType() : type;
    }
}
