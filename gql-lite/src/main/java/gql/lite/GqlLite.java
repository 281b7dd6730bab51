package gql.lite;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for hosts: parses query text and executes it against a schema.
///
/// Usage:
/// ```java
/// GqlType.ObjectType query = GqlType.object("Query", Map.of(
///     "hello", FieldDefinition.of(GqlType.STRING, (parent, args) -> "World")));
/// GqlLite engine = GqlLite.of(new Schema(query));
/// Map<String, Object> result = engine.execute("{ hello }"); // {hello=World}
/// ```
///
/// Instances are immutable and may be shared between threads.
public final class GqlLite {

    private static final Logger LOG = Logger.getLogger(GqlLite.class.getName());

    private final Executor executor;

    private GqlLite(Executor executor) {
        this.executor = executor;
    }

    public static GqlLite of(Schema schema) {
        return new GqlLite(new Executor(schema));
    }

    /// @param lookup default resolution for fields without a resolver
    public static GqlLite of(Schema schema, FieldLookup lookup) {
        return new GqlLite(new Executor(schema, lookup));
    }

    public Schema schema() {
        return executor.schema();
    }

    /// Parses and executes `query` with a null root value.
    public Map<String, Object> execute(String query) {
        return execute(query, null);
    }

    /// Parses and executes `query`.
    /// @throws GqlParseException if the text cannot be parsed
    /// @throws GqlException on any execution failure
    public Map<String, Object> execute(String query, Object rootValue) {
        Objects.requireNonNull(query, "query must not be null");
        final var parsed = QueryParser.parse(query);
        LOG.fine(() -> "Running " + parsed);
        return executor.execute(parsed, rootValue);
    }
}
