package gql.lite;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A field of an object type: its declared type, optional description, declared arguments and
/// optional resolver. Without a resolver the executor falls back to its [FieldLookup].
public record FieldDefinition(
        GqlType type,
        String description,
        Map<String, ArgumentDefinition> args,
        FieldResolver resolver
) {
    public FieldDefinition {
        Objects.requireNonNull(type, "type must not be null");
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public static FieldDefinition of(GqlType type) {
        return new FieldDefinition(type, null, Map.of(), null);
    }

    public static FieldDefinition of(GqlType type, FieldResolver resolver) {
        return new FieldDefinition(type, null, Map.of(), resolver);
    }

    public FieldDefinition withDescription(String newDescription) {
        return new FieldDefinition(type, newDescription, args, resolver);
    }

    public FieldDefinition withArgument(String name, ArgumentDefinition argument) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(argument, "argument must not be null");
        final var merged = new LinkedHashMap<>(args);
        merged.put(name, argument);
        return new FieldDefinition(type, description, merged, resolver);
    }

    public FieldDefinition withResolver(FieldResolver newResolver) {
        return new FieldDefinition(type, description, args, newResolver);
    }

    public boolean hasResolver() {
        return resolver != null;
    }
}
