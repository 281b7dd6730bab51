package gql.lite;

/// Message templates for every failure the engine can raise.
/// Each entry belongs to one [Category] so hosts can map errors to their own response codes.
public enum GqlError {
    /// Root query type is not an object type
    QUERY_TYPE_NOT_OBJECT(Category.SCHEMA, "Query type must be an ObjectType."),

    /// Root mutation type is not an object type
    MUTATION_TYPE_NOT_OBJECT(Category.SCHEMA, "Mutation type must be an ObjectType."),

    /// Field map requested from a non-object type
    FIELDS_ON_NON_OBJECT(Category.SCHEMA, "Cannot get fields from a non-object type (%s)."),

    /// Single field requested from a non-object type
    FIELD_ON_NON_OBJECT(Category.SCHEMA, "Cannot get field '%s' from a non-object type (%s)."),

    /// Wrapped type requested from a scalar or object type
    OF_TYPE_ON_UNWRAPPED(Category.SCHEMA, "Cannot get 'ofType' from a non-LIST or non-NON_NULL type (%s)."),

    EMPTY_QUERY(Category.PARSE, "Empty query string."),

    UNSUPPORTED_QUERY_FORMAT(Category.PARSE, "Unsupported query format. Expected 'query {' or 'mutation {' or '{'."),

    MISMATCHED_BRACES(Category.PARSE, "Mismatched curly braces in query."),

    UNBALANCED_FIELD_BRACES(Category.PARSE, "Unbalanced braces in field '%s'."),

    UNEXPECTED_TOKEN(Category.PARSE, "Unexpected token near: %s..."),

    UNSUPPORTED_OPERATION(Category.EXECUTION, "Unsupported operation type: %s"),

    NO_MUTATION_TYPE(Category.EXECUTION, "Schema does not define a Mutation type."),

    /// Selection set applied to a scalar or list type
    SELECTION_ON_NON_OBJECT(Category.EXECUTION, "Cannot resolve selections on a non-object type (%s)."),

    FIELD_NOT_FOUND(Category.EXECUTION, "Cannot query field \"%s\" on type \"%s\"."),

    /// Default field resolution could not read the source value
    FIELD_LOOKUP_FAILED(Category.EXECUTION, "Default resolution of field \"%s\" failed: %s"),

    RESOLVER_FAILED(Category.RESOLVER, "Resolver for field \"%s\" threw an exception: %s"),

    NON_NULL_VIOLATION(Category.COERCION, "Cannot return null for non-nullable type %s."),

    NOT_ITERABLE(Category.COERCION, "Value is not iterable for List type %s: %s"),

    INVALID_INT(Category.COERCION, "Value is not a valid Int: %s"),

    INVALID_FLOAT(Category.COERCION, "Value is not a valid Float: %s"),

    NOT_AN_OBJECT(Category.COERCION, "Value cannot be coerced to object type %s: %s"),

    /// Scalar name outside the built-in set
    UNKNOWN_SCALAR(Category.COERCION, "Unknown scalar type: %s"),

    UNSUPPORTED_KIND(Category.COERCION, "Unsupported type kind for coercion: %s");

    /// Broad families of failure
    public enum Category {
        SCHEMA,
        PARSE,
        EXECUTION,
        RESOLVER,
        COERCION
    }

    private final Category category;
    private final String messageTemplate;

    GqlError(Category category, String messageTemplate) {
        this.category = category;
        this.messageTemplate = messageTemplate;
    }

    public Category category() {
        return category;
    }

    /// Formats the template with the given arguments.
    public String message(Object... args) {
        return String.format(messageTemplate, args);
    }
}
