package gql.lite;

/// The closed set of shapes a [GqlType] can take.
public enum TypeKind {
    SCALAR,
    OBJECT,
    LIST,
    NON_NULL
}
