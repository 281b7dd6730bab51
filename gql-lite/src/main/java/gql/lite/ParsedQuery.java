package gql.lite;

import java.util.Objects;

/// Output of [QueryParser#parse]: the operation kind and the requested selection tree.
public record ParsedQuery(OperationType operation, SelectionSet selections) {
    public ParsedQuery {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(selections, "selections must not be null");
    }

    /// Reconstructs the canonical query text, e.g. `mutation { createUser { id } }`.
    @Override
    public String toString() {
        return operation.keyword() + " " + selections;
    }
}
