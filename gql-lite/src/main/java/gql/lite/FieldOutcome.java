package gql.lite;

/// Result of obtaining one field's raw value: either the value or the error that stops execution.
sealed interface FieldOutcome permits FieldOutcome.Value, FieldOutcome.Failure {

    static FieldOutcome value(Object raw) {
        return new Value(raw);
    }

    static FieldOutcome failure(GqlException error) {
        return new Failure(error);
    }

    /// Raw value, may be null
    record Value(Object raw) implements FieldOutcome {
    }

    record Failure(GqlException error) implements FieldOutcome {
    }
}
