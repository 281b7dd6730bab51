package gql.lite;

import java.util.Map;

/// Produces the raw value of one field from its parent value.
///
/// Implementations may throw any exception; the executor attributes it to the field being resolved.
/// A [GqlException] thrown from a resolver propagates unchanged.
@FunctionalInterface
public interface FieldResolver {

    /// @param parent the value of the enclosing object (the root value for root fields)
    /// @param args field arguments, currently always empty
    /// @return the raw field value, coerced afterwards against the field's declared type
    Object resolve(Object parent, Map<String, Object> args) throws Exception;
}
