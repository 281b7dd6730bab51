package gql.lite;

import java.util.Optional;

/// Reads a field's raw value from a source value when the field has no resolver.
///
/// Hosts supply one matching how their values are represented; [FieldLookups#defaults()] covers
/// maps, records, public fields and accessor methods.
@FunctionalInterface
public interface FieldLookup {

    /// @param source the parent value, may be null
    /// @param fieldName the requested field
    /// @return the raw value, or empty when the source has no such field or it holds null
    /// @throws Exception when reading an existing member fails
    Optional<Object> lookup(Object source, String fieldName) throws Exception;

    /// Tries this lookup first and falls back to `next` when it finds nothing.
    default FieldLookup orElse(FieldLookup next) {
        return (source, fieldName) -> {
            final var found = lookup(source, fieldName);
            return found.isPresent() ? found : next.lookup(source, fieldName);
        };
    }
}
