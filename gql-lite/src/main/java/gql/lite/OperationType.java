package gql.lite;

import java.util.Locale;

/// Kind of operation a query text requests.
public enum OperationType {
    QUERY("query"),
    MUTATION("mutation");

    private final String keyword;

    OperationType(String keyword) {
        this.keyword = keyword;
    }

    /// Lower-case keyword used in query text.
    public String keyword() {
        return keyword;
    }

    /// Resolves an operation keyword, ignoring case.
    /// @throws GqlException for anything other than `query` or `mutation`
    public static OperationType fromKeyword(String keyword) {
        if (keyword != null) {
            final var normalized = keyword.trim().toLowerCase(Locale.ROOT);
            for (OperationType type : values()) {
                if (type.keyword.equals(normalized)) {
                    return type;
                }
            }
        }
        throw GqlException.of(GqlError.UNSUPPORTED_OPERATION, keyword);
    }
}
