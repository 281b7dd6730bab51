package gql.lite;

/// Exception thrown when query text cannot be parsed into a selection tree.
public class GqlParseException extends GqlException {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final String query;

    /// Creates a parse exception without position information.
    public GqlParseException(GqlError error, Object... args) {
        super(error, error.message(args), null, null);
        this.position = -1;
        this.query = null;
    }

    /// Creates a parse exception pointing at a cursor position within the query text.
    public GqlParseException(String query, int position, GqlError error, Object... args) {
        super(error, formatMessage(error.message(args), query, position), null, null);
        this.position = position;
        this.query = query;
    }

    /// Returns the offset into [#query()] where the error occurred, or -1 if unknown.
    public int position() {
        return position;
    }

    /// Returns the text [#position()] points into, or null if unknown.
    /// For errors raised by [QueryParser#parse] this is the query after comments are stripped and
    /// surrounding whitespace is trimmed, not the caller's original string.
    public String query() {
        return query;
    }

    private static String formatMessage(String message, String query, int position) {
        if (query == null || position < 0) {
            return message;
        }
        return message + " (at position " + position + ")";
    }
}
