package gql.lite;

import java.util.Objects;
import java.util.logging.Logger;

/// Parser for query text into an operation kind and a [SelectionSet].
///
/// Supported syntax:
/// - `query { ... }`, `mutation { ... }` (keyword case-insensitive) or a bare `{ ... }` meaning query
/// - field names made of `[A-Za-z0-9_]`, separated by whitespace
/// - nested selections `field { sub }` to any depth
/// - `#` comments running to the end of the line
///
/// Aliases, arguments, fragments, variables and directives are not recognized. A field repeated at
/// the same level keeps its first position and takes the selection of its last occurrence.
public final class QueryParser {

    private static final Logger LOG = Logger.getLogger(QueryParser.class.getName());

    private static final int TOKEN_CONTEXT = 20;

    private final String text;

    private QueryParser(String text) {
        this.text = text;
    }

    /// Parses query text.
    /// @param query the query text
    /// @return the operation kind and selection tree
    /// @throws NullPointerException if query is null
    /// @throws GqlParseException if the text is empty, has an unknown top-level form, unbalanced
    ///         braces or a token that is not a field name; its position is an offset into the
    ///         comment-stripped, trimmed text carried as [GqlParseException#query()]
    public static ParsedQuery parse(String query) {
        Objects.requireNonNull(query, "query must not be null");
        LOG.fine(() -> "Parsing query: " + query);

        final var stripped = stripComments(query).trim();
        if (stripped.isEmpty()) {
            throw new GqlParseException(GqlError.EMPTY_QUERY);
        }
        final var parsed = new QueryParser(stripped).parseOperation();
        LOG.finer(() -> "Parsed query: " + parsed);
        return parsed;
    }

    /// Parses one selection body such as `{ id name }` or `id name` without the top-level
    /// operation and brace-count checks.
    static SelectionSet parseSelections(String body) {
        Objects.requireNonNull(body, "body must not be null");
        final var parser = new QueryParser(body);
        return parser.parseSelectionSet(0, body.length());
    }

    /// Removes each `#` and the rest of its line, together with the whitespace just before it.
    static String stripComments(String query) {
        final var sb = new StringBuilder(query.length());
        int i = 0;
        while (i < query.length()) {
            final char c = query.charAt(i);
            if (c == '#') {
                int end = sb.length();
                while (end > 0 && Character.isWhitespace(sb.charAt(end - 1))) {
                    end--;
                }
                sb.setLength(end);
                while (i < query.length() && query.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    private ParsedQuery parseOperation() {
        OperationType operation = null;
        int bodyStart = -1;

        for (OperationType candidate : OperationType.values()) {
            final var keyword = candidate.keyword();
            if (text.regionMatches(true, 0, keyword, 0, keyword.length())) {
                final int brace = skipWhitespace(keyword.length(), text.length());
                if (brace < text.length() && text.charAt(brace) == '{') {
                    operation = candidate;
                    bodyStart = brace;
                    break;
                }
            }
        }

        if (operation == null) {
            if (text.charAt(0) != '{') {
                throw new GqlParseException(text, 0, GqlError.UNSUPPORTED_QUERY_FORMAT);
            }
            operation = OperationType.QUERY;
            bodyStart = 0;
        }

        checkBraceCount(bodyStart);

        final var selections = parseSelectionSet(bodyStart, text.length());
        return new ParsedQuery(operation, selections);
    }

    private void checkBraceCount(int from) {
        int open = 0;
        int close = 0;
        for (int i = from; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '{') {
                open++;
            } else if (c == '}') {
                close++;
            }
        }
        if (open != close) {
            throw new GqlParseException(GqlError.MISMATCHED_BRACES);
        }
    }

    /// Parses the fields in `text[start, end)`, dropping one pair of enclosing braces if present.
    private SelectionSet parseSelectionSet(int start, int end) {
        start = skipWhitespace(start, end);
        end = trimEnd(start, end);
        if (end - start >= 2 && text.charAt(start) == '{' && text.charAt(end - 1) == '}') {
            start = skipWhitespace(start + 1, end - 1);
            end = trimEnd(start, end - 1);
        }
        if (start >= end) {
            return SelectionSet.empty();
        }

        final var builder = SelectionSet.builder();
        int pos = start;
        while (pos < end) {
            pos = skipWhitespace(pos, end);
            final int nameStart = pos;
            while (pos < end && isNameChar(text.charAt(pos))) {
                pos++;
            }
            if (pos == nameStart) {
                final var near = text.substring(pos, Math.min(pos + TOKEN_CONTEXT, end));
                throw new GqlParseException(text, pos, GqlError.UNEXPECTED_TOKEN, near);
            }
            final var fieldName = text.substring(nameStart, pos);
            pos = skipWhitespace(pos, end);

            if (pos < end && text.charAt(pos) == '{') {
                final int braceStart = pos;
                int depth = 1;
                pos++;
                while (pos < end && depth > 0) {
                    final char c = text.charAt(pos);
                    if (c == '{') {
                        depth++;
                    } else if (c == '}') {
                        depth--;
                    }
                    pos++;
                }
                if (depth != 0) {
                    throw new GqlParseException(text, braceStart, GqlError.UNBALANCED_FIELD_BRACES, fieldName);
                }
                final var nested = parseSelectionSet(braceStart, pos);
                LOG.finer(() -> "Parsed field " + fieldName + " with selection " + nested);
                builder.field(fieldName, nested);
                pos = skipWhitespace(pos, end);
            } else {
                LOG.finer(() -> "Parsed leaf field " + fieldName);
                builder.leaf(fieldName);
            }
        }
        return builder.build();
    }

    private int skipWhitespace(int pos, int end) {
        while (pos < end && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private int trimEnd(int start, int end) {
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    private static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '_';
    }
}
