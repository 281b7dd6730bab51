package gql.lite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// The single failure type raised by schema construction, parsing and execution.
/// This is a runtime exception as every failure is fatal to the request that raised it.
///
/// Besides the message each error carries the [GqlError] that produced it and an extensions map
/// which always holds `code` and `category`. [#toMap()] renders the `{message, extensions}` shape
/// hosts put on the wire; the `debug` block is added when the system property
/// {@code gql.lite.debug} is `true`.
public class GqlException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = Logger.getLogger(GqlException.class.getName());

    /// System property key enabling the debug block in [#toMap()]
    public static final String DEBUG_PROPERTY = "gql.lite.debug";

    private static final boolean DEBUG_ENABLED;

    static {
        final String propertyValue = System.getProperty(DEBUG_PROPERTY);
        boolean debug = false;
        if (propertyValue != null) {
            final String normalized = propertyValue.trim().toLowerCase(Locale.ROOT);
            debug = switch (normalized) {
                case "true" -> {
                    LOG.fine(() -> "Error debug output enabled via system property");
                    yield true;
                }
                case "false" -> false;
                default -> {
                    LOG.warning(() -> "Invalid value for " + DEBUG_PROPERTY + ": " + propertyValue
                            + ". Debug output stays disabled");
                    yield false;
                }
            };
        }
        DEBUG_ENABLED = debug;
    }

    private final GqlError error;
    private final transient Map<String, Object> extensions;

    /// Creates an exception with an explicit message, extra extensions and cause.
    public GqlException(GqlError error, String message, Map<String, ?> extensions, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error must not be null");
        final var ext = new LinkedHashMap<String, Object>();
        ext.put("code", error.name());
        ext.put("category", error.category().name());
        if (extensions != null) {
            ext.putAll(extensions);
        }
        this.extensions = Collections.unmodifiableMap(ext);
    }

    /// Creates an exception whose message is the formatted template of `error`.
    public static GqlException of(GqlError error, Object... args) {
        return new GqlException(error, error.message(args), null, null);
    }

    /// Same as [#of] but keeps the triggering exception as cause.
    public static GqlException caused(Throwable cause, GqlError error, Object... args) {
        return new GqlException(error, error.message(args), null, cause);
    }

    public GqlError error() {
        return error;
    }

    public GqlError.Category category() {
        return error.category();
    }

    public Map<String, Object> extensions() {
        return extensions;
    }

    /// Whether [#toMap()] includes the debug block.
    public static boolean debugEnabled() {
        return DEBUG_ENABLED;
    }

    /// Converts this error to the `{message, extensions, debug?}` wire shape using the configured debug flag.
    public Map<String, Object> toMap() {
        return toMap(DEBUG_ENABLED);
    }

    /// Converts this error to the `{message, extensions, debug?}` wire shape.
    /// @param debug whether to add the `debug` block with file, line and stack trace
    public Map<String, Object> toMap(boolean debug) {
        final var out = new LinkedHashMap<String, Object>();
        out.put("message", getMessage());
        if (!extensions.isEmpty()) {
            out.put("extensions", extensions);
        }
        if (debug) {
            final var debugBlock = new LinkedHashMap<String, Object>();
            final StackTraceElement[] stack = getStackTrace();
            final StackTraceElement origin = origin(stack);
            if (origin != null) {
                debugBlock.put("file", origin.getFileName());
                debugBlock.put("line", origin.getLineNumber());
            }
            final var trace = new ArrayList<String>(stack.length);
            for (StackTraceElement element : stack) {
                trace.add(element.toString());
            }
            debugBlock.put("trace", List.copyOf(trace));
            out.put("debug", Collections.unmodifiableMap(debugBlock));
        }
        return Collections.unmodifiableMap(out);
    }

    /// First frame outside the static factories, i.e. where the error was raised.
    private static StackTraceElement origin(StackTraceElement[] stack) {
        for (StackTraceElement element : stack) {
            if (!element.getClassName().equals(GqlException.class.getName())) {
                return element;
            }
        }
        return stack.length > 0 ? stack[0] : null;
    }

    /// Renders a value for use inside an error message: strings quoted, everything else as text.
    static String display(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence text) {
            return "'" + text + "'";
        }
        if (value.getClass().isArray()) {
            return value.getClass().getComponentType().getSimpleName() + "[]";
        }
        return String.valueOf(value);
    }
}
