package gql.lite;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Shapes a raw field value into the form its declared type mandates.
///
/// Null passes through every nullable type; a [GqlType.NonNullType] rejects it after coercing
/// the wrapped type. Lists accept any single value as a one-element sequence.
final class ValueCoercer {

    private static final Logger LOG = Logger.getLogger(ValueCoercer.class.getName());

    /// Decimal or exponent notation, optional sign
    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private ValueCoercer() {
        // utility class
    }

    /// Coerces `value` against `type`.
    /// @throws GqlException on a null for a non-null type or a value the type cannot represent
    static Object coerce(Object value, GqlType type) {
        if (type instanceof GqlType.NonNullType nonNull) {
            final Object coerced = coerce(value, nonNull.ofType());
            if (coerced == null) {
                throw GqlException.of(GqlError.NON_NULL_VIOLATION, type.name());
            }
            return coerced;
        }
        if (type instanceof GqlType.ListType list) {
            if (value == null) {
                return null;
            }
            List<Object> items = elements(value);
            if (items == null) {
                LOG.finer(() -> "Wrapping single value as list for " + type.name());
                items = List.of(value);
            }
            final var out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(coerce(item, list.ofType()));
            }
            return Collections.unmodifiableList(out);
        }
        if (type instanceof GqlType.Scalar scalar) {
            return value == null ? null : coerceScalar(value, scalar.scalarKind());
        }
        if (type instanceof GqlType.ObjectType) {
            return value == null ? null : toPlainMap(value, type);
        }
        throw GqlException.of(GqlError.UNSUPPORTED_KIND, type.kind());
    }

    static Object coerceScalar(Object value, ScalarKind kind) {
        return switch (kind) {
            case STRING, ID -> String.valueOf(value);
            case INT -> coerceInt(value);
            case BOOLEAN -> coerceBoolean(value);
            case FLOAT -> coerceFloat(value);
        };
    }

    /// Integral numbers within 32 bits, or text whose canonical integer form is the text itself.
    static Integer coerceInt(Object value) {
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).intValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                throw GqlException.caused(e, GqlError.INVALID_INT, GqlException.display(value));
            }
        }
        if (value instanceof CharSequence text) {
            final var s = text.toString();
            final int parsed;
            try {
                parsed = Integer.parseInt(s);
            } catch (NumberFormatException e) {
                throw GqlException.caused(e, GqlError.INVALID_INT, GqlException.display(value));
            }
            if (Integer.toString(parsed).equals(s)) {
                return parsed;
            }
        }
        throw GqlException.of(GqlError.INVALID_INT, GqlException.display(value));
    }

    /// Any number, or numeric text in decimal or exponent notation.
    static Double coerceFloat(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof CharSequence text) {
            final var s = text.toString().strip();
            if (NUMERIC.matcher(s).matches()) {
                return Double.parseDouble(s);
            }
        }
        throw GqlException.of(GqlError.INVALID_FLOAT, GqlException.display(value));
    }

    /// Recognizes `1/true/on/yes` and `0/false/off/no/""` in any case, then falls back to
    /// truthiness: zero, `"0"`, and empty containers are false, everything else true.
    static Boolean coerceBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            final var s = value.toString().strip().toLowerCase(Locale.ROOT);
            return switch (s) {
                case "1", "true", "on", "yes" -> true;
                case "0", "false", "off", "no", "" -> false;
                default -> true;
            };
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    /// Copies a composite value into a plain map: map entries, `key`/`value` of a single entry,
    /// record components, accessible public instance fields, or list elements keyed by index.
    static Map<String, Object> toPlainMap(Object value, GqlType type) {
        if (isScalarLike(value)) {
            throw GqlException.of(GqlError.NOT_AN_OBJECT, type.name(), GqlException.display(value));
        }
        final var out = new LinkedHashMap<String, Object>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> out.put(String.valueOf(k), v));
            return Collections.unmodifiableMap(out);
        }
        final List<Object> items = elements(value);
        if (items != null) {
            for (int i = 0; i < items.size(); i++) {
                out.put(Integer.toString(i), items.get(i));
            }
            return Collections.unmodifiableMap(out);
        }
        if (value instanceof Map.Entry<?, ?> entry) {
            out.put("key", entry.getKey());
            out.put("value", entry.getValue());
            return Collections.unmodifiableMap(out);
        }
        try {
            final Class<?> source = value.getClass();
            if (source.isRecord()) {
                for (RecordComponent component : source.getRecordComponents()) {
                    final Method accessor = FieldLookups.accessible(component.getAccessor(), value);
                    if (accessor != null) {
                        out.put(component.getName(), accessor.invoke(value));
                    }
                }
            } else {
                for (Field field : source.getFields()) {
                    if (!Modifier.isStatic(field.getModifiers())
                            && (field.canAccess(value) || field.trySetAccessible())) {
                        out.put(field.getName(), field.get(value));
                    }
                }
            }
        } catch (ReflectiveOperationException e) {
            throw GqlException.caused(e, GqlError.NOT_AN_OBJECT, type.name(), GqlException.display(value));
        }
        return Collections.unmodifiableMap(out);
    }

    /// Elements of an `Iterable` or array in encounter order, or null when the value is neither.
    static List<Object> elements(Object value) {
        if (value instanceof Iterable<?> iterable) {
            final var out = new ArrayList<Object>();
            iterable.forEach(out::add);
            return out;
        }
        if (value != null && value.getClass().isArray()) {
            final int length = Array.getLength(value);
            final var out = new ArrayList<Object>(length);
            for (int i = 0; i < length; i++) {
                out.add(Array.get(value, i));
            }
            return out;
        }
        return null;
    }

    private static boolean isScalarLike(Object value) {
        return value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum<?>;
    }
}
