package gql.lite;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Stock [FieldLookup] strategies.
///
/// [#defaults()] reads maps by key; any other value is read through a record component or public
/// field first and a zero-argument accessor second.
public final class FieldLookups {

    private static final Logger LOG = Logger.getLogger(FieldLookups.class.getName());

    private static final FieldLookup MAP_KEYS = (source, fieldName) -> {
        if (source instanceof Map<?, ?> map) {
            return Optional.ofNullable(map.get(fieldName));
        }
        return Optional.empty();
    };

    private static final FieldLookup PROPERTIES = FieldLookups::readProperty;

    private static final FieldLookup ACCESSORS = FieldLookups::invokeAccessor;

    private static final FieldLookup MEMBERS = PROPERTIES.orElse(ACCESSORS);

    private static final FieldLookup DEFAULTS = (source, fieldName) -> {
        if (source == null) {
            return Optional.empty();
        }
        if (source instanceof Map<?, ?>) {
            return MAP_KEYS.lookup(source, fieldName);
        }
        return MEMBERS.lookup(source, fieldName);
    };

    private FieldLookups() {
        // utility class
    }

    /// Key lookup on `java.util.Map` sources; nothing for other values.
    public static FieldLookup mapKeys() {
        return MAP_KEYS;
    }

    /// Record component or public instance field named exactly like the field.
    public static FieldLookup properties() {
        return PROPERTIES;
    }

    /// Public zero-argument method named like the field, or its `getX` / `isX` bean getter.
    /// Methods declared by `java.lang.Object` are never called.
    public static FieldLookup accessors() {
        return ACCESSORS;
    }

    /// Maps by key, every other value by property then accessor.
    public static FieldLookup defaults() {
        return DEFAULTS;
    }

    /// Chains lookups; the first non-empty result wins.
    /// @throws IllegalArgumentException if no lookup is given
    public static FieldLookup firstOf(FieldLookup... lookups) {
        if (lookups.length == 0) {
            throw new IllegalArgumentException("At least one lookup is required");
        }
        FieldLookup chain = Objects.requireNonNull(lookups[0], "lookup must not be null");
        for (int i = 1; i < lookups.length; i++) {
            chain = chain.orElse(Objects.requireNonNull(lookups[i], "lookup must not be null"));
        }
        return chain;
    }

    private static Optional<Object> readProperty(Object source, String fieldName) throws Exception {
        if (source == null) {
            return Optional.empty();
        }
        final Class<?> type = source.getClass();
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                if (component.getName().equals(fieldName)) {
                    final Method accessor = accessible(component.getAccessor(), source);
                    return accessor == null ? Optional.empty() : Optional.ofNullable(invoke(accessor, source));
                }
            }
            return Optional.empty();
        }
        final Field field;
        try {
            field = type.getField(fieldName);
        } catch (NoSuchFieldException e) {
            return Optional.empty();
        }
        if (Modifier.isStatic(field.getModifiers())) {
            return Optional.empty();
        }
        if (!field.canAccess(source) && !field.trySetAccessible()) {
            LOG.finer(() -> "Field " + fieldName + " of " + type.getName() + " is not accessible");
            return Optional.empty();
        }
        return Optional.ofNullable(field.get(source));
    }

    private static Optional<Object> invokeAccessor(Object source, String fieldName) throws Exception {
        if (source == null || fieldName.isEmpty()) {
            return Optional.empty();
        }
        final var capitalized = fieldName.substring(0, 1).toUpperCase(Locale.ROOT) + fieldName.substring(1);
        for (String candidate : new String[]{fieldName, "get" + capitalized, "is" + capitalized}) {
            final var method = findAccessor(source, candidate);
            if (method != null) {
                return Optional.ofNullable(invoke(method, source));
            }
        }
        return Optional.empty();
    }

    private static Method findAccessor(Object source, String name) {
        final Method method = publicMethod(source.getClass(), name);
        if (method == null
                || Modifier.isStatic(method.getModifiers())
                || method.getReturnType() == void.class
                || method.getDeclaringClass() == Object.class) {
            return null;
        }
        return accessible(method, source);
    }

    /// Returns `method` if it can be invoked on `source`, otherwise the same method as declared by
    /// an accessible supertype, e.g. `Map.Entry#getKey` for the JDK's hidden entry classes.
    /// Null when no invocable variant exists.
    static Method accessible(Method method, Object source) {
        if (method.canAccess(source) || method.trySetAccessible()) {
            return method;
        }
        for (Class<?> supertype : supertypes(source.getClass())) {
            final Method candidate = publicMethod(supertype, method.getName());
            if (candidate != null && !Modifier.isStatic(candidate.getModifiers()) && candidate.canAccess(source)) {
                LOG.finer(() -> "Invoking " + method.getName() + " through " + candidate.getDeclaringClass().getName());
                return candidate;
            }
        }
        LOG.finer(() -> "Method " + method + " is not accessible");
        return null;
    }

    private static Method publicMethod(Class<?> type, String name) {
        try {
            return type.getMethod(name);
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    /// Superclasses and interfaces of `type`, nearest first.
    private static Set<Class<?>> supertypes(Class<?> type) {
        final var seen = new LinkedHashSet<Class<?>>();
        final var pending = new ArrayDeque<Class<?>>();
        pending.add(type);
        while (!pending.isEmpty()) {
            final Class<?> current = pending.poll();
            if (seen.add(current)) {
                if (current.getSuperclass() != null) {
                    pending.add(current.getSuperclass());
                }
                pending.addAll(Arrays.asList(current.getInterfaces()));
            }
        }
        seen.remove(type);
        return seen;
    }

    private static Object invoke(Method method, Object source) throws Exception {
        try {
            return method.invoke(source);
        } catch (InvocationTargetException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
