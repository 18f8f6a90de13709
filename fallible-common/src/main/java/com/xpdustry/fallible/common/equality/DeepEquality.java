package com.xpdustry.fallible.common.equality;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import org.jspecify.annotations.Nullable;

/**
 * Recursive value equality.
 *
 * <p>Arrays, lists, sets, maps, map entries, optionals and records are compared by content, all the way down. Any
 * other object falls back to its own {@code equals}. Values of different types are never coerced, so {@code 123} and
 * {@code "123"} differ, and so do {@code 123} and {@code 123L}. Cyclic structures are not supported.
 */
public final class DeepEquality {

    private DeepEquality() {}

    public static boolean deepEquals(final @Nullable Object a, final @Nullable Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a.getClass().isArray() || b.getClass().isArray()) {
            return a.getClass().isArray() && b.getClass().isArray() && arrayEquals(a, b);
        }
        if (a instanceof Record || b instanceof Record) {
            return a.getClass() == b.getClass() && recordEquals((Record) a, (Record) b);
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            return x.size() == y.size() && iteratorEquals(x.iterator(), y.iterator());
        }
        if (a instanceof Set<?> x && b instanceof Set<?> y) {
            return x.size() == y.size() && containsAllDeep(x, y) && containsAllDeep(y, x);
        }
        if (a instanceof Map<?, ?> x && b instanceof Map<?, ?> y) {
            return x.size() == y.size() && mapEquals(x, y);
        }
        if (a instanceof Map.Entry<?, ?> x && b instanceof Map.Entry<?, ?> y) {
            return deepEquals(x.getKey(), y.getKey()) && deepEquals(x.getValue(), y.getValue());
        }
        if (a instanceof Optional<?> x && b instanceof Optional<?> y) {
            return deepEquals(x.orElse(null), y.orElse(null));
        }
        return a.equals(b);
    }

    public static int deepHashCode(final @Nullable Object value) {
        if (value == null) {
            return 0;
        }
        if (value.getClass().isArray()) {
            int hash = 1;
            for (int i = 0; i < Array.getLength(value); i++) {
                hash = 31 * hash + deepHashCode(Array.get(value, i));
            }
            return hash;
        }
        if (value instanceof Record record) {
            int hash = record.getClass().hashCode();
            for (final var component : record.getClass().getRecordComponents()) {
                hash = 31 * hash + deepHashCode(read(record, component));
            }
            return hash;
        }
        if (value instanceof List<?> list) {
            int hash = 1;
            for (final var element : list) {
                hash = 31 * hash + deepHashCode(element);
            }
            return hash;
        }
        if (value instanceof Set<?> set) {
            int hash = 0;
            for (final var element : set) {
                hash += deepHashCode(element);
            }
            return hash;
        }
        if (value instanceof Map<?, ?> map) {
            int hash = 0;
            for (final var entry : map.entrySet()) {
                hash += deepHashCode(entry.getKey()) ^ deepHashCode(entry.getValue());
            }
            return hash;
        }
        if (value instanceof Map.Entry<?, ?> entry) {
            return deepHashCode(entry.getKey()) ^ deepHashCode(entry.getValue());
        }
        if (value instanceof Optional<?> optional) {
            return deepHashCode(optional.orElse(null));
        }
        return value.hashCode();
    }

    private static boolean arrayEquals(final Object a, final Object b) {
        // int[] and Integer[] hold the same values but are different shapes
        if ((a.getClass().getComponentType().isPrimitive() || b.getClass().getComponentType().isPrimitive())
                && a.getClass() != b.getClass()) {
            return false;
        }
        final var length = Array.getLength(a);
        if (length != Array.getLength(b)) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (!deepEquals(Array.get(a, i), Array.get(b, i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean recordEquals(final Record a, final Record b) {
        for (final var component : a.getClass().getRecordComponents()) {
            if (!deepEquals(read(a, component), read(b, component))) {
                return false;
            }
        }
        return true;
    }

    private static boolean iteratorEquals(final Iterator<?> a, final Iterator<?> b) {
        while (a.hasNext() && b.hasNext()) {
            if (!deepEquals(a.next(), b.next())) {
                return false;
            }
        }
        return !a.hasNext() && !b.hasNext();
    }

    private static boolean containsAllDeep(final Set<?> container, final Set<?> elements) {
        for (final var element : elements) {
            if (lookup(() -> container.contains(element))) {
                continue;
            }
            if (container.stream().noneMatch(candidate -> deepEquals(candidate, element))) {
                return false;
            }
        }
        return true;
    }

    private static boolean mapEquals(final Map<?, ?> a, final Map<?, ?> b) {
        for (final var entry : a.entrySet()) {
            if (lookup(() -> b.containsKey(entry.getKey()))) {
                if (!deepEquals(entry.getValue(), b.get(entry.getKey()))) {
                    return false;
                }
                continue;
            }
            final var found = b.entrySet().stream()
                    .anyMatch(other -> deepEquals(entry.getKey(), other.getKey())
                            && deepEquals(entry.getValue(), other.getValue()));
            if (!found) {
                return false;
            }
        }
        return true;
    }

    // Immutable and sorted collections reject null or foreign keys on lookup instead of answering false
    private static boolean lookup(final BooleanSupplier query) {
        try {
            return query.getAsBoolean();
        } catch (final NullPointerException | ClassCastException e) {
            return false;
        }
    }

    private static @Nullable Object read(final Record record, final RecordComponent component) {
        final var accessor = component.getAccessor();
        try {
            if (!accessor.canAccess(record)) {
                accessor.setAccessible(true);
            }
            return accessor.invoke(record);
        } catch (final IllegalAccessException e) {
            throw new IllegalStateException(
                    "Cannot read component " + component.getName() + " of " + record.getClass().getName(), e);
        } catch (final InvocationTargetException e) {
            throw new IllegalStateException(
                    "Accessor of component " + component.getName() + " of " + record.getClass().getName() + " failed",
                    e.getCause());
        }
    }
}
