package com.myorg.blockquota.ledger.update;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Expected current value of a column.
 *
 * <p>{@link Kind#MATCH} accepts any of {@link #values()}; a null member matches a NULL column.
 * {@link Kind#NOT_MATCH} accepts anything but the listed values. With {@code autoNone} a NULL column
 * counts as "different", the way {@code !=} behaves in Java rather than in SQL, unless null itself is
 * one of the excluded values.
 */
public record Condition(Kind kind, List<Object> values, boolean autoNone) {

    public enum Kind { MATCH, NOT_MATCH }

    public Condition {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("condition needs at least one value");
        }
        // List.copyOf rejects nulls and null is a legitimate expected value
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Condition equalTo(Object value) {
        return new Condition(Kind.MATCH, Collections.singletonList(value), false);
    }

    public static Condition in(Collection<?> values) {
        return new Condition(Kind.MATCH, new ArrayList<>(values), false);
    }

    public static Condition not(Object value) {
        return not(value, true);
    }

    public static Condition not(Object value, boolean autoNone) {
        if (value instanceof Collection<?> c) return notIn(c, autoNone);
        return new Condition(Kind.NOT_MATCH, Collections.singletonList(value), autoNone);
    }

    public static Condition notIn(Collection<?> values) {
        return notIn(values, true);
    }

    public static Condition notIn(Collection<?> values, boolean autoNone) {
        return new Condition(Kind.NOT_MATCH, new ArrayList<>(values), autoNone);
    }

    /** Plain values become an equality, collections become IN, conditions pass through. */
    public static Condition of(Object expected) {
        if (expected instanceof Condition c) return c;
        if (expected instanceof Collection<?> c) return in(c);
        return equalTo(expected);
    }

    public boolean containsNull() {
        return values.contains(null);
    }

    /** Java-side evaluation, used for CASE branches and by tests to reason about a row. */
    public boolean test(Object actual) {
        boolean matched = false;
        for (Object v : values) {
            if (v == null ? actual == null : valueEquals(v, actual)) {
                matched = true;
                break;
            }
        }
        if (kind == Kind.MATCH) return matched;
        if (actual == null) return autoNone && !containsNull();
        return !matched;
    }

    private static boolean valueEquals(Object expected, Object actual) {
        if (actual == null) return false;
        if (expected instanceof Number a && actual instanceof Number b) {
            return a.longValue() == b.longValue();
        }
        return expected.equals(actual);
    }
}
