package de.bsommerfeld.todos.core.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Result of coercing a loosely typed "completed" input into the 0/1 value the
 * {@code todos.completed} column stores.
 *
 * <p>
 * Coercion table:
 * <ul>
 * <li>{@link Boolean}: maps directly</li>
 * <li>{@link Number}: zero (or NaN) is {@link #FALSE}, anything else
 * {@link #TRUE}</li>
 * <li>{@link String} (trimmed, case-insensitive): {@code "true"}/{@code "1"}
 * is {@link #TRUE}, {@code "false"}/{@code "0"} is {@link #FALSE}</li>
 * <li>everything else, {@code null} included: {@link #UNSPECIFIED}</li>
 * </ul>
 *
 * <p>
 * {@link #UNSPECIFIED} carries no storable value. Callers pick the default
 * that fits their context via {@link #orElse(boolean)}: {@code false} when
 * creating an item, the existing value when patching one.
 */
public enum Completion {

    TRUE,
    FALSE,
    UNSPECIFIED;

    public static Completion coerce(Object raw) {
        if (raw instanceof Boolean b) {
            return b ? TRUE : FALSE;
        }
        if (raw instanceof Number n) {
            return coerceNumber(n);
        }
        if (raw instanceof CharSequence s) {
            return switch (s.toString().trim().toLowerCase(Locale.ROOT)) {
                case "true", "1" -> TRUE;
                case "false", "0" -> FALSE;
                default -> UNSPECIFIED;
            };
        }
        return UNSPECIFIED;
    }

    private static Completion coerceNumber(Number n) {
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            return (d == 0 || Double.isNaN(d)) ? FALSE : TRUE;
        }
        if (n instanceof BigDecimal bd) {
            return bd.signum() == 0 ? FALSE : TRUE;
        }
        if (n instanceof BigInteger bi) {
            return bi.signum() == 0 ? FALSE : TRUE;
        }
        return n.longValue() == 0 ? FALSE : TRUE;
    }

    /**
     * Normalizes a value read back from the {@code completed} column. Rows
     * written by this store hold 0/1, older rows may hold a boolean or a
     * {@code "true"} string. Anything that does not coerce to {@link #TRUE}
     * reads as {@code false}.
     */
    public static boolean fromStored(Object stored) {
        return coerce(stored) == TRUE;
    }

    public static Completion of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isSpecified() {
        return this != UNSPECIFIED;
    }

    public boolean orElse(boolean fallback) {
        return switch (this) {
            case TRUE -> true;
            case FALSE -> false;
            case UNSPECIFIED -> fallback;
        };
    }

    /**
     * @return 1 or 0 for the {@code completed} column
     * @throws IllegalStateException for {@link #UNSPECIFIED}, which must be
     *                               resolved with {@link #orElse(boolean)} first
     */
    public int toStored() {
        return switch (this) {
            case TRUE -> 1;
            case FALSE -> 0;
            case UNSPECIFIED -> throw new IllegalStateException(
                    "UNSPECIFIED completion has no stored form; resolve a default first");
        };
    }
}
