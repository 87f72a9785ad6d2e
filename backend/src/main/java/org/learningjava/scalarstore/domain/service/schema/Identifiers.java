package org.learningjava.scalarstore.domain.service.schema;

import org.learningjava.scalarstore.domain.error.InvalidIdentifierException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The single gate for everything interpolated into generated statements: identifiers are
 * validated against a strict grammar, values are rendered as escaped literals.
 */
public final class Identifiers {

    private static final Pattern SAFE = Pattern.compile("^[a-z_][a-z0-9_]{1,63}$");

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private Identifiers() {
    }

    public static boolean isSafe(String identifier) {
        return identifier != null && SAFE.matcher(identifier).matches();
    }

    public static String requireSafe(String identifier) {
        if (!isSafe(identifier)) {
            throw new InvalidIdentifierException(identifier);
        }
        return identifier;
    }

    public static List<String> requireSafe(Collection<String> identifiers) {
        return identifiers.stream().map(Identifiers::requireSafe).toList();
    }

    /** Single-quoted string literal with backslashes and quotes escaped. */
    public static String stringLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        StringBuilder sb = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\0' -> sb.append("\\0");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    public static String stringListLiteral(Collection<String> values) {
        return values.stream().map(Identifiers::stringLiteral).collect(Collectors.joining(", "));
    }

    public static String stringArrayLiteral(Collection<String> values) {
        return "[" + stringListLiteral(values) + "]";
    }

    public static String doubleLiteral(Double value) {
        if (value == null) {
            return "NULL";
        }
        if (value.isNaN()) {
            return "nan";
        }
        if (value.isInfinite()) {
            return value > 0 ? "inf" : "-inf";
        }
        return Double.toString(value);
    }

    /** Millisecond-precision UTC timestamp literal. */
    public static String timestampLiteral(Instant instant) {
        return "toDateTime64(" + stringLiteral(TIMESTAMP_FORMAT.format(instant.truncatedTo(ChronoUnit.MILLIS)))
                + ", 3, 'UTC')";
    }
}
