package org.quarry.formula.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.quarry.formula.api.FormulaErrorCode;
import org.quarry.formula.api.FormulaException;
import org.quarry.formula.api.MentionEntity;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversion and rendering rules shared by the evaluator and the built-in functions.
 * <p>
 * Numbers are carried as {@link Double}; any other {@link Number} supplied by a caller is read through
 * {@link Number#doubleValue()}.
 */
public final class FormulaValues {

    /** Leading numeric prefix, so that {@code "12px"} reads as 12. */
    private static final Pattern NUMERIC_PREFIX = Pattern.compile("^\\s*[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final DateTimeFormatter ISO_MILLIS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter ISO_DATE_OR_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final double MAX_PLAIN_INTEGRAL = 1e15;

    private FormulaValues() {
        // Private constructor to prevent instantiation
    }

    /**
     * Converts a value to a number.
     * @param value A number or a string with a numeric prefix.
     * @return The numeric value.
     * @throws FormulaException with code {@link FormulaErrorCode#TYPE_ERROR} for anything else.
     */
    public static double toNumber(Object value) throws FormulaException {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            OptionalDouble parsed = parseNumericPrefix(text);
            if (parsed.isPresent()) {
                return parsed.getAsDouble();
            }
            throw new FormulaException("Cannot convert string \"" + text + "\" to number", FormulaErrorCode.TYPE_ERROR);
        }
        throw new FormulaException("Cannot convert " + typeName(value) + " to number", FormulaErrorCode.TYPE_ERROR);
    }

    /**
     * Reads the leading number of a string, e.g. 12 for {@code "12px"}.
     * @return The number, or empty if the string does not start with one.
     */
    public static OptionalDouble parseNumericPrefix(String text) {
        Matcher matcher = NUMERIC_PREFIX.matcher(text);
        if (matcher.find()) {
            return OptionalDouble.of(Double.parseDouble(matcher.group().trim()));
        }
        return OptionalDouble.empty();
    }

    /**
     * Equality used by {@code =}/{@code ==} and by the record matching of the aggregate functions:
     * numbers compare numerically, everything else by {@link Objects#equals(Object, Object)}.
     */
    public static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        return Objects.equals(left, right);
    }

    /**
     * Converts a value to a point in time.
     * @param value An {@link Instant}, an ISO-8601 date or date-time string, or epoch milliseconds.
     * @return The instant.
     * @throws FormulaException with code {@link FormulaErrorCode#TYPE_ERROR} if the value is not a date.
     */
    public static Instant toDate(Object value) throws FormulaException {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        if (value instanceof String text) {
            try {
                TemporalAccessor parsed = ISO_DATE_OR_DATE_TIME.parseBest(text.trim(),
                        OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
                if (parsed instanceof OffsetDateTime offsetDateTime) {
                    return offsetDateTime.toInstant();
                }
                if (parsed instanceof LocalDateTime localDateTime) {
                    return localDateTime.toInstant(ZoneOffset.UTC);
                }
                return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException e) {
                throw new FormulaException("Cannot convert string \"" + text + "\" to date", FormulaErrorCode.TYPE_ERROR, e);
            }
        }
        throw new FormulaException("Cannot convert " + typeName(value) + " to date", FormulaErrorCode.TYPE_ERROR);
    }

    /**
     * Wraps a value as a list: lists are returned as is, {@code null} becomes empty, scalars become singletons.
     */
    public static List<Object> toList(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        return Collections.singletonList(value);
    }

    /**
     * Flattens arguments one level (arrays are spread) and converts every element to a number.
     */
    public static List<Double> flattenNumbers(List<Object> arguments) throws FormulaException {
        List<Double> numbers = new ArrayList<>();
        for (Object argument : arguments) {
            for (Object element : toList(argument)) {
                numbers.add(toNumber(element));
            }
        }
        return numbers;
    }

    /**
     * Converts a value to text the way string functions and concatenation see it:
     * {@code null} is empty, numbers render without a trailing {@code .0}, arrays and objects render as JSON.
     */
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Number number) {
            return formatNumber(number.doubleValue());
        }
        if (value instanceof Instant instant) {
            return formatIsoDate(instant);
        }
        if (value instanceof Collection<?> || value instanceof Map<?, ?> || value instanceof MentionEntity) {
            return toJson(value);
        }
        return String.valueOf(value);
    }

    /**
     * Renders a value for display next to a formula.
     */
    public static String toDisplayString(Object value) {
        if (value instanceof Collection<?> collection) {
            List<String> parts = new ArrayList<>();
            for (Object element : collection) {
                parts.add(toDisplayString(element));
            }
            return String.join(", ", parts);
        }
        return toText(value);
    }

    /**
     * Formats a number like a decimal literal, never in scientific notation:
     * {@code 42}, {@code 3.14}, {@code 0.0005}, {@code 1000000000000000}.
     */
    public static String formatNumber(double number) {
        if (Double.isNaN(number)) {
            return "NaN";
        }
        if (Double.isInfinite(number)) {
            return number > 0 ? "Infinity" : "-Infinity";
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    /**
     * Formats an instant as ISO-8601 UTC with millisecond precision, e.g. {@code 2024-01-15T10:30:00.000Z}.
     */
    public static String formatIsoDate(Instant instant) {
        return ISO_MILLIS.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    /**
     * Truthiness used by conditionals and logic functions: {@code null}, {@code false}, zero, NaN
     * and the empty string are falsy; everything else is truthy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean bool) return bool;
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String text) return !text.isEmpty();
        return true;
    }

    /**
     * Normalizes a caller-supplied value into the engine's value model: numbers become {@link Double},
     * mention entities become maps, nested collections are normalized recursively.
     */
    public static Object normalize(Object value) {
        if (value instanceof Double || value instanceof String || value instanceof Boolean
                || value instanceof Instant || value == null) {
            return value;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof MentionEntity entity) {
            return normalize(entity.toValue());
        }
        if (value instanceof Collection<?> collection) {
            List<Object> normalized = new ArrayList<>();
            for (Object element : collection) {
                normalized.add(normalize(element));
            }
            return Collections.unmodifiableList(normalized);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                normalized.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return Collections.unmodifiableMap(normalized);
        }
        return value;
    }

    /**
     * @return A short, user-facing name of the value's kind.
     */
    public static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof String) return "string";
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Instant) return "date";
        if (value instanceof Collection<?>) return "array";
        return "object";
    }

    private static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(jsonReady(value));
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static Object jsonReady(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && Math.abs(d) < MAX_PLAIN_INTEGRAL) {
                return (long) d;
            }
            return d;
        }
        if (value instanceof Instant instant) {
            return formatIsoDate(instant);
        }
        if (value instanceof MentionEntity entity) {
            return jsonReady(entity.toValue());
        }
        if (value instanceof Collection<?> collection) {
            List<Object> elements = new ArrayList<>();
            for (Object element : collection) {
                elements.add(jsonReady(element));
            }
            return elements;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), jsonReady(entry.getValue()));
            }
            return entries;
        }
        return value;
    }
}
