package org.quarry.formula.functions;

import org.quarry.formula.runtime.FormulaValues;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import static org.quarry.formula.functions.Builtins.define;
import static org.quarry.formula.functions.Builtins.textArg;

/**
 * Date functions. Dates are interpreted and rendered in UTC.
 */
final class DateFunctions {

    private static final long MILLIS_PER_SECOND = 1000L;
    private static final long MILLIS_PER_MINUTE = 60 * MILLIS_PER_SECOND;
    private static final long MILLIS_PER_HOUR = 60 * MILLIS_PER_MINUTE;
    private static final long MILLIS_PER_DAY = 24 * MILLIS_PER_HOUR;

    private static final DateTimeFormatter SHORT = usFormat("MMM d");
    private static final DateTimeFormatter MEDIUM = usFormat("MMM d, yyyy");
    private static final DateTimeFormatter LONG = usFormat("EEEE, MMMM d, yyyy");
    private static final DateTimeFormatter ISO = usFormat("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = usFormat("hh:mm a");
    private static final DateTimeFormatter DATETIME = usFormat("MMM d, hh:mm a");

    private DateFunctions() {
        // Private constructor to prevent instantiation
    }

    static List<FunctionDefinition> definitions() {
        return List.of(
                define("Now", FunctionCategory.DATE, "Current date and time",
                        "Now() → \"2024-01-15T10:30:00.000Z\"", "datetime", List.of(),
                        (args, ctx) -> FormulaValues.formatIsoDate(ctx.now())),
                define("Today", FunctionCategory.DATE, "Current date (no time)",
                        "Today() → \"2024-01-15\"", "date", List.of(),
                        (args, ctx) -> ISO.format(ctx.now())),
                define("Duration", FunctionCategory.DATE, "Calculate duration between two dates",
                        "Duration(\"2024-01-01\", \"2024-01-04\") → 3", "number",
                        List.of(ParamInfo.required("start", "date", "Start date"),
                                ParamInfo.required("end", "date", "End date"),
                                ParamInfo.optional("unit", "string", "Unit (ms/seconds/minutes/hours/days)", "days")),
                        (args, ctx) -> {
                            Instant start = FormulaValues.toDate(args.get(0));
                            Instant end = FormulaValues.toDate(args.get(1));
                            long diffMs = end.toEpochMilli() - start.toEpochMilli();
                            return duration(diffMs, textArg(args, 2, "days"));
                        }),
                define("DateAdd", FunctionCategory.DATE, "Add duration to a date",
                        "DateAdd(\"2024-01-15\", 7, \"days\") → \"2024-01-22T00:00:00.000Z\"", "date",
                        List.of(ParamInfo.required("date", "date", "Base date"),
                                ParamInfo.required("amount", "number", "Amount to add"),
                                ParamInfo.optional("unit", "string", "Unit (minutes/hours/days/weeks/months/years)", "days")),
                        (args, ctx) -> {
                            ZonedDateTime date = FormulaValues.toDate(args.get(0)).atZone(ZoneOffset.UTC);
                            long amount = (long) FormulaValues.toNumber(args.get(1));
                            return FormulaValues.formatIsoDate(add(date, amount, textArg(args, 2, "days")).toInstant());
                        }),
                define("FormatDate", FunctionCategory.DATE, "Format date for display",
                        "FormatDate(\"2024-01-15\", \"short\") → \"Jan 15\"", "string",
                        List.of(ParamInfo.required("date", "date", "Date to format"),
                                ParamInfo.optional("format", "string", "Format style (short/medium/long/iso/time/datetime)", "medium")),
                        (args, ctx) -> format(FormulaValues.toDate(args.get(0)), textArg(args, 1, "medium"))),
                define("DayOfWeek", FunctionCategory.DATE, "Get day of week (0=Sunday, 6=Saturday)",
                        "DayOfWeek(\"2024-01-15\") → 1", "number",
                        List.of(ParamInfo.required("date", "date", "Date")),
                        (args, ctx) -> (double) (FormulaValues.toDate(args.get(0))
                                .atZone(ZoneOffset.UTC).getDayOfWeek().getValue() % 7))
        );
    }

    static double duration(long diffMs, String unit) {
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "milliseconds":
            case "ms":
                return diffMs;
            case "seconds":
            case "s":
                return Math.round((double) diffMs / MILLIS_PER_SECOND);
            case "minutes":
            case "m":
                return Math.round((double) diffMs / MILLIS_PER_MINUTE);
            case "hours":
            case "h":
                return Math.round((double) diffMs / MILLIS_PER_HOUR);
            default:
                return Math.round((double) diffMs / MILLIS_PER_DAY);
        }
    }

    private static ZonedDateTime add(ZonedDateTime date, long amount, String unit) {
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "minutes":
            case "m":
                return date.plusMinutes(amount);
            case "hours":
            case "h":
                return date.plusHours(amount);
            case "days":
            case "d":
                return date.plusDays(amount);
            case "weeks":
            case "w":
                return date.plusWeeks(amount);
            case "months":
                return date.plusMonths(amount);
            case "years":
            case "y":
                return date.plusYears(amount);
            default:
                return date;
        }
    }

    private static String format(Instant date, String style) {
        switch (style) {
            case "short":
                return SHORT.format(date);
            case "long":
                return LONG.format(date);
            case "iso":
                return ISO.format(date);
            case "time":
                return TIME.format(date);
            case "datetime":
                return DATETIME.format(date);
            default:
                return MEDIUM.format(date);
        }
    }

    private static DateTimeFormatter usFormat(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.US).withZone(ZoneOffset.UTC);
    }
}
