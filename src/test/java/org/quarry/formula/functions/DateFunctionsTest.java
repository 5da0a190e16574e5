package org.quarry.formula.functions;

import org.quarry.formula.api.FormulaErrorCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.quarry.formula.functions.FunctionTestSupport.assertFails;
import static org.quarry.formula.functions.FunctionTestSupport.call;

@Tag("unit")
class DateFunctionsTest {

    @Test
    void nowAndTodayUseTheContextClock() {
        assertThat(call("Now")).isEqualTo("2024-01-15T10:30:00.000Z");
        assertThat(call("Today")).isEqualTo("2024-01-15");
    }

    @ParameterizedTest
    @CsvSource({
            "2024-01-01, 2024-01-04, days, 3",
            "2024-01-01, 2024-01-04, d, 3",
            "2024-01-01, 2024-01-04, hours, 72",
            "2024-01-04, 2024-01-01, days, -3",
            "2024-01-01T00:00:00Z, 2024-01-01T00:01:30Z, minutes, 2",
            "2024-01-01T00:00:00Z, 2024-01-01T00:00:01.500Z, ms, 1500",
            "2024-01-01T00:00:00Z, 2024-01-01T00:00:42Z, s, 42"
    })
    void durationInUnits(String start, String end, String unit, double expected) {
        assertThat(call("Duration", start, end, unit)).isEqualTo(expected);
    }

    @Test
    void durationDefaultsToDays() {
        assertThat(call("Duration", "2024-01-01", "2024-01-11")).isEqualTo(10.0);
        assertThat(call("Duration", Instant.parse("2024-01-01T00:00:00Z"), "2024-01-02")).isEqualTo(1.0);
    }

    @Test
    void dateAddSupportsCalendarUnits() {
        assertThat(call("DateAdd", "2024-01-15", 7.0, "days")).isEqualTo("2024-01-22T00:00:00.000Z");
        assertThat(call("DateAdd", "2024-01-15", 2.0, "weeks")).isEqualTo("2024-01-29T00:00:00.000Z");
        assertThat(call("DateAdd", "2024-01-15T10:00:00Z", 90.0, "minutes")).isEqualTo("2024-01-15T11:30:00.000Z");
        assertThat(call("DateAdd", "2024-01-31", 1.0, "months")).isEqualTo("2024-02-29T00:00:00.000Z");
        assertThat(call("DateAdd", "2024-01-15", 1.0, "years")).isEqualTo("2025-01-15T00:00:00.000Z");
        assertThat(call("DateAdd", "2024-01-15", 3.0)).isEqualTo("2024-01-18T00:00:00.000Z");
    }

    @ParameterizedTest
    @CsvSource({
            "short, Jan 15",
            "medium, 'Jan 15, 2024'",
            "long, 'Monday, January 15, 2024'",
            "iso, 2024-01-15",
            "time, 10:30 AM",
            "datetime, 'Jan 15, 10:30 AM'",
            "unknown, 'Jan 15, 2024'"
    })
    void formatDateStyles(String style, String expected) {
        assertThat(call("FormatDate", "2024-01-15T10:30:00Z", style)).isEqualTo(expected);
    }

    @Test
    void dayOfWeekStartsOnSunday() {
        assertThat(call("DayOfWeek", "2024-01-14")).isEqualTo(0.0);
        assertThat(call("DayOfWeek", "2024-01-15")).isEqualTo(1.0);
        assertThat(call("DayOfWeek", "2024-01-20")).isEqualTo(6.0);
    }

    @Test
    void invalidDatesAreTypeErrors() {
        assertFails(FormulaErrorCode.TYPE_ERROR, "Duration", "not a date", "2024-01-01");
        assertFails(FormulaErrorCode.TYPE_ERROR, "DayOfWeek", true);
    }
}
