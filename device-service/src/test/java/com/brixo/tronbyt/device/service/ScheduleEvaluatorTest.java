package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.App;
import com.brixo.tronbyt.device.model.RecurrencePattern;
import com.brixo.tronbyt.device.model.RecurrenceType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleEvaluatorTest {

    private final ScheduleEvaluator evaluator = new ScheduleEvaluator();

    private static ZonedDateTime at(String isoLocal) {
        return LocalDateTime.parse(isoLocal).atZone(ZoneOffset.UTC);
    }

    private static App recurring(RecurrenceType type, int interval, RecurrencePattern pattern) {
        App app = new App("100", "clock", 0);
        app.setUseCustomRecurrence(true);
        app.setRecurrenceType(type);
        app.setRecurrenceInterval(interval);
        app.setRecurrencePattern(pattern);
        app.setRecurrenceStartDate(LocalDate.of(2025, 1, 1));
        return app;
    }

    @Test
    void appWithoutScheduleIsAlwaysActive() {
        App app = new App("100", "clock", 0);
        assertTrue(evaluator.isActive(app, at("2025-01-01T00:00")));
        assertTrue(evaluator.isActive(app, at("2025-06-30T23:59:59")));
    }

    @Test
    void overnightWindowWrapsPastMidnight() {
        App app = new App("100", "clock", 0);
        app.setStartTime("22:00");
        app.setEndTime("06:00");

        assertTrue(evaluator.isActive(app, at("2025-01-01T23:10")));
        assertTrue(evaluator.isActive(app, at("2025-01-01T23:59:10.001")));
        assertTrue(evaluator.isActive(app, at("2025-01-02T06:00:59")));
        assertFalse(evaluator.isActive(app, at("2025-01-01T08:10")));
    }

    @Test
    void daytimeWindowIncludesBothEnds() {
        App app = new App("100", "clock", 0);
        app.setStartTime("09:00");
        app.setEndTime("17:30");

        assertTrue(evaluator.isActive(app, at("2025-01-01T09:00")));
        assertTrue(evaluator.isActive(app, at("2025-01-01T17:30:45")));
        assertFalse(evaluator.isActive(app, at("2025-01-01T17:31")));
        assertFalse(evaluator.isActive(app, at("2025-01-01T08:59")));
    }

    @Test
    void legacyDaysMatchWeekdayNames() {
        App app = new App("100", "clock", 0);
        app.setDays(List.of("Monday", "friday"));

        assertTrue(evaluator.isActive(app, at("2025-01-06T12:00")));
        assertTrue(evaluator.isActive(app, at("2025-01-10T12:00")));
        assertFalse(evaluator.isActive(app, at("2025-01-07T12:00")));
    }

    @Test
    void dailyRecurrenceHonoursInterval() {
        App app = recurring(RecurrenceType.DAILY, 3, new RecurrencePattern());

        assertTrue(evaluator.isActive(app, at("2025-01-01T10:00")));
        assertFalse(evaluator.isActive(app, at("2025-01-02T10:00")));
        assertFalse(evaluator.isActive(app, at("2025-01-03T10:00")));
        assertTrue(evaluator.isActive(app, at("2025-01-04T10:00")));
        assertTrue(evaluator.isActive(app, at("2025-01-07T10:00")));
    }

    @Test
    void recurrenceRespectsDateBounds() {
        App app = recurring(RecurrenceType.DAILY, 1, new RecurrencePattern());
        app.setRecurrenceStartDate(LocalDate.of(2025, 1, 3));
        app.setRecurrenceEndDate(LocalDate.of(2025, 1, 5));

        assertFalse(evaluator.isActive(app, at("2025-01-02T10:00")));
        assertTrue(evaluator.isActive(app, at("2025-01-05T23:00")));
        assertFalse(evaluator.isActive(app, at("2025-01-06T00:00")));
    }

    @Test
    void weeklyRecurrenceCountsWeeksFromStartWeek() {
        App app = recurring(RecurrenceType.WEEKLY, 2, RecurrencePattern.weekly(List.of("monday")));

        // 2025-01-01 es miércoles: su semana empieza el lunes 2024-12-30
        assertFalse(evaluator.isActive(app, at("2025-01-06T10:00")));
        assertTrue(evaluator.isActive(app, at("2025-01-13T10:00")));
        assertFalse(evaluator.isActive(app, at("2025-01-14T10:00")));
        assertTrue(evaluator.isActive(app, at("2025-01-27T10:00")));
    }

    @Test
    void weeklyWithoutWeekdaysMatchesEveryDayOfActiveWeeks() {
        App app = recurring(RecurrenceType.WEEKLY, 1, RecurrencePattern.weekly(List.of()));
        assertTrue(evaluator.isActive(app, at("2025-01-09T10:00")));
    }

    @Test
    void monthlyByDayOfWeekToken() {
        App app = recurring(RecurrenceType.MONTHLY, 1, RecurrencePattern.dayOfWeek("first_monday"));

        assertTrue(evaluator.isActive(app, at("2025-01-06T10:00")));
        assertTrue(evaluator.isActive(app, at("2025-02-03T10:00")));
        assertFalse(evaluator.isActive(app, at("2025-01-13T10:00")));
    }

    @Test
    void monthlyLastWeekdayOfMonth() {
        App app = recurring(RecurrenceType.MONTHLY, 1, RecurrencePattern.dayOfWeek("last_friday"));

        assertTrue(evaluator.isActive(app, at("2025-01-31T10:00")));
        assertFalse(evaluator.isActive(app, at("2025-01-24T10:00")));
    }

    @Test
    void monthlyByDayOfMonthWithInterval() {
        App app = recurring(RecurrenceType.MONTHLY, 2, RecurrencePattern.dayOfMonth(15));

        assertTrue(evaluator.isActive(app, at("2025-01-15T10:00")));
        assertFalse(evaluator.isActive(app, at("2025-02-15T10:00")));
        assertTrue(evaluator.isActive(app, at("2025-03-15T10:00")));
        assertFalse(evaluator.isActive(app, at("2025-03-16T10:00")));
    }

    @Test
    void yearlyMatchesStartDateAnniversary() {
        App app = recurring(RecurrenceType.YEARLY, 1, new RecurrencePattern());
        app.setRecurrenceStartDate(LocalDate.of(2024, 3, 15));

        assertTrue(evaluator.isActive(app, at("2025-03-15T10:00")));
        assertFalse(evaluator.isActive(app, at("2025-03-16T10:00")));
    }

    @Test
    void missingStartDateDefaultsToFirstOfJanuary2025() {
        App app = recurring(RecurrenceType.DAILY, 2, new RecurrencePattern());
        app.setRecurrenceStartDate(null);

        assertTrue(evaluator.isActive(app, at("2025-01-03T10:00")));
        assertFalse(evaluator.isActive(app, at("2025-01-04T10:00")));
    }

    @Test
    void timeWindowAppliesBeforeRecurrence() {
        App app = recurring(RecurrenceType.DAILY, 1, new RecurrencePattern());
        app.setStartTime("08:00");
        app.setEndTime("09:00");

        assertFalse(evaluator.isActive(app, at("2025-01-02T10:00")));
    }
}
