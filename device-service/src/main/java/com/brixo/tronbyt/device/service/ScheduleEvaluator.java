package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.App;
import com.brixo.tronbyt.device.model.RecurrencePattern;
import com.brixo.tronbyt.device.model.RecurrenceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;

/**
 * Decide si el horario de una app está activo en un instante local dado:
 * ventana horaria, días de la semana (legacy) o recurrencia personalizada.
 */
@Component
public class ScheduleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ScheduleEvaluator.class);

    static final LocalTime DEFAULT_START = LocalTime.of(0, 0);
    static final LocalTime DEFAULT_END = LocalTime.of(23, 59);
    static final LocalDate DEFAULT_RECURRENCE_START = LocalDate.of(2025, 1, 1);

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("H:mm");

    public boolean isActive(App app, ZonedDateTime now) {
        LocalTime start = parseTime(app.getStartTime(), DEFAULT_START);
        LocalTime end = parseTime(app.getEndTime(), DEFAULT_END);
        if (!inWindow(now.toLocalTime(), start, end)) {
            return false;
        }
        if (app.isUseCustomRecurrence() && app.getRecurrenceType() != null) {
            return isRecurrenceActive(app, now.toLocalDate());
        }
        return matchesAnyDay(app.getDays(), now.getDayOfWeek());
    }

    /**
     * Ventana inclusiva a resolución de minuto. Si {@code start > end} la
     * ventana cruza la medianoche.
     */
    static boolean inWindow(LocalTime time, LocalTime start, LocalTime end) {
        LocalTime minute = time.truncatedTo(ChronoUnit.MINUTES);
        if (start.isAfter(end)) {
            return !minute.isBefore(start) || !minute.isAfter(end);
        }
        return !minute.isBefore(start) && !minute.isAfter(end);
    }

    static LocalTime parseTime(String value, LocalTime fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return LocalTime.parse(value.trim(), HH_MM);
        } catch (DateTimeParseException e) {
            log.warn("Hora con formato inválido '{}', usando {}", value, fallback);
            return fallback;
        }
    }

    private boolean isRecurrenceActive(App app, LocalDate today) {
        LocalDate startDate = app.getRecurrenceStartDate() != null
                ? app.getRecurrenceStartDate()
                : DEFAULT_RECURRENCE_START;
        LocalDate endDate = app.getRecurrenceEndDate();
        if (endDate != null && today.isAfter(endDate)) {
            return false;
        }
        if (today.isBefore(startDate)) {
            return false;
        }
        int interval = Math.max(1, app.getRecurrenceInterval());
        RecurrencePattern pattern = app.getRecurrencePattern() != null
                ? app.getRecurrencePattern()
                : new RecurrencePattern();

        RecurrenceType type = app.getRecurrenceType();
        return switch (type) {
            case DAILY -> ChronoUnit.DAYS.between(startDate, today) % interval == 0;
            case WEEKLY -> isWeeklyActive(startDate, today, interval, pattern);
            case MONTHLY -> isMonthlyActive(startDate, today, interval, pattern);
            case YEARLY -> (today.getYear() - startDate.getYear()) % interval == 0
                    && today.getMonth() == startDate.getMonth()
                    && today.getDayOfMonth() == startDate.getDayOfMonth();
        };
    }

    private boolean isWeeklyActive(LocalDate startDate, LocalDate today, int interval,
            RecurrencePattern pattern) {
        // Semanas contadas de lunes a lunes desde la semana de la fecha de inicio
        LocalDate startWeek = startDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate currentWeek = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        long weeksSince = ChronoUnit.WEEKS.between(startWeek, currentWeek);
        if (weeksSince % interval != 0) {
            return false;
        }
        return matchesAnyDay(pattern.weekdays(), today.getDayOfWeek());
    }

    private boolean isMonthlyActive(LocalDate startDate, LocalDate today, int interval,
            RecurrencePattern pattern) {
        long monthsSince = (today.getYear() - startDate.getYear()) * 12L
                + (today.getMonthValue() - startDate.getMonthValue());
        if (monthsSince % interval != 0) {
            return false;
        }
        if (pattern.dayOfMonth() != null) {
            return today.getDayOfMonth() == pattern.dayOfMonth();
        }
        if (pattern.dayOfWeek() != null) {
            return matchesMonthlyWeekday(today, pattern.dayOfWeek());
        }
        return true;
    }

    /**
     * Evalúa tokens como {@code first_monday} o {@code last_friday}.
     */
    static boolean matchesMonthlyWeekday(LocalDate date, String token) {
        String[] parts = token.toLowerCase(Locale.ROOT).split("_");
        if (parts.length != 2) {
            return false;
        }
        if (!parts[1].equals(dayName(date.getDayOfWeek()))) {
            return false;
        }
        int nth = (date.getDayOfMonth() - 1) / 7 + 1;
        return switch (parts[0]) {
            case "first" -> nth == 1;
            case "second" -> nth == 2;
            case "third" -> nth == 3;
            case "fourth" -> nth == 4;
            case "last" -> date.plusDays(7).getMonth() != date.getMonth();
            default -> false;
        };
    }

    /** Lista vacía o nula significa todos los días. */
    private static boolean matchesAnyDay(List<String> days, DayOfWeek day) {
        if (days == null || days.isEmpty()) {
            return true;
        }
        String current = dayName(day);
        return days.stream().anyMatch(d -> d != null && d.toLowerCase(Locale.ROOT).equals(current));
    }

    static String dayName(DayOfWeek day) {
        return day.name().toLowerCase(Locale.ROOT);
    }
}
