package com.brixo.tronbyt.device.model;

import java.util.List;

/**
 * Patrón de recurrencia personalizado.
 * weekdays aplica a "weekly"; dayOfMonth o dayOfWeek (e.g. "first_monday",
 * "last_friday") aplican a "monthly".
 */
public record RecurrencePattern(List<String> weekdays, Integer dayOfMonth, String dayOfWeek) {

    public RecurrencePattern() {
        this(null, null, null);
    }

    public static RecurrencePattern weekly(List<String> weekdays) {
        return new RecurrencePattern(weekdays, null, null);
    }

    public static RecurrencePattern dayOfMonth(int day) {
        return new RecurrencePattern(null, day, null);
    }

    public static RecurrencePattern dayOfWeek(String token) {
        return new RecurrencePattern(null, null, token);
    }
}
