package com.brixo.tronbyt.device.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Cambios parciales de una app instalada. Los campos nulos no se tocan.
 */
public record AppUpdateRequest(
        Boolean enabled,
        Integer uinterval,
        Integer displayTime,
        String notes,
        Boolean autopin,
        String startTime,
        String endTime,
        List<String> days,
        Boolean useCustomRecurrence,
        RecurrenceType recurrenceType,
        Integer recurrenceInterval,
        RecurrencePattern recurrencePattern,
        LocalDate recurrenceStartDate,
        LocalDate recurrenceEndDate,
        Map<String, Object> config) {
}
