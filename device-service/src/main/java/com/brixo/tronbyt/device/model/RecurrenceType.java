package com.brixo.tronbyt.device.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RecurrenceType {
    @JsonProperty("daily")
    DAILY,
    @JsonProperty("weekly")
    WEEKLY,
    @JsonProperty("monthly")
    MONTHLY,
    @JsonProperty("yearly")
    YEARLY
}
