package com.brixo.tronbyt.device.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Modelos de hardware soportados. Solo el Tronbyt S3 ancho admite apps 2x.
 */
public enum DeviceType {
    @JsonProperty("tidbyt_gen1")
    TIDBYT_GEN1(false),
    @JsonProperty("tidbyt_gen2")
    TIDBYT_GEN2(false),
    @JsonProperty("pixoticker")
    PIXOTICKER(false),
    @JsonProperty("raspberrypi")
    RASPBERRYPI(false),
    @JsonProperty("tronbyt_s3")
    TRONBYT_S3(false),
    @JsonProperty("tronbyt_s3_wide")
    TRONBYT_S3_WIDE(true),
    @JsonProperty("matrixportal_s3")
    MATRIXPORTAL_S3(false),
    @JsonProperty("other")
    OTHER(false);

    private final boolean supports2x;

    DeviceType(boolean supports2x) {
        this.supports2x = supports2x;
    }

    public boolean supports2x() {
        return supports2x;
    }
}
