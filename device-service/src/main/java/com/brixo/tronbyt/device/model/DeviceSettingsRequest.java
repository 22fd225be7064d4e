package com.brixo.tronbyt.device.model;

/**
 * Cambios parciales de configuración de pantalla. Los campos nulos no se tocan.
 */
public record DeviceSettingsRequest(
        String name,
        DeviceType type,
        Integer brightness,
        Boolean nightModeEnabled,
        String nightModeApp,
        String nightStart,
        String nightEnd,
        Integer nightBrightness,
        String dimTime,
        Integer dimBrightness,
        Integer defaultInterval,
        String timezone,
        Boolean interstitialEnabled,
        String interstitialApp) {
}
