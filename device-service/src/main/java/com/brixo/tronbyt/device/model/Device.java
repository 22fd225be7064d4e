package com.brixo.tronbyt.device.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dispositivo Tronbyt registrado con sus apps instaladas.
 *
 * No usa record: el scheduler y el gate de renders avanzan la vista en memoria
 * (pinnedApp, lastAppIndex, estado de render de cada app) durante un ciclo.
 * Cada lectura del {@code DeviceStore} devuelve una copia nueva, así que nunca
 * hay un grafo mutable compartido entre peticiones.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public class Device {

    public static final int DEFAULT_BRIGHTNESS = 100;
    public static final int DEFAULT_INTERVAL_SECONDS = 15;

    private String id;
    private String owner;
    private String name = "";
    private DeviceType type = DeviceType.TIDBYT_GEN1;
    private int brightness = DEFAULT_BRIGHTNESS;
    private boolean nightModeEnabled;
    private String nightModeApp = "";
    private String nightStart;
    private String nightEnd;
    private int nightBrightness;
    private String dimTime;
    private Integer dimBrightness;
    private int defaultInterval = DEFAULT_INTERVAL_SECONDS;
    private String timezone;
    private int lastAppIndex;
    private String pinnedApp;
    private boolean interstitialEnabled;
    private String interstitialApp;
    private Instant lastSeen;
    private DeviceInfo info = new DeviceInfo();
    private Map<String, App> apps = new LinkedHashMap<>();

    public Device(String id, String owner) {
        this.id = id;
        this.owner = owner;
    }

    // Constructor vacío requerido por Jackson
    public Device() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public DeviceType getType() {
        return type;
    }

    public void setType(DeviceType type) {
        this.type = type;
    }

    public int getBrightness() {
        return brightness;
    }

    public void setBrightness(int brightness) {
        this.brightness = brightness;
    }

    public boolean isNightModeEnabled() {
        return nightModeEnabled;
    }

    public void setNightModeEnabled(boolean nightModeEnabled) {
        this.nightModeEnabled = nightModeEnabled;
    }

    public String getNightModeApp() {
        return nightModeApp;
    }

    public void setNightModeApp(String nightModeApp) {
        this.nightModeApp = nightModeApp;
    }

    public String getNightStart() {
        return nightStart;
    }

    public void setNightStart(String nightStart) {
        this.nightStart = nightStart;
    }

    public String getNightEnd() {
        return nightEnd;
    }

    public void setNightEnd(String nightEnd) {
        this.nightEnd = nightEnd;
    }

    public int getNightBrightness() {
        return nightBrightness;
    }

    public void setNightBrightness(int nightBrightness) {
        this.nightBrightness = nightBrightness;
    }

    public String getDimTime() {
        return dimTime;
    }

    public void setDimTime(String dimTime) {
        this.dimTime = dimTime;
    }

    public Integer getDimBrightness() {
        return dimBrightness;
    }

    public void setDimBrightness(Integer dimBrightness) {
        this.dimBrightness = dimBrightness;
    }

    public int getDefaultInterval() {
        return defaultInterval;
    }

    public void setDefaultInterval(int defaultInterval) {
        this.defaultInterval = defaultInterval;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getLastAppIndex() {
        return lastAppIndex;
    }

    public void setLastAppIndex(int lastAppIndex) {
        this.lastAppIndex = lastAppIndex;
    }

    public String getPinnedApp() {
        return pinnedApp;
    }

    public void setPinnedApp(String pinnedApp) {
        this.pinnedApp = pinnedApp;
    }

    public boolean isInterstitialEnabled() {
        return interstitialEnabled;
    }

    public void setInterstitialEnabled(boolean interstitialEnabled) {
        this.interstitialEnabled = interstitialEnabled;
    }

    public String getInterstitialApp() {
        return interstitialApp;
    }

    public void setInterstitialApp(String interstitialApp) {
        this.interstitialApp = interstitialApp;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(Instant lastSeen) {
        this.lastSeen = lastSeen;
    }

    public DeviceInfo getInfo() {
        return info;
    }

    public void setInfo(DeviceInfo info) {
        this.info = info != null ? info : new DeviceInfo();
    }

    public Map<String, App> getApps() {
        return apps;
    }

    public void setApps(Map<String, App> apps) {
        this.apps = apps != null ? new LinkedHashMap<>(apps) : new LinkedHashMap<>();
    }

    /** Agrega o reemplaza una app usando su iname como clave. */
    public void putApp(App app) {
        apps.put(app.getIname(), app);
    }

    /** Solo los modelos anchos de Tronbyt S3 renderizan a escala 2x. */
    public boolean supports2x() {
        return type != null && type.supports2x();
    }
}
