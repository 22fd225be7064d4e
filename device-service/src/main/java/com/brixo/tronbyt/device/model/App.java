package com.brixo.tronbyt.device.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instancia de una app instalada en un dispositivo.
 *
 * El {@code order} define la rotación base; el scheduler ordena por este campo
 * y tolera huecos tras un borrado. Los campos de horario ({@code startTime},
 * {@code endTime}) usan el formato {@code HH:MM} tal como los guarda la UI.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public class App {

    private String iname;
    private String name;
    private String path;
    private String notes = "";
    private int order;
    private int uinterval;
    private int displayTime;
    private boolean enabled = true;
    private boolean pushed;
    private long lastRender;
    private boolean emptyLastRender;
    private boolean autopin;
    private String startTime;
    private String endTime;
    private List<String> days = new ArrayList<>();
    private boolean useCustomRecurrence;
    private RecurrenceType recurrenceType = RecurrenceType.DAILY;
    private int recurrenceInterval = 1;
    private RecurrencePattern recurrencePattern = new RecurrencePattern();
    private LocalDate recurrenceStartDate;
    private LocalDate recurrenceEndDate;
    private Map<String, Object> config = new LinkedHashMap<>();

    public App(String iname, String name, int order) {
        this.iname = iname;
        this.name = name;
        this.order = order;
    }

    // Constructor vacío requerido por Jackson
    public App() {
    }

    public String getIname() {
        return iname;
    }

    public void setIname(String iname) {
        this.iname = iname;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public int getOrder() {
        return order;
    }

    public void setOrder(int order) {
        this.order = order;
    }

    public int getUinterval() {
        return uinterval;
    }

    public void setUinterval(int uinterval) {
        this.uinterval = uinterval;
    }

    public int getDisplayTime() {
        return displayTime;
    }

    public void setDisplayTime(int displayTime) {
        this.displayTime = displayTime;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isPushed() {
        return pushed;
    }

    public void setPushed(boolean pushed) {
        this.pushed = pushed;
    }

    public long getLastRender() {
        return lastRender;
    }

    public void setLastRender(long lastRender) {
        this.lastRender = lastRender;
    }

    public boolean isEmptyLastRender() {
        return emptyLastRender;
    }

    public void setEmptyLastRender(boolean emptyLastRender) {
        this.emptyLastRender = emptyLastRender;
    }

    public boolean isAutopin() {
        return autopin;
    }

    public void setAutopin(boolean autopin) {
        this.autopin = autopin;
    }

    public String getStartTime() {
        return startTime;
    }

    public void setStartTime(String startTime) {
        this.startTime = startTime;
    }

    public String getEndTime() {
        return endTime;
    }

    public void setEndTime(String endTime) {
        this.endTime = endTime;
    }

    public List<String> getDays() {
        return days;
    }

    public void setDays(List<String> days) {
        this.days = days != null ? new ArrayList<>(days) : new ArrayList<>();
    }

    public boolean isUseCustomRecurrence() {
        return useCustomRecurrence;
    }

    public void setUseCustomRecurrence(boolean useCustomRecurrence) {
        this.useCustomRecurrence = useCustomRecurrence;
    }

    public RecurrenceType getRecurrenceType() {
        return recurrenceType;
    }

    public void setRecurrenceType(RecurrenceType recurrenceType) {
        this.recurrenceType = recurrenceType;
    }

    public int getRecurrenceInterval() {
        return recurrenceInterval;
    }

    public void setRecurrenceInterval(int recurrenceInterval) {
        this.recurrenceInterval = recurrenceInterval;
    }

    public RecurrencePattern getRecurrencePattern() {
        return recurrencePattern;
    }

    public void setRecurrencePattern(RecurrencePattern recurrencePattern) {
        this.recurrencePattern = recurrencePattern != null ? recurrencePattern : new RecurrencePattern();
    }

    public LocalDate getRecurrenceStartDate() {
        return recurrenceStartDate;
    }

    public void setRecurrenceStartDate(LocalDate recurrenceStartDate) {
        this.recurrenceStartDate = recurrenceStartDate;
    }

    public LocalDate getRecurrenceEndDate() {
        return recurrenceEndDate;
    }

    public void setRecurrenceEndDate(LocalDate recurrenceEndDate) {
        this.recurrenceEndDate = recurrenceEndDate;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
    }

    /** Nombre base del archivo webp en la caché del dispositivo. */
    public String basename() {
        return "%s-%s".formatted(name, iname);
    }
}
