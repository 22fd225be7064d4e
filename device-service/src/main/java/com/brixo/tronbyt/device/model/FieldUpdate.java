package com.brixo.tronbyt.device.model;

import java.util.List;
import java.util.Objects;

/**
 * Asignación de un campo de un dispositivo por ruta, e.g.
 * {@code ["lastAppIndex"]} o {@code ["apps", "002", "lastRender"]}.
 * Varias se aplican juntas en una única transacción del {@code DeviceStore}.
 *
 * {@link Kind#SET} solo modifica campos existentes; {@link Kind#PUT} y
 * {@link Kind#REMOVE} agregan o quitan entradas de un mapa (las apps).
 */
public record FieldUpdate(List<String> path, Object value, Kind kind) {

    public enum Kind {
        SET, PUT, REMOVE
    }

    public FieldUpdate {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("La ruta del campo no puede estar vacía");
        }
        path = List.copyOf(path);
    }

    public FieldUpdate(List<String> path, Object value) {
        this(path, value, Kind.SET);
    }

    public static FieldUpdate device(String field, Object value) {
        return new FieldUpdate(List.of(field), value);
    }

    public static FieldUpdate info(String field, Object value) {
        return new FieldUpdate(List.of("info", field), value);
    }

    public static FieldUpdate app(String iname, String field, Object value) {
        return new FieldUpdate(List.of("apps", iname, field), value);
    }

    public static FieldUpdate putApp(App app) {
        return new FieldUpdate(List.of("apps", app.getIname()), app, Kind.PUT);
    }

    public static FieldUpdate removeApp(String iname) {
        return new FieldUpdate(List.of("apps", iname), null, Kind.REMOVE);
    }

    public String describe() {
        return String.join(".", path);
    }
}
