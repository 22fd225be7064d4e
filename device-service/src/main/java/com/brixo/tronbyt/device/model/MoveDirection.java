package com.brixo.tronbyt.device.model;

import java.util.Locale;

/** Sentido en que se mueve una app dentro de la rotación. */
public enum MoveDirection {
    UP,
    DOWN;

    /**
     * @throws IllegalArgumentException si no es "up" ni "down"
     */
    public static MoveDirection parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Falta la dirección");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
