package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.App;

/**
 * Candidato elegido por el {@link AppScheduler}.
 *
 * @param app          app candidata
 * @param index        posición en la rotación expandida (sin cambios para fijada o nocturna)
 * @param pinned       viene de {@code pinnedApp}
 * @param nightModeApp viene del modo nocturno
 * @param interstitial ocupa una posición intersticial
 * @param eligible     pasó las reglas de visibilidad y puede ir al render
 */
public record AppSelection(App app, int index, boolean pinned, boolean nightModeApp,
        boolean interstitial, boolean eligible) {

    static AppSelection pinned(App app, int index) {
        return new AppSelection(app, index, true, false, false, true);
    }

    static AppSelection nightMode(App app, int index) {
        return new AppSelection(app, index, false, true, false, true);
    }
}
