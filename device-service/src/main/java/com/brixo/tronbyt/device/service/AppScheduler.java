package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.App;
import com.brixo.tronbyt.device.model.Device;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Lógica pura de rotación: qué app toca mostrar dado el estado del
 * dispositivo y la hora local. No renderiza ni persiste nada; eso lo hace
 * {@link RotationService}.
 */
@Component
public class AppScheduler {

    private final ScheduleEvaluator scheduleEvaluator;
    private final DisplayModes displayModes;

    public AppScheduler(ScheduleEvaluator scheduleEvaluator, DisplayModes displayModes) {
        this.scheduleEvaluator = scheduleEvaluator;
        this.displayModes = displayModes;
    }

    /**
     * Primer candidato para este ciclo: la app nocturna si el modo nocturno
     * está activo, luego la app fijada y por último la rotación normal.
     */
    public Optional<AppSelection> selectApp(Device device, int lastIndex, boolean advance, ZonedDateTime now) {
        Optional<App> night = nightModeApp(device, now);
        if (night.isPresent()) {
            return Optional.of(AppSelection.nightMode(night.get(), lastIndex));
        }
        Optional<App> pinned = pinnedApp(device);
        if (pinned.isPresent()) {
            return Optional.of(AppSelection.pinned(pinned.get(), lastIndex));
        }
        List<App> expanded = expandedRotation(device);
        if (expanded.isEmpty()) {
            return Optional.empty();
        }
        int index = startIndex(expanded.size(), lastIndex, advance);
        return Optional.of(rotationCandidate(device, expanded, index, now));
    }

    public Optional<App> nightModeApp(Device device, ZonedDateTime now) {
        String iname = device.getNightModeApp();
        if (iname == null || iname.isEmpty() || !displayModes.isNightModeActive(device, now)) {
            return Optional.empty();
        }
        return Optional.ofNullable(device.getApps().get(iname));
    }

    public Optional<App> pinnedApp(Device device) {
        String iname = device.getPinnedApp();
        if (iname == null || iname.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(device.getApps().get(iname));
    }

    /**
     * Apps ordenadas por {@code order}. Con intersticial activo y existente,
     * se inserta la app intersticial después de cada app salvo la última,
     * así ocupa las posiciones impares.
     */
    public List<App> expandedRotation(Device device) {
        List<App> base = new ArrayList<>(device.getApps().values());
        base.sort(Comparator.comparingInt(App::getOrder));
        App interstitial = interstitialApp(device);
        if (interstitial == null) {
            return base;
        }
        List<App> expanded = new ArrayList<>(base.size() * 2);
        for (int i = 0; i < base.size(); i++) {
            expanded.add(base.get(i));
            if (i < base.size() - 1) {
                expanded.add(interstitial);
            }
        }
        return expanded;
    }

    /**
     * Al avanzar se toma la siguiente posición; si no, la actual. Un índice
     * fuera de rango vale 0.
     */
    public int startIndex(int size, int lastIndex, boolean advance) {
        int index = lastIndex < 0 || lastIndex >= size ? 0 : lastIndex;
        if (advance) {
            return (index + 1) % size;
        }
        return index;
    }

    public AppSelection rotationCandidate(Device device, List<App> expanded, int index, ZonedDateTime now) {
        App app = expanded.get(index);
        boolean interstitialPosition = isInterstitialPosition(device, app, index);

        boolean eligible;
        if (interstitialPosition) {
            // Un intersticial nunca se muestra si la app anterior no se mostraría
            App previous = expanded.get(index - 1);
            eligible = previous.isEnabled()
                    && scheduleEvaluator.isActive(previous, now)
                    && !previous.isEmptyLastRender();
        } else {
            eligible = app.isEnabled() && scheduleEvaluator.isActive(app, now);
        }
        if (!interstitialPosition && app.getIname().equals(device.getInterstitialApp()) && !app.isEnabled()) {
            eligible = false;
        }
        return new AppSelection(app, index, false, false, interstitialPosition, eligible);
    }

    private boolean isInterstitialPosition(Device device, App app, int index) {
        return device.isInterstitialEnabled()
                && index % 2 == 1
                && app.getIname().equals(device.getInterstitialApp());
    }

    private App interstitialApp(Device device) {
        String iname = device.getInterstitialApp();
        if (!device.isInterstitialEnabled() || iname == null || iname.isEmpty()) {
            return null;
        }
        return device.getApps().get(iname);
    }
}
