package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.App;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.Frame;
import org.springframework.stereotype.Component;

/**
 * Arma frames con el dwell y el brillo que corresponden a cada origen.
 */
@Component
public class FrameFactory {

    /** Dwell de las imágenes push que interrumpen la rotación. */
    public static final int IMMEDIATE_DWELL_SECONDS = 5;

    private final WebpCache webpCache;

    public FrameFactory(WebpCache webpCache) {
        this.webpCache = webpCache;
    }

    public Frame ofApp(Device device, App app, byte[] image, int brightness) {
        return new Frame(image, brightness, dwellSeconds(device, app), false, app.getIname());
    }

    public Frame placeholder(Device device, int brightness) {
        return new Frame(webpCache.placeholder(), brightness, device.getDefaultInterval(), false, null);
    }

    public Frame immediate(byte[] image, int brightness) {
        return new Frame(image, brightness, IMMEDIATE_DWELL_SECONDS, true, null);
    }

    public static int dwellSeconds(Device device, App app) {
        return app.getDisplayTime() > 0 ? app.getDisplayTime() : device.getDefaultInterval();
    }
}
