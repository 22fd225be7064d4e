package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.exception.RenderException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Renderiza una app a bytes webp. Un arreglo vacío es un resultado válido
 * (la app no tiene nada que mostrar ahora).
 */
public interface AppRenderer {

    byte[] render(Path appPath, Map<String, Object> config, boolean use2x) throws RenderException;
}
