package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.App;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Directorio de imágenes webp por dispositivo:
 * {@code <data-dir>/webp/<deviceId>/<name>-<iname>.webp} para apps renderizadas
 * y {@code pushed/} para imágenes enviadas por push. Los archivos
 * {@code pushed/__*} son efímeros y se consumen una sola vez.
 */
@Component
public class WebpCache {

    private static final Logger log = LoggerFactory.getLogger(WebpCache.class);
    private static final String PUSHED_DIR = "pushed";
    private static final String EPHEMERAL_PREFIX = "__";
    private static final String PLACEHOLDER = "static/images/default.webp";

    private final Path root;
    private volatile byte[] placeholder;

    public WebpCache(@Value("${tronbyt.data-dir:./data}") String dataDir) {
        this.root = Path.of(dataDir).resolve("webp");
    }

    public Path deviceDir(String deviceId) {
        return root.resolve(deviceId);
    }

    public Path appImage(String deviceId, App app) {
        if (app.isPushed()) {
            return deviceDir(deviceId).resolve(PUSHED_DIR).resolve(app.getIname() + ".webp");
        }
        return deviceDir(deviceId).resolve(app.basename() + ".webp");
    }

    /** True si existe y tiene al menos un byte. */
    public boolean hasImage(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    public Optional<byte[]> read(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (IOException e) {
            log.error("No se pudo leer {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public void write(Path path, byte[] bytes) {
        try {
            Files.createDirectories(path.getParent());
            Files.write(path, bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo escribir " + path, e);
        }
    }

    public void copy(Path source, Path target) {
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo copiar " + source, e);
        }
    }

    // ── Imágenes push ────────────────────────────────────────────────────────

    public Path writeEphemeral(String deviceId, byte[] bytes) {
        Path path = deviceDir(deviceId).resolve(PUSHED_DIR)
                .resolve(EPHEMERAL_PREFIX + System.nanoTime() + ".webp");
        write(path, bytes);
        return path;
    }

    public Path writePushedApp(String deviceId, String iname, byte[] bytes) {
        Path path = deviceDir(deviceId).resolve(PUSHED_DIR).resolve(iname + ".webp");
        write(path, bytes);
        return path;
    }

    public boolean hasEphemeral(String deviceId) {
        return firstEphemeral(deviceId).isPresent();
    }

    /**
     * Lee y borra la imagen efímera más antigua, si hay alguna.
     */
    public Optional<byte[]> takeEphemeral(String deviceId) {
        Optional<Path> next = firstEphemeral(deviceId);
        if (next.isEmpty()) {
            return Optional.empty();
        }
        Path path = next.get();
        Optional<byte[]> bytes = read(path);
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.error("No se pudo borrar la imagen efímera {}: {}", path, e.getMessage());
        }
        return bytes;
    }

    private Optional<Path> firstEphemeral(String deviceId) {
        Path dir = deviceDir(deviceId).resolve(PUSHED_DIR);
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().startsWith(EPHEMERAL_PREFIX))
                    .sorted()
                    .findFirst();
        } catch (IOException e) {
            log.warn("No se pudo listar {}: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }

    // ── Mantenimiento ────────────────────────────────────────────────────────

    public void purge(String deviceId) {
        try {
            FileSystemUtils.deleteRecursively(deviceDir(deviceId));
        } catch (IOException e) {
            log.error("No se pudo borrar el directorio de {}: {}", deviceId, e.getMessage());
        }
    }

    public byte[] placeholder() {
        byte[] cached = placeholder;
        if (cached == null) {
            try (InputStream in = new ClassPathResource(PLACEHOLDER).getInputStream()) {
                cached = in.readAllBytes();
            } catch (IOException e) {
                throw new UncheckedIOException("Falta la imagen por defecto " + PLACEHOLDER, e);
            }
            placeholder = cached;
        }
        return cached;
    }
}
