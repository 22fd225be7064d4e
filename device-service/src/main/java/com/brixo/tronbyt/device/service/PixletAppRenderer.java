package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.exception.RenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link AppRenderer} que ejecuta el binario {@code pixlet}:
 * {@code pixlet render <app> clave=valor... -o <salida> [--2x]}.
 */
public class PixletAppRenderer implements AppRenderer {

    private static final Logger log = LoggerFactory.getLogger(PixletAppRenderer.class);

    private final String pixletPath;
    private final Duration timeout;

    public PixletAppRenderer(String pixletPath, Duration timeout) {
        this.pixletPath = pixletPath;
        this.timeout = timeout;
    }

    @Override
    public byte[] render(Path appPath, Map<String, Object> config, boolean use2x) throws RenderException {
        Path output = null;
        Path console = null;
        try {
            output = Files.createTempFile("tronbyt-render-", ".webp");
            console = Files.createTempFile("tronbyt-render-", ".log");
            Process process = new ProcessBuilder(command(appPath, config, use2x, output))
                    .redirectErrorStream(true)
                    .redirectOutput(console.toFile())
                    .start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new RenderException("pixlet excedió %s renderizando %s".formatted(timeout, appPath));
            }
            String messages = Files.readString(console, StandardCharsets.UTF_8);
            if (!messages.isBlank()) {
                log.debug("pixlet {}: {}", appPath.getFileName(), messages.strip());
            }
            if (process.exitValue() != 0) {
                throw new RenderException("pixlet terminó con código %d: %s"
                        .formatted(process.exitValue(), messages.strip()));
            }
            return Files.readAllBytes(output);
        } catch (IOException e) {
            throw new RenderException("No se pudo ejecutar pixlet para " + appPath, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderException("Render interrumpido: " + appPath, e);
        } finally {
            deleteQuietly(output);
            deleteQuietly(console);
        }
    }

    List<String> command(Path appPath, Map<String, Object> config, boolean use2x, Path output) {
        List<String> command = new ArrayList<>();
        command.add(pixletPath);
        command.add("render");
        command.add(appPath.toString());
        config.forEach((key, value) -> command.add(key + "=" + (value == null ? "" : value)));
        command.add("-o");
        command.add(output.toString());
        if (use2x) {
            command.add("--2x");
        }
        return command;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("No se pudo borrar el temporal {}: {}", path, e.getMessage());
        }
    }
}
