package com.brixo.tronbyt.device.config;

import com.brixo.tronbyt.device.service.AppRenderer;
import com.brixo.tronbyt.device.service.PixletAppRenderer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Beans de infraestructura: reloj, pool de emisores WebSocket y renderer.
 */
@Configuration
public class DeviceServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Un hilo por sesión WebSocket activa; se interrumpen al apagar. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService senderExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("ws-sender-"));
    }

    @Bean
    public AppRenderer appRenderer(
            @Value("${tronbyt.pixlet.path:pixlet}") String pixletPath,
            @Value("${tronbyt.pixlet.timeout-seconds:30}") long timeoutSeconds) {
        return new PixletAppRenderer(pixletPath, Duration.ofSeconds(timeoutSeconds));
    }
}
