package dev.medrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the medical multi-path retrieval service.
 *
 * <p>Supports two Spring profiles: {@code web} (MCP over SSE on port 8080)
 * and {@code stdio} (MCP stdio transport, no web server).
 */
@SpringBootApplication
public class MedRagApplication {
    public static void main(String[] args) {
        SpringApplication.run(MedRagApplication.class, args);
    }
}
