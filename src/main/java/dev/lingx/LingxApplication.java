package dev.lingx;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Lingx context ranking and quality scoring service.
 *
 * <p>Exposes AI context selection under {@code /api/context} and quality configuration,
 * classification and cache validation under {@code /api/projects/{id}/quality} and {@code
 * /api/quality}.
 */
@SpringBootApplication
public class LingxApplication {
    public static void main(String[] args) {
        SpringApplication.run(LingxApplication.class, args);
    }
}
