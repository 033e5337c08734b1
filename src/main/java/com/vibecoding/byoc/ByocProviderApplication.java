package com.vibecoding.byoc;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class ByocProviderApplication {

    private static final Logger log = LoggerFactory.getLogger(ByocProviderApplication.class);

    public static void main(String[] args) {
        log.info("==============================================");
        log.info("  BYOC Provider - control plane resources");
        log.info("==============================================");

        // Load .env file and set as system properties
        try {
            Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

            dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).forEach(entry -> {
                System.setProperty(entry.getKey(), entry.getValue());
                log.debug("Loaded environment variable: {}", entry.getKey());
            });

            log.info("Environment variables loaded from .env file");
        } catch (DotenvException e) {
            log.warn("Failed to load .env file: {}", e.getMessage());
            log.info("Continuing with system environment variables...");
        }

        SpringApplication.run(ByocProviderApplication.class, args);

        log.info("Provider started successfully!");
    }
}
