package com.codefarm.shorturl.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
public class StartupLogger {

    private static final Logger log = LoggerFactory.getLogger(StartupLogger.class);

    private final ShortenerProperties properties;
    private final Environment environment;

    public StartupLogger(ShortenerProperties properties, Environment environment) {
        this.properties = properties;
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logEndpoints() {
        String port = environment.getProperty("local.server.port", environment.getProperty("server.port", "8080"));
        String address = environment.getProperty("server.address", "0.0.0.0");
        String root = "http://localhost:" + port;

        log.info("{} {} listening on {}:{}", properties.getServiceName(), properties.getVersion(), address, port);
        log.info("Database: {}", properties.getStoragePath());
        log.info("Health check: {}/health", root);
        log.info("Stats: {}/stats", root);
    }
}
