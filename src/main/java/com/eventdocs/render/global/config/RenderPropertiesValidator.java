package com.eventdocs.render.global.config;

import java.nio.file.Files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Reports questionable settings once the application is ready. A missing export only means "no data" yet.
 */
@Component
public class RenderPropertiesValidator {

    private static final Logger log = LoggerFactory.getLogger(RenderPropertiesValidator.class);

    private final RenderProperties properties;

    public RenderPropertiesValidator(RenderProperties properties) {
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateProperties() {
        if (properties.getInput() == null || !Files.isRegularFile(properties.getInput())) {
            log.warn("render.input: export file '{}' not found, use render.input to point to the event export",
                    properties.getInput());
        }
        if (properties.getHomeCountries() == null || properties.getHomeCountries().isEmpty()) {
            log.warn("render.home-countries is empty, every postal address will include its country");
        }
    }
}
