package com.eventdocs.render.modules.event.application;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.eventdocs.render.global.config.RenderProperties;
import com.eventdocs.render.global.error.ProblemException;
import com.eventdocs.render.modules.event.domain.Event;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the event export from disk and hands it to the {@link EventGraphBuilder}.
 */
@Service
public class EventExportLoader {

    private static final Logger log = LoggerFactory.getLogger(EventExportLoader.class);

    private final ObjectMapper objectMapper;
    private final EventGraphBuilder graphBuilder;
    private final RenderProperties properties;

    public EventExportLoader(ObjectMapper objectMapper, EventGraphBuilder graphBuilder, RenderProperties properties) {
        this.objectMapper = objectMapper;
        this.graphBuilder = graphBuilder;
        this.properties = properties;
    }

    public Optional<Event> loadConfigured() {
        return load(properties.getInput());
    }

    /**
     * @return the event, or empty if the file is missing or unreadable
     * @throws ProblemException if the file is readable but not a usable export
     */
    public Optional<Event> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("Export file '{}' not found", path);
            return Optional.empty();
        }

        JsonNode root;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            root = objectMapper.readTree(reader);
        } catch (JsonProcessingException ex) {
            throw new ProblemException("MALFORMED_JSON", "Export file '" + path + "' is not valid JSON", ex);
        } catch (IOException ex) {
            log.warn("Export file '{}' could not be read: {}", path, ex.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            throw new ProblemException("MALFORMED_JSON", "Export file '" + path + "' does not contain a JSON object");
        }

        Event event = graphBuilder.build(root);
        log.info("Loaded event '{}' (schema {}): {} parts, {} tracks, {} courses, {} lodgements, {} registrations",
                event.getShortname(), event.getSchemaVersion(), event.getParts().size(), event.getTracks().size(),
                event.getCourses().size(), event.getLodgements().size(), event.getRegistrations().size());
        return Optional.of(event);
    }
}
