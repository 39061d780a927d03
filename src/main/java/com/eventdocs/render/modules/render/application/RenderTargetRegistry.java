package com.eventdocs.render.modules.render.application;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.eventdocs.render.global.error.ProblemException;
import com.eventdocs.render.modules.event.domain.Event;
import com.eventdocs.render.modules.render.domain.RenderTarget;
import com.eventdocs.render.modules.render.domain.RenderTask;

/**
 * Named render targets. Targets are registered explicitly during start-up, see {@link RenderTargetConfig}.
 */
public class RenderTargetRegistry {

    private final Map<String, RenderTarget> targets = new LinkedHashMap<>();

    public RenderTargetRegistry register(String name, RenderTarget target) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("target name must not be blank");
        }
        if (targets.putIfAbsent(name, target) != null) {
            throw new IllegalArgumentException("Render target '" + name + "' is already registered");
        }
        return this;
    }

    public Optional<RenderTarget> find(String name) {
        return Optional.ofNullable(targets.get(name));
    }

    /**
     * @return target names in registration order
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(targets.keySet());
    }

    public List<RenderTask> createTasks(String name, Event event, Pattern match) {
        RenderTarget target = find(name)
                .orElseThrow(() -> new ProblemException("UNKNOWN_TARGET", "Render target '" + name + "' is unknown"));
        return target.createTasks(event, match);
    }
}
