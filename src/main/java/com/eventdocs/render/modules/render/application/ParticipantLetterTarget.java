package com.eventdocs.render.modules.render.application;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.eventdocs.render.global.config.RenderProperties;
import com.eventdocs.render.modules.event.application.EventQueries;
import com.eventdocs.render.modules.event.domain.Event;
import com.eventdocs.render.modules.event.domain.Registration;
import com.eventdocs.render.modules.render.domain.RenderTarget;
import com.eventdocs.render.modules.render.domain.RenderTask;

/**
 * One letter per participant (guests excluded), optionally restricted to names matching a pattern.
 */
public class ParticipantLetterTarget implements RenderTarget {

    static final String TEMPLATE = "tnletter.tex";

    private final RenderProperties properties;

    public ParticipantLetterTarget(RenderProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<RenderTask> createTasks(Event event, Pattern match) {
        return EventQueries.activeRegistrations(event, null, false, false, false).stream()
                .filter(registration -> match == null || match.matcher(registration.getName().common()).find())
                .map(this::letter)
                .toList();
    }

    private RenderTask letter(Registration registration) {
        return new RenderTask(
                TEMPLATE,
                "tnletter_" + registration.getId(),
                Map.of(
                        "registration", registration,
                        "postalAddress", registration.getAddress().fullAddress(properties.getHomeCountries())
                ),
                false
        );
    }

    @Override
    public String description() {
        return "Letter to every participant";
    }
}
