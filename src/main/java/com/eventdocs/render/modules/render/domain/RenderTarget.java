package com.eventdocs.render.modules.render.domain;

import java.util.List;
import java.util.regex.Pattern;

import com.eventdocs.render.modules.event.domain.Event;

/**
 * Produces the render tasks of one kind of document. Targets only read the event.
 */
@FunctionalInterface
public interface RenderTarget {

    /**
     * @param match optional pattern to select single documents, e.g. by recipient name; {@code null} selects all
     */
    List<RenderTask> createTasks(Event event, Pattern match);

    default String description() {
        return "";
    }
}
