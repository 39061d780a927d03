package com.eventdocs.render.modules.event.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Lodgement {

    private final int id;
    private final String title;
    private final LodgementGroup group;
    private final Map<String, Object> fields;
    private final Map<Integer, LodgementPart> parts = new LinkedHashMap<>();

    /**
     * Creates the lodgement with one (empty) {@link LodgementPart} per event part.
     *
     * @param group the lodgement group, {@code null} if the lodgement belongs to none
     */
    public Lodgement(int id, String title, LodgementGroup group, Map<String, Object> fields, List<EventPart> eventParts) {
        this.id = id;
        this.title = title;
        this.group = group;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        for (EventPart part : eventParts) {
            parts.put(part.getId(), new LodgementPart(this, part));
        }
    }

    public int getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public LodgementGroup getGroup() {
        return group;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public Object getField(String name) {
        return fields.get(name);
    }

    public Map<Integer, LodgementPart> getParts() {
        return Collections.unmodifiableMap(parts);
    }

    public LodgementPart getPart(EventPart part) {
        return parts.get(part.getId());
    }

    @Override
    public String toString() {
        return "Lodgement(" + id + ", " + title + ")";
    }
}
