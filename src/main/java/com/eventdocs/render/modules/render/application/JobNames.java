package com.eventdocs.render.modules.render.application;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.eventdocs.render.modules.event.domain.Event;
import com.eventdocs.render.modules.event.domain.EventPart;

public final class JobNames {

    private static final String RESERVED_CHARACTERS = "/\\?%*:|\"<> ";

    private JobNames() {
    }

    /**
     * Replaces characters that are reserved in file names on common file systems (and spaces) by underscores. Dots
     * are kept.
     */
    public static String sanitizeFilename(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name must not be null");
        }
        StringBuilder builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            builder.append(RESERVED_CHARACTERS.indexOf(ch) >= 0 ? '_' : ch);
        }
        return builder.toString();
    }

    /**
     * Job name suffix per event part, derived from the part's shortname. Parts whose suffix would collide get their
     * id appended.
     */
    public static Map<EventPart, String> partSuffixes(Event event) {
        Map<EventPart, String> result = new LinkedHashMap<>();
        Map<String, EventPart> firstBySuffix = new HashMap<>();
        Set<EventPart> ambiguous = new HashSet<>();
        for (EventPart part : event.getParts()) {
            String suffix = sanitizeFilename(part.getShortname() != null ? part.getShortname() : "");
            result.put(part, suffix);
            EventPart previous = firstBySuffix.putIfAbsent(suffix, part);
            if (previous != null) {
                ambiguous.add(previous);
                ambiguous.add(part);
            }
        }
        for (EventPart part : ambiguous) {
            result.put(part, result.get(part) + "_" + part.getId());
        }
        return result;
    }
}
