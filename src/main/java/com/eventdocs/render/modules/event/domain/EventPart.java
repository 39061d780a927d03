package com.eventdocs.render.modules.event.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One time segment of the event, e.g. one week.
 */
public class EventPart {

    private final int id;
    private final String title;
    private final String shortname;
    private final LocalDate begin;
    private final LocalDate end;
    private final List<EventTrack> tracks = new ArrayList<>();

    public EventPart(int id, String title, String shortname, LocalDate begin, LocalDate end) {
        this.id = id;
        this.title = title;
        this.shortname = shortname;
        this.begin = begin;
        this.end = end;
    }

    public int getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getShortname() {
        return shortname;
    }

    public LocalDate getBegin() {
        return begin;
    }

    public LocalDate getEnd() {
        return end;
    }

    public List<EventTrack> getTracks() {
        return Collections.unmodifiableList(tracks);
    }

    // Called while loading only; the graph is not changed once built.
    public void addTrack(EventTrack track) {
        tracks.add(track);
    }

    /**
     * @return every calendar day from begin to end, both inclusive
     */
    public List<LocalDate> getDays() {
        if (end.isBefore(begin)) {
            return List.of();
        }
        return begin.datesUntil(end.plusDays(1)).toList();
    }

    @Override
    public String toString() {
        return "EventPart(" + id + ", " + shortname + ")";
    }
}
