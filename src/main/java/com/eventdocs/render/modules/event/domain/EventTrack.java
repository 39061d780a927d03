package com.eventdocs.render.modules.event.domain;

/**
 * A parallel course slot within one event part.
 */
public class EventTrack {

    private final int id;
    private final String title;
    private final String shortname;
    private final int sortkey;
    private final int numChoices;
    private final EventPart part;

    public EventTrack(int id, String title, String shortname, int sortkey, int numChoices, EventPart part) {
        this.id = id;
        this.title = title;
        this.shortname = shortname;
        this.sortkey = sortkey;
        this.numChoices = numChoices;
        this.part = part;
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

    public int getSortkey() {
        return sortkey;
    }

    public int getNumChoices() {
        return numChoices;
    }

    public EventPart getPart() {
        return part;
    }

    @Override
    public String toString() {
        return "EventTrack(" + id + ", " + shortname + ")";
    }
}
