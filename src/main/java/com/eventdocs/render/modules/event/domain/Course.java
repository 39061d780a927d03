package com.eventdocs.render.modules.event.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class Course {

    private final int id;
    private final String nr;
    private final String title;
    private final String shortname;
    private final Map<String, Object> fields;
    private Map<Integer, CourseTrack> tracks = new LinkedHashMap<>();

    public Course(int id, String nr, String title, String shortname, Map<String, Object> fields) {
        this.id = id;
        this.nr = nr != null ? nr : "";
        this.title = title;
        this.shortname = shortname;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public int getId() {
        return id;
    }

    public String getNr() {
        return nr;
    }

    public String getTitle() {
        return title;
    }

    public String getShortname() {
        return shortname;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public Object getField(String name) {
        return fields.get(name);
    }

    /**
     * @return course tracks keyed by event track id, in event track order
     */
    public Map<Integer, CourseTrack> getTracks() {
        return Collections.unmodifiableMap(tracks);
    }

    public Collection<CourseTrack> getCourseTracks() {
        return getTracks().values();
    }

    public CourseTrack getTrack(EventTrack track) {
        return tracks.get(track.getId());
    }

    // Called while loading only; the graph is not changed once built.
    public void setTracks(Map<Integer, CourseTrack> tracks) {
        this.tracks = new LinkedHashMap<>(tracks);
    }

    public boolean isActive() {
        return tracks.values().stream().anyMatch(courseTrack -> courseTrack.getStatus().isActive());
    }

    @Override
    public String toString() {
        return "Course(" + id + ", " + nr + ". " + shortname + ")";
    }
}
