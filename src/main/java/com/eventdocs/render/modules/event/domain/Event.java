package com.eventdocs.render.modules.event.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fully wired event graph. Read-only once returned by the loader, so it may be shared between rendering threads.
 */
public class Event {

    private final String title;
    private final String shortname;
    private final String courseRoomField;
    private final OffsetDateTime timestamp;
    private final SchemaVersion schemaVersion;
    private final Map<String, FieldDefinition> fieldDefinitions;
    private final List<EventPart> parts;
    private final List<EventTrack> tracks;
    private final List<Course> courses;
    private final List<LodgementGroup> lodgementGroups;
    private final List<Lodgement> lodgements;
    private final List<Registration> registrations;

    private final Map<Integer, EventPart> partsById;
    private final Map<Integer, EventTrack> tracksById;
    private final Map<Integer, Course> coursesById;
    private final Map<Integer, LodgementGroup> lodgementGroupsById;
    private final Map<Integer, Lodgement> lodgementsById;
    private final Map<Integer, Registration> registrationsById;

    public Event(
            String title,
            String shortname,
            String courseRoomField,
            OffsetDateTime timestamp,
            SchemaVersion schemaVersion,
            Map<String, FieldDefinition> fieldDefinitions,
            List<EventPart> parts,
            List<EventTrack> tracks,
            List<Course> courses,
            List<LodgementGroup> lodgementGroups,
            List<Lodgement> lodgements,
            List<Registration> registrations
    ) {
        this.title = title;
        this.shortname = shortname;
        this.courseRoomField = courseRoomField;
        this.timestamp = timestamp;
        this.schemaVersion = schemaVersion;
        this.fieldDefinitions = Map.copyOf(fieldDefinitions);
        this.parts = List.copyOf(parts);
        this.tracks = List.copyOf(tracks);
        this.courses = List.copyOf(courses);
        this.lodgementGroups = List.copyOf(lodgementGroups);
        this.lodgements = List.copyOf(lodgements);
        this.registrations = List.copyOf(registrations);

        this.partsById = index(this.parts, EventPart::getId);
        this.tracksById = index(this.tracks, EventTrack::getId);
        this.coursesById = index(this.courses, Course::getId);
        this.lodgementGroupsById = index(this.lodgementGroups, LodgementGroup::getId);
        this.lodgementsById = index(this.lodgements, Lodgement::getId);
        this.registrationsById = index(this.registrations, Registration::getId);
    }

    private static <T> Map<Integer, T> index(Collection<T> entities, Function<T, Integer> idOf) {
        return entities.stream().collect(Collectors.toUnmodifiableMap(idOf, Function.identity()));
    }

    public String getTitle() {
        return title;
    }

    public String getShortname() {
        return shortname;
    }

    /**
     * @return name of the course field holding the course room, or {@code null} if the event has none
     */
    public String getCourseRoomField() {
        return courseRoomField;
    }

    public OffsetDateTime getTimestamp() {
        return timestamp;
    }

    public SchemaVersion getSchemaVersion() {
        return schemaVersion;
    }

    public Map<String, FieldDefinition> getFieldDefinitions() {
        return fieldDefinitions;
    }

    public List<EventPart> getParts() {
        return parts;
    }

    public List<EventTrack> getTracks() {
        return tracks;
    }

    public List<Course> getCourses() {
        return courses;
    }

    public List<LodgementGroup> getLodgementGroups() {
        return lodgementGroups;
    }

    public List<Lodgement> getLodgements() {
        return lodgements;
    }

    public List<Registration> getRegistrations() {
        return registrations;
    }

    public Optional<EventPart> findPart(int id) {
        return Optional.ofNullable(partsById.get(id));
    }

    public Optional<EventTrack> findTrack(int id) {
        return Optional.ofNullable(tracksById.get(id));
    }

    public Optional<Course> findCourse(int id) {
        return Optional.ofNullable(coursesById.get(id));
    }

    public Optional<LodgementGroup> findLodgementGroup(int id) {
        return Optional.ofNullable(lodgementGroupsById.get(id));
    }

    public Optional<Lodgement> findLodgement(int id) {
        return Optional.ofNullable(lodgementsById.get(id));
    }

    public Optional<Registration> findRegistration(int id) {
        return Optional.ofNullable(registrationsById.get(id));
    }

    public LocalDate getBegin() {
        return parts.stream().map(EventPart::getBegin).min(LocalDate::compareTo).orElse(null);
    }

    public LocalDate getEnd() {
        return parts.stream().map(EventPart::getEnd).max(LocalDate::compareTo).orElse(null);
    }

    /**
     * @return the sorted union of all parts' days
     */
    public List<LocalDate> getDays() {
        TreeSet<LocalDate> days = new TreeSet<>();
        parts.forEach(part -> days.addAll(part.getDays()));
        return List.copyOf(days);
    }

    public Optional<Object> getCourseRoom(Course course) {
        if (courseRoomField == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(course.getField(courseRoomField));
    }
}
