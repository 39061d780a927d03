package com.eventdocs.render.modules.event.application;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.springframework.stereotype.Component;

import com.eventdocs.render.modules.event.domain.Course;
import com.eventdocs.render.modules.event.domain.Event;
import com.eventdocs.render.modules.event.domain.EventPart;
import com.eventdocs.render.modules.event.domain.EventTrack;
import com.eventdocs.render.modules.event.domain.FieldDefinition;
import com.eventdocs.render.modules.event.domain.Lodgement;
import com.eventdocs.render.modules.event.domain.LodgementGroup;
import com.eventdocs.render.modules.event.domain.Registration;
import com.eventdocs.render.modules.event.domain.SchemaVersion;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns a partial export into the wired {@link Event} graph in one synchronous pass. Nothing is exposed before the
 * whole graph is built; any {@link com.eventdocs.render.global.error.ProblemException} aborts the build.
 */
@Component
public class EventGraphBuilder {

    private final ExportVersionGate versionGate;
    private final EventEntityFactory factory;
    private final CrossLinkResolver resolver;

    public EventGraphBuilder(ExportVersionGate versionGate, EventEntityFactory factory, CrossLinkResolver resolver) {
        this.versionGate = versionGate;
        this.factory = factory;
        this.resolver = resolver;
    }

    public Event build(JsonNode root) {
        SchemaVersion version = versionGate.check(root);
        JsonNode eventNode = ExportJson.require(root, "event");
        Map<String, FieldDefinition> fieldDefinitions = factory.fieldDefinitions(eventNode.get("fields"));

        List<EventPart> parts = new ArrayList<>();
        List<EventTrack> tracks = new ArrayList<>();
        for (ExportJson.Entry partEntry : ExportJson.entries(eventNode.get("parts"))) {
            EventPart part = factory.part(partEntry.id(), partEntry.node());
            parts.add(part);
            for (ExportJson.Entry trackEntry : ExportJson.entries(partEntry.node().get("tracks"))) {
                tracks.add(factory.track(trackEntry.id(), trackEntry.node(), part));
            }
        }
        parts.sort(EventOrdering.PARTS);
        tracks.sort(EventOrdering.TRACKS);
        tracks.forEach(track -> track.getPart().addTrack(track));
        Map<Integer, EventPart> partsById = byId(parts, EventPart::getId);
        Map<Integer, EventTrack> tracksById = byId(tracks, EventTrack::getId);

        List<Course> courses = new ArrayList<>();
        for (ExportJson.Entry entry : ExportJson.entries(root.get("courses"))) {
            courses.add(factory.course(entry.id(), entry.node(), fieldDefinitions, tracksById));
        }
        courses.sort(EventOrdering.courses(courses));
        Map<Integer, Course> coursesById = byId(courses, Course::getId);

        List<LodgementGroup> lodgementGroups = new ArrayList<>();
        for (ExportJson.Entry entry : ExportJson.entries(root.get("lodgement_groups"))) {
            lodgementGroups.add(factory.lodgementGroup(entry.id(), entry.node()));
        }
        lodgementGroups.sort(EventOrdering.LODGEMENT_GROUPS);
        Map<Integer, LodgementGroup> groupsById = byId(lodgementGroups, LodgementGroup::getId);

        List<Lodgement> lodgements = new ArrayList<>();
        for (ExportJson.Entry entry : ExportJson.entries(root.get("lodgements"))) {
            lodgements.add(factory.lodgement(entry.id(), entry.node(), groupsById, fieldDefinitions, parts));
        }
        lodgements.sort(EventOrdering.LODGEMENTS);
        lodgements.stream()
                .filter(lodgement -> lodgement.getGroup() != null)
                .forEach(lodgement -> lodgement.getGroup().addLodgement(lodgement));
        Map<Integer, Lodgement> lodgementsById = byId(lodgements, Lodgement::getId);

        LocalDate eventBegin = parts.isEmpty() ? null : parts.get(0).getBegin();
        List<Registration> registrations = new ArrayList<>();
        for (ExportJson.Entry entry : ExportJson.entries(root.get("registrations"))) {
            registrations.add(factory.registration(entry.id(), entry.node(), eventBegin, fieldDefinitions,
                    partsById, tracksById, coursesById, lodgementsById));
        }
        registrations.sort(EventOrdering.REGISTRATIONS);

        resolver.resolve(parts, tracks, courses, registrations);

        return new Event(
                ExportJson.text(eventNode, "title"),
                ExportJson.text(eventNode, "shortname"),
                courseRoomField(eventNode.get("course_room_field"), fieldDefinitions),
                ExportValueParser.parseDateTime(ExportJson.text(root, "timestamp")),
                version,
                fieldDefinitions,
                parts,
                tracks,
                courses,
                lodgementGroups,
                lodgements,
                registrations
        );
    }

    // Newer exports name the field, older ones reference its id.
    private static String courseRoomField(JsonNode node, Map<String, FieldDefinition> fieldDefinitions) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return fieldDefinitions.values().stream()
                    .filter(definition -> definition.id() != null && definition.id() == node.intValue())
                    .map(FieldDefinition::name)
                    .findFirst()
                    .orElse(null);
        }
        return node.asText();
    }

    private static <T> Map<Integer, T> byId(List<T> entities, Function<T, Integer> idOf) {
        Map<Integer, T> result = new LinkedHashMap<>();
        for (T entity : entities) {
            result.put(idOf.apply(entity), entity);
        }
        return result;
    }
}
