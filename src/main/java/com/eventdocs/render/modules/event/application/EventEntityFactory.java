package com.eventdocs.render.modules.event.application;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.eventdocs.render.global.error.ProblemException;
import com.eventdocs.render.modules.event.domain.Address;
import com.eventdocs.render.modules.event.domain.Course;
import com.eventdocs.render.modules.event.domain.CourseTrack;
import com.eventdocs.render.modules.event.domain.CourseTrackStatus;
import com.eventdocs.render.modules.event.domain.EventPart;
import com.eventdocs.render.modules.event.domain.EventTrack;
import com.eventdocs.render.modules.event.domain.FieldAssociation;
import com.eventdocs.render.modules.event.domain.FieldDatatype;
import com.eventdocs.render.modules.event.domain.FieldDefinition;
import com.eventdocs.render.modules.event.domain.Gender;
import com.eventdocs.render.modules.event.domain.Lodgement;
import com.eventdocs.render.modules.event.domain.LodgementGroup;
import com.eventdocs.render.modules.event.domain.Name;
import com.eventdocs.render.modules.event.domain.Persona;
import com.eventdocs.render.modules.event.domain.Registration;
import com.eventdocs.render.modules.event.domain.RegistrationPart;
import com.eventdocs.render.modules.event.domain.RegistrationPartStatus;
import com.eventdocs.render.modules.event.domain.RegistrationTrack;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds one entity from its JSON fragment and the entities it references. Each factory wires the entity's direct
 * relationships; missing relations are completed later by {@link CrossLinkResolver}.
 */
@Component
public class EventEntityFactory {

    private static final Logger log = LoggerFactory.getLogger(EventEntityFactory.class);

    public Map<String, FieldDefinition> fieldDefinitions(JsonNode fieldsNode) {
        Map<String, FieldDefinition> definitions = new LinkedHashMap<>();
        if (fieldsNode == null || !fieldsNode.isObject()) {
            return definitions;
        }
        fieldsNode.fields().forEachRemaining(entry -> {
            JsonNode node = entry.getValue();
            String name = ExportJson.text(node, "field_name");
            if (name == null) {
                name = entry.getKey();
            }
            int kindCode = ExportJson.requireInt(node, "kind");
            FieldDatatype datatype = FieldDatatype.fromCode(kindCode);
            if (datatype == null) {
                throw new ProblemException("UNKNOWN_CODE", "Unknown datatype " + kindCode + " of field '" + name + "'");
            }
            Integer associationCode = ExportJson.optionalId(node, "association");
            FieldAssociation association = null;
            if (associationCode != null) {
                association = FieldAssociation.fromCode(associationCode);
                if (association == null) {
                    throw new ProblemException("UNKNOWN_CODE",
                            "Unknown association " + associationCode + " of field '" + name + "'");
                }
            }
            Integer id = ExportJson.optionalId(node, "id");
            definitions.put(name, new FieldDefinition(id, name, datatype, association));
        });
        return definitions;
    }

    public EventPart part(int id, JsonNode node) {
        return new EventPart(
                id,
                ExportJson.text(node, "title"),
                ExportJson.text(node, "shortname"),
                ExportValueParser.parseDate(ExportJson.require(node, "part_begin").asText()),
                ExportValueParser.parseDate(ExportJson.require(node, "part_end").asText())
        );
    }

    /**
     * Builds the track of {@code part}. The caller appends it to the part once all tracks are sorted.
     */
    public EventTrack track(int id, JsonNode node, EventPart part) {
        return new EventTrack(
                id,
                ExportJson.text(node, "title"),
                ExportJson.text(node, "shortname"),
                ExportJson.intOrDefault(node, "sortkey", 0),
                ExportJson.intOrDefault(node, "num_choices", 0),
                part
        );
    }

    public LodgementGroup lodgementGroup(int id, JsonNode node) {
        return new LodgementGroup(id, ExportJson.text(node, "title", "moniker"));
    }

    /**
     * Builds the course with a {@link CourseTrack} for every track its segments mention.
     */
    public Course course(int id, JsonNode node, Map<String, FieldDefinition> fieldDefinitions,
                         Map<Integer, EventTrack> tracksById) {
        Course course = new Course(
                id,
                ExportJson.text(node, "nr"),
                ExportJson.text(node, "title"),
                ExportJson.text(node, "shortname"),
                ExportValueParser.decodeFields(node.get("fields"), fieldDefinitions, FieldAssociation.COURSE)
        );
        course.setTracks(segments(course, node, tracksById));
        return course;
    }

    private Map<Integer, CourseTrack> segments(Course course, JsonNode node, Map<Integer, EventTrack> tracksById) {
        Map<Integer, CourseTrack> courseTracks = new LinkedHashMap<>();
        JsonNode segments = node.path("segments");
        if (segments.isObject()) {
            for (ExportJson.Entry segment : ExportJson.entries(segments)) {
                CourseTrackStatus status = segment.node().asBoolean(false)
                        ? CourseTrackStatus.ACTIVE : CourseTrackStatus.CANCELLED;
                putSegment(courseTracks, course, segment.id(), status, tracksById);
            }
        } else if (segments.isArray()) {
            Set<Integer> activeSegments = new HashSet<>();
            node.path("active_segments").forEach(trackId -> activeSegments.add(trackId.asInt()));
            for (JsonNode trackId : segments) {
                CourseTrackStatus status = activeSegments.contains(trackId.asInt())
                        ? CourseTrackStatus.ACTIVE : CourseTrackStatus.CANCELLED;
                putSegment(courseTracks, course, trackId.asInt(), status, tracksById);
            }
        }
        return courseTracks;
    }

    private void putSegment(Map<Integer, CourseTrack> courseTracks, Course course, int trackId,
                            CourseTrackStatus status, Map<Integer, EventTrack> tracksById) {
        EventTrack track = tracksById.get(trackId);
        if (track == null) {
            log.debug("Course {} has a segment in unknown track {}", course.getId(), trackId);
            return;
        }
        courseTracks.put(trackId, new CourseTrack(course, track, status));
    }

    /**
     * Builds the lodgement. An unknown group id leaves the lodgement without group; the caller appends the lodgement
     * to its group once all lodgements are sorted.
     */
    public Lodgement lodgement(int id, JsonNode node, Map<Integer, LodgementGroup> groupsById,
                               Map<String, FieldDefinition> fieldDefinitions, List<EventPart> parts) {
        Integer groupId = ExportJson.optionalId(node, "group_id");
        LodgementGroup group = groupId != null ? groupsById.get(groupId) : null;
        if (groupId != null && group == null) {
            log.debug("Lodgement {} references unknown lodgement group {}", id, groupId);
        }
        return new Lodgement(
                id,
                ExportJson.text(node, "title", "moniker"),
                group,
                ExportValueParser.decodeFields(node.get("fields"), fieldDefinitions, FieldAssociation.LODGEMENT),
                parts
        );
    }

    /**
     * Builds the registration with the part and track entries present in the export.
     *
     * @param ageReference the date the age is computed for, usually the begin of the event
     */
    public Registration registration(int id, JsonNode node, LocalDate ageReference,
                                     Map<String, FieldDefinition> fieldDefinitions,
                                     Map<Integer, EventPart> partsById,
                                     Map<Integer, EventTrack> tracksById,
                                     Map<Integer, Course> coursesById,
                                     Map<Integer, Lodgement> lodgementsById) {
        Persona persona = persona(node);
        Integer age = persona.birthday() != null && ageReference != null
                ? ExportValueParser.age(ageReference, persona.birthday())
                : null;
        Registration registration = new Registration(
                id,
                persona,
                age,
                ExportJson.flag(node, "list_consent"),
                ExportValueParser.decodeFields(node.get("fields"), fieldDefinitions, FieldAssociation.REGISTRATION)
        );
        registration.setParts(registrationParts(registration, node.path("parts"), partsById, lodgementsById));
        registration.setTracks(registrationTracks(registration, node.path("tracks"), tracksById, coursesById));
        return registration;
    }

    private Persona persona(JsonNode registrationNode) {
        JsonNode node = registrationNode.has("persona") ? registrationNode.get("persona") : registrationNode;
        Integer personaId = ExportJson.optionalId(node, "id");
        if (personaId == null || node == registrationNode) {
            personaId = ExportJson.requireInt(registrationNode, "persona_id");
        }

        Integer genderCode = ExportJson.optionalId(node, "gender");
        Gender gender = Gender.NOT_SPECIFIED;
        if (genderCode != null) {
            gender = Gender.fromCode(genderCode);
            if (gender == null) {
                throw new ProblemException("UNKNOWN_CODE", "Unknown gender " + genderCode + " of persona " + personaId);
            }
        }

        return new Persona(
                personaId,
                new Name(
                        ExportJson.text(node, "title"),
                        ExportJson.text(node, "given_names"),
                        ExportJson.text(node, "family_name"),
                        ExportJson.text(node, "name_supplement"),
                        ExportJson.text(node, "display_name")
                ),
                gender,
                ExportValueParser.parseDate(ExportJson.text(node, "birthday")),
                ExportJson.text(node, "username", "email"),
                ExportJson.text(node, "telephone"),
                ExportJson.text(node, "mobile"),
                new Address(
                        ExportJson.text(node, "address"),
                        ExportJson.text(node, "address_supplement"),
                        ExportJson.text(node, "postal_code"),
                        ExportJson.text(node, "location"),
                        ExportJson.text(node, "country")
                ),
                ExportJson.flag(node, "is_orga") || ExportJson.flag(registrationNode, "is_orga")
        );
    }

    private Map<Integer, RegistrationPart> registrationParts(Registration registration, JsonNode partsNode,
                                                              Map<Integer, EventPart> partsById,
                                                              Map<Integer, Lodgement> lodgementsById) {
        Map<Integer, RegistrationPart> parts = new LinkedHashMap<>();
        for (ExportJson.Entry entry : ExportJson.entries(partsNode)) {
            EventPart part = partsById.get(entry.id());
            if (part == null) {
                log.debug("Registration {} has an entry for unknown part {}", registration.getId(), entry.id());
                continue;
            }
            int statusCode = ExportJson.requireInt(entry.node(), "status");
            RegistrationPartStatus status = RegistrationPartStatus.fromCode(statusCode);
            if (status == null) {
                throw new ProblemException("UNKNOWN_CODE",
                        "Unknown status " + statusCode + " of registration " + registration.getId());
            }
            Integer lodgementId = ExportJson.optionalId(entry.node(), "lodgement_id");
            Lodgement lodgement = lodgementId != null ? lodgementsById.get(lodgementId) : null;
            if (lodgementId != null && lodgement == null) {
                log.debug("Registration {} references unknown lodgement {} in part {}",
                        registration.getId(), lodgementId, part.getId());
            }
            parts.put(part.getId(), new RegistrationPart(registration, part, status, lodgement,
                    ExportJson.flag(entry.node(), "is_camping_mat")));
        }
        return parts;
    }

    private Map<Integer, RegistrationTrack> registrationTracks(Registration registration, JsonNode tracksNode,
                                                                Map<Integer, EventTrack> tracksById,
                                                                Map<Integer, Course> coursesById) {
        Map<Integer, RegistrationTrack> tracks = new LinkedHashMap<>();
        for (ExportJson.Entry entry : ExportJson.entries(tracksNode)) {
            EventTrack track = tracksById.get(entry.id());
            if (track == null) {
                log.debug("Registration {} has an entry for unknown track {}", registration.getId(), entry.id());
                continue;
            }
            JsonNode node = entry.node();
            tracks.put(track.getId(), new RegistrationTrack(
                    registration,
                    track,
                    course(registration, node.get("course_id"), coursesById),
                    course(registration, node.get("course_instructor"), coursesById),
                    choices(registration, node.path("choices"), track.getNumChoices(), coursesById)
            ));
        }
        return tracks;
    }

    private static Course course(Registration registration, JsonNode courseId, Map<Integer, Course> coursesById) {
        if (courseId == null || courseId.isNull() || courseId.isMissingNode()) {
            return null;
        }
        int id = courseId.isTextual() ? ExportJson.parseId(courseId.textValue()) : courseId.intValue();
        Course course = coursesById.get(id);
        if (course == null) {
            log.debug("Registration {} references unknown course {}", registration.getId(), id);
        }
        return course;
    }

    private static List<Course> choices(Registration registration, JsonNode choicesNode, int numChoices,
                                        Map<Integer, Course> coursesById) {
        List<Course> choices = new ArrayList<>(numChoices);
        for (int rank = 0; rank < numChoices; rank++) {
            choices.add(course(registration, choicesNode.path(rank), coursesById));
        }
        return choices;
    }
}
