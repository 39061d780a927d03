package com.eventdocs.render.modules.event.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.eventdocs.render.modules.event.domain.Address;
import com.eventdocs.render.modules.event.domain.Course;
import com.eventdocs.render.modules.event.domain.EventPart;
import com.eventdocs.render.modules.event.domain.Gender;
import com.eventdocs.render.modules.event.domain.Lodgement;
import com.eventdocs.render.modules.event.domain.Name;
import com.eventdocs.render.modules.event.domain.Persona;
import com.eventdocs.render.modules.event.domain.Registration;

class EventOrderingTest {

    private static Course course(int id, String nr) {
        return new Course(id, nr, "Course " + id, "C" + id, Map.of());
    }

    private static Registration registration(int id, String given, String family) {
        Persona persona = new Persona(id, new Name(null, given, family, null, null), Gender.NOT_SPECIFIED, null,
                null, null, null, new Address(null, null, null, null, null), false);
        return new Registration(id, persona, null, false, Map.of());
    }

    @Test
    @DisplayName("course numbers sort by length first, courses without number lead")
    void coursesByPaddedNumber() {
        List<Course> courses = new ArrayList<>(List.of(
                course(1, "10"), course(2, "2"), course(3, ""), course(4, "1a"), course(5, "2")));

        courses.sort(EventOrdering.courses(courses));

        assertThat(courses).extracting(Course::getId).containsExactly(3, 2, 5, 1, 4);
    }

    @Test
    @DisplayName("the padded sort key has the full width")
    void courseSortKey() {
        assertThat(EventOrdering.courseSortKey("7", 3)).isEqualTo("\0\0" + "7");
        assertThat(EventOrdering.courseSortKey(null, 2)).isEqualTo("\0\0");
        assertThat(EventOrdering.courseSortKey("123", 2)).isEqualTo("123");
        assertThat(EventOrdering.maxNumberWidth(List.of("1", "", "12a"))).isEqualTo(3);
        assertThat(EventOrdering.maxNumberWidth(List.of())).isZero();
    }

    @Test
    @DisplayName("registrations sort by given names, family name and id")
    void registrations() {
        List<Registration> registrations = new ArrayList<>(List.of(
                registration(4, "Anna", "Zander"),
                registration(2, "Anna", "Adler"),
                registration(1, "Anna", "Adler"),
                registration(3, "Aaron", "Zander")));

        registrations.sort(EventOrdering.REGISTRATIONS);

        assertThat(registrations).extracting(Registration::getId).containsExactly(3, 1, 2, 4);
    }

    @Test
    @DisplayName("parts sort by begin, lodgements by title with missing titles first")
    void partsAndLodgements() {
        EventPart late = new EventPart(1, "Late", "L", LocalDate.of(2024, 8, 1), LocalDate.of(2024, 8, 5));
        EventPart early = new EventPart(2, "Early", "E", LocalDate.of(2024, 7, 1), LocalDate.of(2024, 7, 5));
        EventPart sameDay = new EventPart(0, "Early too", "E2", LocalDate.of(2024, 7, 1), LocalDate.of(2024, 7, 3));
        List<EventPart> parts = new ArrayList<>(List.of(late, early, sameDay));
        parts.sort(EventOrdering.PARTS);
        assertThat(parts).containsExactly(sameDay, early, late);

        List<Lodgement> lodgements = new ArrayList<>(List.of(
                new Lodgement(3, "B", null, Map.of(), parts),
                new Lodgement(2, null, null, Map.of(), parts),
                new Lodgement(1, "B", null, Map.of(), parts),
                new Lodgement(4, "A", null, Map.of(), parts)));
        lodgements.sort(EventOrdering.LODGEMENTS);
        assertThat(lodgements).extracting(Lodgement::getId).containsExactly(2, 4, 1, 3);
    }
}
