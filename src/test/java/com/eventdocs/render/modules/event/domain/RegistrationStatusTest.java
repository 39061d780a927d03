package com.eventdocs.render.modules.event.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RegistrationStatusTest {

    @Test
    @DisplayName("age classes are checked from the top")
    void ageClasses() {
        assertThat(AgeClass.of(18)).isEqualTo(AgeClass.FULL);
        assertThat(AgeClass.of(17)).isEqualTo(AgeClass.U18);
        assertThat(AgeClass.of(16)).isEqualTo(AgeClass.U18);
        assertThat(AgeClass.of(15)).isEqualTo(AgeClass.U16);
        assertThat(AgeClass.of(13)).isEqualTo(AgeClass.U14);
        assertThat(AgeClass.FULL.isMinor()).isFalse();
        assertThat(AgeClass.U14.isMinor()).isTrue();
    }

    @Test
    @DisplayName("status predicates follow the exporter's semantics")
    void statusPredicates() {
        assertThat(Arrays.stream(RegistrationPartStatus.values()).filter(RegistrationPartStatus::isPresent))
                .containsExactly(RegistrationPartStatus.PARTICIPANT, RegistrationPartStatus.GUEST);
        assertThat(Arrays.stream(RegistrationPartStatus.values()).filter(RegistrationPartStatus::isInvolved))
                .containsExactly(RegistrationPartStatus.APPLIED, RegistrationPartStatus.PARTICIPANT,
                        RegistrationPartStatus.WAITLIST, RegistrationPartStatus.GUEST);
        assertThat(RegistrationPartStatus.fromCode(-1)).isEqualTo(RegistrationPartStatus.NOT_APPLIED);
        assertThat(RegistrationPartStatus.fromCode(7)).isNull();
        assertThat(Gender.fromCode(0)).isEqualTo(Gender.NOT_SPECIFIED);
        assertThat(Gender.fromCode(1)).isEqualTo(Gender.MALE);
        assertThat(Gender.fromCode(2)).isEqualTo(Gender.FEMALE);
        assertThat(Gender.fromCode(10)).isNull();
    }

    @Test
    @DisplayName("a registration without known age counts as adult")
    void registrationWithoutAge() {
        Persona persona = new Persona(1, new Name(null, "Jo", "Doe", null, null), Gender.OTHER, null,
                null, null, null, new Address(null, null, null, null, null), false);
        Registration registration = new Registration(1, persona, null, false, Map.of());

        assertThat(registration.getAgeClass()).isEqualTo(AgeClass.FULL);
        assertThat(registration.isMinor()).isFalse();
    }

    @Test
    @DisplayName("registration predicates hold if any part qualifies")
    void registrationPredicates() {
        EventPart first = new EventPart(1, "First", "1", LocalDate.of(2024, 7, 1), LocalDate.of(2024, 7, 3));
        EventPart second = new EventPart(2, "Second", "2", LocalDate.of(2024, 7, 4), LocalDate.of(2024, 7, 4));
        Persona persona = new Persona(1, new Name(null, "Jo", "Doe", null, null), Gender.OTHER,
                LocalDate.of(2010, 1, 1), null, null, null, new Address(null, null, null, null, null), false);
        Registration registration = new Registration(1, persona, 14, false, Map.of());
        registration.setParts(Map.of(
                1, new RegistrationPart(registration, first, RegistrationPartStatus.WAITLIST, null, false),
                2, new RegistrationPart(registration, second, RegistrationPartStatus.GUEST, null, false)));

        assertThat(registration.isPresent()).isTrue();
        assertThat(registration.isParticipant()).isFalse();
        assertThat(registration.isInvolved()).isTrue();
        assertThat(registration.getAgeClass()).isEqualTo(AgeClass.U16);
        assertThat(second.getDays()).containsExactly(LocalDate.of(2024, 7, 4));
        assertThat(first.getDays()).hasSize(3);
        assertThat(List.of(SchemaVersion.of(15, Integer.MAX_VALUE).toString(), SchemaVersion.of(12, 0).toString()))
                .containsExactly("15.*", "12.0");
    }
}
