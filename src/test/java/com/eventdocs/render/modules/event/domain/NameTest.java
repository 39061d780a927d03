package com.eventdocs.render.modules.event.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NameTest {

    private final Name anna = new Name("Dr.", "Anna Maria", "Adler", "von", "Anna");
    private final Name carl = new Name(null, "Carl", "Clausen", null, "Carli");
    private final Name bernd = new Name(null, "Bernd", "Berg", null, "Bernd");

    @Test
    @DisplayName("the display name is used in running text only if it is one of the given names")
    void common() {
        assertThat(anna.common()).isEqualTo("Anna Adler");
        assertThat(carl.common()).isEqualTo("Carl Clausen");
        assertThat(bernd.common()).isEqualTo("Bernd Berg");
    }

    @Test
    @DisplayName("the salutation prefers the display name")
    void salutation() {
        assertThat(anna.salutation()).isEqualTo("Anna");
        assertThat(carl.salutation()).isEqualTo("Carli");
        assertThat(new Name(null, "Dora", "Dietz", null, " ").salutation()).isEqualTo("Dora");
    }

    @Test
    @DisplayName("the legal name carries title and supplement")
    void legal() {
        assertThat(anna.legal()).isEqualTo("Dr. Anna Maria Adler von");
        assertThat(bernd.legal()).isEqualTo("Bernd Berg");
    }

    @Test
    @DisplayName("nametags move the given names to the surname line for a distinct display name")
    void nametag() {
        assertThat(anna.nametagForename()).isEqualTo("Anna");
        assertThat(anna.nametagSurname()).isEqualTo("Anna Maria Adler");
        assertThat(carl.nametag()).isEqualTo("Carli Carl Clausen");
        assertThat(bernd.nametagSurname()).isEqualTo("Berg");
        assertThat(bernd.nametag()).isEqualTo("Bernd Berg");
    }

    @Test
    @DisplayName("the organizational name shows a distinct display name in parentheses")
    void organizational() {
        assertThat(anna.organizational()).isEqualTo("Anna Maria (Anna) Adler");
        assertThat(bernd.organizational()).isEqualTo("Bernd Berg");
        assertThat(bernd.hasDistinctDisplayName()).isFalse();
    }

    @Test
    @DisplayName("missing parts are treated as empty")
    void nullParts() {
        Name name = new Name(null, null, "Solo", null, null);

        assertThat(name.givenNames()).isEmpty();
        assertThat(name.common()).isEqualTo("Solo");
        assertThat(name.legal()).isEqualTo("Solo");
    }
}
