package com.eventdocs.render.modules.render.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.eventdocs.render.modules.event.domain.Event;
import com.eventdocs.render.modules.event.domain.EventPart;
import com.eventdocs.render.support.ExportFixtures;
import com.fasterxml.jackson.databind.node.ObjectNode;

class JobNamesTest {

    @Test
    @DisplayName("reserved characters and spaces become underscores")
    void sanitizeFilename() {
        assertThat(JobNames.sanitizeFilename("a/b c:d.tex")).isEqualTo("a_b_c_d.tex");
        assertThat(JobNames.sanitizeFilename("\"x\"|<y>*?%\\")).isEqualTo("_x___y_____");
        assertThat(JobNames.sanitizeFilename("Kurs-2.H")).isEqualTo("Kurs-2.H");
    }

    @Test
    @DisplayName("null names are rejected")
    void sanitizeNull() {
        assertThatThrownBy(() -> JobNames.sanitizeFilename(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("part suffixes come from the shortnames")
    void partSuffixes() {
        Event event = ExportFixtures.summerAcademyEvent();

        assertThat(JobNames.partSuffixes(event).values()).containsExactly("1.H", "2.H");
    }

    @Test
    @DisplayName("colliding part suffixes get the part id appended")
    void ambiguousPartSuffixes() {
        ObjectNode root = ExportFixtures.summerAcademy();
        ((ObjectNode) root.path("event").path("parts").path("2")).put("shortname", "1 H");
        ((ObjectNode) root.path("event").path("parts").path("1")).put("shortname", "1/H");

        Map<EventPart, String> suffixes = JobNames.partSuffixes(ExportFixtures.build(root));

        assertThat(suffixes.values()).containsExactly("1_H_1", "1_H_2");
    }
}
