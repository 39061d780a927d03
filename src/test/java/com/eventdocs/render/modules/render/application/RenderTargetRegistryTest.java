package com.eventdocs.render.modules.render.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.eventdocs.render.global.error.ProblemException;
import com.eventdocs.render.modules.event.domain.Event;
import com.eventdocs.render.modules.render.domain.RenderTarget;
import com.eventdocs.render.modules.render.domain.RenderTask;
import com.eventdocs.render.support.ExportFixtures;

class RenderTargetRegistryTest {

    private final RenderTarget overview = (event, match) ->
            List.of(new RenderTask("overview.tex", "overview_" + event.getShortname(), Map.of("event", event), true));

    @Test
    @DisplayName("targets are listed in registration order")
    void names() {
        RenderTargetRegistry registry = new RenderTargetRegistry()
                .register("zeta", overview)
                .register("alpha", overview);

        assertThat(registry.names()).containsExactly("zeta", "alpha");
        assertThat(registry.find("alpha")).containsSame(overview);
        assertThat(registry.find("beta")).isEmpty();
    }

    @Test
    @DisplayName("duplicate and blank names are rejected")
    void invalidNames() {
        RenderTargetRegistry registry = new RenderTargetRegistry().register("overview", overview);

        assertThatThrownBy(() -> registry.register("overview", overview))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(" ", overview))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("tasks are created by the named target")
    void createTasks() {
        Event event = ExportFixtures.summerAcademyEvent();
        RenderTargetRegistry registry = new RenderTargetRegistry().register("overview", overview);

        List<RenderTask> tasks = registry.createTasks("overview", event, null);

        assertThat(tasks).singleElement().satisfies(task -> {
            assertThat(task.jobName()).isEqualTo("overview_SoAk24");
            assertThat(task.compileTwice()).isTrue();
            assertThat(task.arguments()).containsEntry("event", event);
        });
        assertThatThrownBy(() -> registry.createTasks("missing", event, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("UNKNOWN_TARGET"));
    }

    @Test
    @DisplayName("render tasks need a template and a job name")
    void invalidTask() {
        assertThatThrownBy(() -> new RenderTask("", "job", Map.of(), false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RenderTask("a.tex", null, Map.of(), false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new RenderTask("a.tex", "job", null, false).arguments()).isEmpty();
    }
}
