package com.reviewgate.engine.execution;

import com.reviewgate.core.exception.DefinitionValidationException;
import com.reviewgate.core.model.Stage;
import com.reviewgate.core.model.TaskSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class WavePlannerTest {

    private final WavePlanner planner = new WavePlanner();

    private static List<List<String>> ids(List<List<TaskSpec>> waves) {
        return waves.stream().map(w -> w.stream().map(TaskSpec::id).toList()).toList();
    }

    @Test
    void plan_independentTasks_shouldFormOneWaveInDeclaredOrder() {
        Stage stage = Stage.parallel("review",
            TaskSpec.builder("security").build(),
            TaskSpec.builder("code-quality").build(),
            TaskSpec.builder("architect").build());

        assertEquals(List.of(List.of("security", "code-quality", "architect")), ids(planner.plan(stage)));
    }

    @Test
    void plan_chainAndDiamond_shouldLayerByDependencies() {
        Stage stage = Stage.parallel("review",
            TaskSpec.builder("summary").dependsOn("security", "code-quality").build(),
            TaskSpec.builder("security").dependsOn("checkout").build(),
            TaskSpec.builder("checkout").build(),
            TaskSpec.builder("code-quality").dependsOn("checkout").build());

        assertEquals(List.of(
            List.of("checkout"),
            List.of("security", "code-quality"),
            List.of("summary")), ids(planner.plan(stage)));
    }

    @Test
    void plan_dependencyOnEarlierStage_shouldBeIgnored() {
        Stage stage = Stage.parallel("tracking",
            TaskSpec.builder("jira-integration").dependsOn("architect").build(),
            TaskSpec.builder("changelog").build());

        assertEquals(List.of(List.of("jira-integration", "changelog")), ids(planner.plan(stage)));
    }

    @Test
    void plan_cycle_shouldBeRejected() {
        Stage stage = Stage.parallel("review",
            TaskSpec.builder("a").dependsOn("b").build(),
            TaskSpec.builder("b").dependsOn("a").build(),
            TaskSpec.builder("c").build());

        assertThatThrownBy(() -> planner.plan(stage))
            .isInstanceOf(DefinitionValidationException.class)
            .satisfies(e -> assertThat(((DefinitionValidationException) e).getViolations())
                .singleElement().asString().contains("cyclic dependsOn among [a, b]"));
    }
}
