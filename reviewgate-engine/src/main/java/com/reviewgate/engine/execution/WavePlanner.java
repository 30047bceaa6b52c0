package com.reviewgate.engine.execution;

import com.reviewgate.core.exception.DefinitionValidationException;
import com.reviewgate.core.model.Stage;
import com.reviewgate.core.model.TaskSpec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Partitions a stage's tasks into waves by their intra-stage dependencies.
 * A wave holds every task whose same-stage dependencies sit in earlier waves;
 * tasks keep their declared order inside a wave. Dependencies on tasks of
 * earlier stages are already satisfied and ignored here.
 */
public class WavePlanner {

    /**
     * Plan the waves of a stage.
     *
     * @param stage The stage
     * @return Waves in dispatch order
     * @throws DefinitionValidationException if the intra-stage dependencies are cyclic
     */
    public List<List<TaskSpec>> plan(Stage stage) {
        Set<String> stageTaskIds = new HashSet<>();
        for (TaskSpec task : stage.tasks()) {
            stageTaskIds.add(task.id());
        }

        // Kahn's algorithm, one layer per wave
        Map<String, Integer> inDegree = new HashMap<>();
        for (TaskSpec task : stage.tasks()) {
            int local = 0;
            for (String dep : task.dependsOn()) {
                if (stageTaskIds.contains(dep)) {
                    local++;
                }
            }
            inDegree.put(task.id(), local);
        }

        List<List<TaskSpec>> waves = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        while (placed.size() < stage.tasks().size()) {
            List<TaskSpec> wave = new ArrayList<>();
            for (TaskSpec task : stage.tasks()) {
                if (!placed.contains(task.id()) && inDegree.get(task.id()) == 0) {
                    wave.add(task);
                }
            }
            if (wave.isEmpty()) {
                List<String> remaining = stage.tasks().stream()
                    .map(TaskSpec::id)
                    .filter(id -> !placed.contains(id))
                    .collect(Collectors.toList());
                throw new DefinitionValidationException("stages." + stage.id(),
                    "cyclic dependsOn among " + remaining);
            }
            for (TaskSpec task : wave) {
                placed.add(task.id());
            }
            for (TaskSpec task : stage.tasks()) {
                if (placed.contains(task.id())) {
                    continue;
                }
                for (String dep : task.dependsOn()) {
                    if (wave.stream().anyMatch(w -> w.id().equals(dep))) {
                        inDegree.merge(task.id(), -1, Integer::sum);
                    }
                }
            }
            waves.add(List.copyOf(wave));
        }
        return waves;
    }
}
