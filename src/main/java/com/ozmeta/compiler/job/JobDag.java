package com.ozmeta.compiler.job;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.model.canonical.JobDefinition;
import com.ozmeta.compiler.model.canonical.JobStepDefinition;

/**
 * Orders job steps so that every step follows its dependencies. Ready steps
 * are taken by (order, code), which makes the result deterministic.
 */
public final class JobDag {

    private static final Comparator<JobStepDefinition> READY_ORDER =
            Comparator.comparingInt(JobStepDefinition::getOrder).thenComparing(JobStepDefinition::getCode);

    private JobDag() {
        // Utility class
    }

    public static List<JobStepDefinition> executionOrder(JobDefinition job) {
        Map<String, JobStepDefinition> byCode = new HashMap<>();
        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<JobStepDefinition>> dependents = new HashMap<>();
        for (JobStepDefinition step : job.getSteps()) {
            byCode.put(step.getCode(), step);
            pending.put(step.getCode(), step.getDependsOn().size());
        }
        for (JobStepDefinition step : job.getSteps()) {
            for (String dependency : step.getDependsOn()) {
                if (!byCode.containsKey(dependency)) {
                    throw new CompilationException("Job '" + job.getCode() + "' step '" + step.getCode()
                            + "' depends on unknown step '" + dependency + "'");
                }
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(step);
            }
        }

        PriorityQueue<JobStepDefinition> ready = new PriorityQueue<>(READY_ORDER);
        job.getSteps().stream().filter(s -> pending.get(s.getCode()) == 0).forEach(ready::add);

        List<JobStepDefinition> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            JobStepDefinition step = ready.poll();
            ordered.add(step);
            for (JobStepDefinition dependent : dependents.getOrDefault(step.getCode(), List.of())) {
                int remaining = pending.merge(dependent.getCode(), -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() != job.getSteps().size()) {
            String stuck = pending.entrySet().stream()
                    .filter(e -> e.getValue() > 0)
                    .map(Map.Entry::getKey)
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new CompilationException("Job '" + job.getCode() + "' has a dependency cycle among steps: " + stuck);
        }
        return ordered;
    }
}
