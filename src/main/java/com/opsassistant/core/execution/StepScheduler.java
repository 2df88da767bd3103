package com.opsassistant.core.execution;

import com.opsassistant.core.model.ExecutionStrategy;
import com.opsassistant.core.model.PlanStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the next wave of steps whose dependencies have all finished.
 */
@Service
public class StepScheduler {

    private static final Logger log = LoggerFactory.getLogger(StepScheduler.class);

    /**
     * @param steps        all steps of the plan, in planned order
     * @param finished     step numbers that already have a result
     * @param dependencies dependency sets keyed by step number
     * @param strategy     SEQUENTIAL caps the wave at one step
     * @return step numbers to dispatch, in planned order; empty when nothing is eligible
     */
    public List<Integer> computeNextWave(List<PlanStep> steps, Set<Integer> finished,
                                         Map<Integer, Set<Integer>> dependencies,
                                         ExecutionStrategy strategy) {
        int limit = strategy == ExecutionStrategy.SEQUENTIAL ? 1 : Integer.MAX_VALUE;
        var wave = new ArrayList<Integer>();
        for (PlanStep step : steps) {
            if (wave.size() >= limit) break;
            int n = step.stepNumber();
            if (finished.contains(n)) continue;
            Set<Integer> deps = dependencies.getOrDefault(n, Set.of());
            if (!finished.containsAll(deps)) {
                log.debug("  step {} waiting on {}", n, deps);
                continue;
            }
            wave.add(n);
        }
        log.debug("Next wave: {} ({} of {} finished, strategy={})", wave, finished.size(), steps.size(), strategy);
        return wave;
    }
}
