package com.opsassistant.core.nodes;

import com.opsassistant.core.events.EventBus;
import com.opsassistant.core.events.PipelineEvent;
import com.opsassistant.core.metrics.PipelineMetrics;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.planner.Planner;
import com.opsassistant.core.planner.PlanningException;
import com.opsassistant.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * First pipeline stage: turns the query into a validated plan.
 * A {@link PlanningException} propagates and ends the invocation.
 */
@Component
public class PlanQueryNode {

    private static final Logger log = LoggerFactory.getLogger(PlanQueryNode.class);

    private final Planner planner;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    public PlanQueryNode(Planner planner, EventBus eventBus, PipelineMetrics metrics) {
        this.planner = planner;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(PipelineState state) {
        long start = System.currentTimeMillis();
        Plan plan;
        try {
            plan = planner.createPlan(state.query());
        } catch (PlanningException e) {
            metrics.recordPlanningFailure(e.reason().name());
            throw e;
        }
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordPlanningDuration(elapsed);
        metrics.recordPlanSize(plan.steps().size());

        log.info("Plan: {} step(s) - {}", plan.steps().size(),
                plan.steps().stream().map(s -> s.stepNumber() + "[" + s.tool().wireName() + "]").toList());
        eventBus.publish(PipelineEvent.of("plan.created", state.queryId(),
                Map.of("intent", plan.intent().wireName(),
                        "steps", plan.steps().size(),
                        "comparisonMode", plan.comparisonMode(),
                        "planningMs", elapsed)));
        return Map.of("plan", plan);
    }
}
