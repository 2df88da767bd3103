package com.opsassistant.core.nodes;

import com.opsassistant.core.execution.PlanExecutor;
import com.opsassistant.core.logging.MdcContext;
import com.opsassistant.core.model.ExecutionResult;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.state.PipelineState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Second pipeline stage: runs the plan.
 */
@Component
public class ExecutePlanNode {

    private final PlanExecutor planExecutor;

    public ExecutePlanNode(PlanExecutor planExecutor) {
        this.planExecutor = planExecutor;
    }

    public Map<String, Object> apply(PipelineState state) {
        Plan plan = state.plan().orElseThrow(
                () -> new IllegalStateException("Plan must be present before execution"));
        MdcContext.setQuery(state.queryId());
        ExecutionResult result = state.executionStrategy()
                .map(strategy -> planExecutor.execute(plan, strategy))
                .orElseGet(() -> planExecutor.execute(plan));
        return Map.of("executionResult", result);
    }
}
