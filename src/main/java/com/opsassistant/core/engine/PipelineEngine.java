package com.opsassistant.core.engine;

import com.opsassistant.core.events.EventBus;
import com.opsassistant.core.events.PipelineEvent;
import com.opsassistant.core.graph.PipelineGraph;
import com.opsassistant.core.logging.MdcContext;
import com.opsassistant.core.model.ExecutionStrategy;
import com.opsassistant.core.model.PipelineResult;
import com.opsassistant.core.planner.Planner;
import com.opsassistant.core.planner.PlanningException;
import com.opsassistant.core.state.PipelineState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the pipeline: plans, executes and verifies a query by
 * invoking the compiled {@link PipelineGraph}.
 * <p>
 * Each invocation gets its own query ID, set in the MDC for the duration of
 * the call. Only {@link PlanningException} escapes; step and verification
 * problems are reported inside the returned {@link PipelineResult}.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);
    private static final AtomicInteger QUERY_COUNTER = new AtomicInteger(0);

    private final PipelineGraph pipelineGraph;
    private final EventBus eventBus;

    public PipelineEngine(PipelineGraph pipelineGraph, EventBus eventBus) {
        this.pipelineGraph = pipelineGraph;
        this.eventBus = eventBus;
    }

    public PipelineResult processQuery(String query) {
        return processQuery(query, null);
    }

    /**
     * @param strategy execution strategy for this query; null keeps the configured default
     * @throws PlanningException when the query is rejected or no valid plan could be produced
     */
    public PipelineResult processQuery(String rawQuery, ExecutionStrategy strategy) {
        String query = Planner.checkQuery(rawQuery);
        long start = System.currentTimeMillis();
        String queryId = generateQueryId();
        MdcContext.setQuery(queryId);
        try {
            log.info("Processing query {}: {}", queryId, query);
            eventBus.publish(PipelineEvent.of("query.received", queryId, Map.of("query", query)));

            var initialState = new HashMap<String, Object>();
            initialState.put("queryId", queryId);
            initialState.put("query", query);
            if (strategy != null) {
                initialState.put("executionStrategy", strategy.name());
            }

            var config = RunnableConfig.builder()
                    .threadId(queryId)
                    .build();

            PipelineState state;
            try {
                state = pipelineGraph.getCompiledGraph()
                        .invoke(Map.copyOf(initialState), config)
                        .orElseThrow(() -> new IllegalStateException(
                                "Graph execution returned empty state for query " + queryId));
            } catch (RuntimeException e) {
                PlanningException planning = findPlanningException(e);
                if (planning != null) {
                    log.error("Planning failed for query {} ({}): {}", queryId, planning.reason(), planning.getMessage());
                    throw planning;
                }
                throw e;
            }

            var result = new PipelineResult(queryId,
                    state.plan().orElseThrow(() -> new IllegalStateException("No plan in final state")),
                    state.executionResult().orElseThrow(() -> new IllegalStateException("No execution result in final state")),
                    state.verificationResult().orElseThrow(() -> new IllegalStateException("No verification result in final state")),
                    System.currentTimeMillis() - start);
            log.info("Query {} finished in {}ms: {}/{} step(s) completed, complete={}, correct={}", queryId,
                    result.totalTimeMs(), result.execution().stepsCompleted(), result.plan().steps().size(),
                    result.verification().isComplete(), result.verification().isCorrect());
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Generates a unique query ID in the format OPS-YYYY-NNNN.
     */
    public String generateQueryId() {
        int count = QUERY_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("OPS-%d-%04d", year, count);
    }

    static PlanningException findPlanningException(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof PlanningException planning) {
                return planning;
            }
            if (t.getCause() == t) break;
        }
        return null;
    }
}
