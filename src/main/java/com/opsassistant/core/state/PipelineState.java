package com.opsassistant.core.state;

import com.opsassistant.core.model.ExecutionResult;
import com.opsassistant.core.model.ExecutionStrategy;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.model.VerificationResult;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.Map;
import java.util.Optional;

/**
 * Graph state carried through the plan / execute / verify pipeline.
 * Each stage writes its own output channel and only reads the previous ones.
 */
public class PipelineState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("queryId",            Channels.base(() -> "")),
        Map.entry("query",              Channels.base(() -> "")),
        Map.entry("executionStrategy",  Channels.base((Reducer<String>) null)),
        Map.entry("plan",               Channels.base((Reducer<Plan>) null)),
        Map.entry("executionResult",    Channels.base((Reducer<ExecutionResult>) null)),
        Map.entry("verificationResult", Channels.base((Reducer<VerificationResult>) null))
    );

    public PipelineState(Map<String, Object> initData) {
        super(initData);
    }

    public String queryId() {
        return this.<String>value("queryId").orElse("");
    }

    public String query() {
        return this.<String>value("query").orElse("");
    }

    /**
     * Strategy requested for this query; empty when the configured default applies.
     */
    public Optional<ExecutionStrategy> executionStrategy() {
        return this.<String>value("executionStrategy").map(ExecutionStrategy::valueOf);
    }

    public Optional<Plan> plan() {
        return value("plan");
    }

    public Optional<ExecutionResult> executionResult() {
        return value("executionResult");
    }

    public Optional<VerificationResult> verificationResult() {
        return value("verificationResult");
    }
}
