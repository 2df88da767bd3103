package com.opsassistant.core.graph;

import com.opsassistant.core.nodes.ExecutePlanNode;
import com.opsassistant.core.nodes.PlanQueryNode;
import com.opsassistant.core.nodes.VerifyResultsNode;
import com.opsassistant.core.state.PipelineState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for the pipeline.
 * <pre>
 *   START -&gt; plan_query -&gt; execute_plan -&gt; verify_results -&gt; END
 * </pre>
 * Every edge is a hard synchronous boundary: a stage starts only after the
 * previous one has written its output channel.
 */
@Component
public class PipelineGraph {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraph.class);

    private final CompiledGraph<PipelineState> compiledGraph;

    public PipelineGraph(PlanQueryNode planNode,
                         ExecutePlanNode executeNode,
                         VerifyResultsNode verifyNode) throws GraphStateException {

        var graph = new StateGraph<>(PipelineState.SCHEMA, PipelineState::new)
                .addNode("plan_query", node_async(planNode::apply))
                .addNode("execute_plan", node_async(executeNode::apply))
                .addNode("verify_results", node_async(verifyNode::apply))
                .addEdge(START, "plan_query")
                .addEdge("plan_query", "execute_plan")
                .addEdge("execute_plan", "verify_results")
                .addEdge("verify_results", END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Pipeline graph compiled");
    }

    public CompiledGraph<PipelineState> getCompiledGraph() {
        return compiledGraph;
    }
}
