package com.twinforge.core.graph;

import com.twinforge.core.model.RunStatus;
import com.twinforge.core.nodes.DeliverRunNode;
import com.twinforge.core.nodes.FailRunNode;
import com.twinforge.core.nodes.JudgeCompatibilityNode;
import com.twinforge.core.nodes.ParallelBuildNode;
import com.twinforge.core.nodes.PlanRunNode;
import com.twinforge.core.nodes.ReplanRunNode;
import com.twinforge.core.nodes.StopRunNode;
import com.twinforge.core.state.RunState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a run.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> plan_run -> [routeAfterPlan]
 *              -> parallel_build -> [routeAfterBuild]
 *                   -> judge_compatibility -> [routeAfterJudge]
 *                        -> deliver_run -> END
 *                        -> replan_run -> [routeAfterReplan]
 *                             -> plan_run (next iteration)
 *                             -> fail_run -> END
 *                        -> fail_run -> END   (iteration budget exhausted)
 *              -> fail_run -> END             (planning failed)
 *   any routing point -> stop_run -> END      (stop requested)
 * </pre>
 * The loop ends because judge_compatibility increments the iteration counter and
 * routeAfterJudge refuses to replan once it reaches the configured maximum.
 */
@Component
public class TwinforgeGraph {

    private static final Logger log = LoggerFactory.getLogger(TwinforgeGraph.class);

    /** Each iteration visits at most four nodes; this leaves room for the 50-iteration ceiling. */
    static final int RECURSION_LIMIT = 500;

    private final CompiledGraph<RunState> compiledGraph;

    public TwinforgeGraph(
            PlanRunNode planNode,
            ParallelBuildNode buildNode,
            JudgeCompatibilityNode judgeNode,
            ReplanRunNode replanNode,
            DeliverRunNode deliverNode,
            FailRunNode failNode,
            StopRunNode stopNode) throws Exception {

        var graph = new StateGraph<>(RunState.SCHEMA, RunState::new)
                .addNode("plan_run", node_async(planNode::apply))
                .addNode("parallel_build", node_async(buildNode::apply))
                .addNode("judge_compatibility", node_async(judgeNode::apply))
                .addNode("replan_run", node_async(replanNode::apply))
                .addNode("deliver_run", node_async(deliverNode::apply))
                .addNode("fail_run", node_async(failNode::apply))
                .addNode("stop_run", node_async(stopNode::apply))
                .addEdge(START, "plan_run")
                .addConditionalEdges("plan_run",
                        edge_async(this::routeAfterPlan),
                        Map.of("parallel_build", "parallel_build",
                                "fail_run", "fail_run",
                                "stop_run", "stop_run"))
                .addConditionalEdges("parallel_build",
                        edge_async(this::routeAfterBuild),
                        Map.of("judge_compatibility", "judge_compatibility",
                                "stop_run", "stop_run"))
                .addConditionalEdges("judge_compatibility",
                        edge_async(this::routeAfterJudge),
                        Map.of("deliver_run", "deliver_run",
                                "replan_run", "replan_run",
                                "fail_run", "fail_run",
                                "stop_run", "stop_run"))
                .addConditionalEdges("replan_run",
                        edge_async(this::routeAfterReplan),
                        Map.of("plan_run", "plan_run",
                                "fail_run", "fail_run",
                                "stop_run", "stop_run"))
                .addEdge("deliver_run", END)
                .addEdge("fail_run", END)
                .addEdge("stop_run", END);

        this.compiledGraph = graph.compile(CompileConfig.builder()
                .recursionLimit(RECURSION_LIMIT)
                .build());
        log.info("Run graph compiled (recursion limit {})", RECURSION_LIMIT);
    }

    String routeAfterPlan(RunState state) {
        return switch (state.status()) {
            case STOPPED -> "stop_run";
            case FAILED -> "fail_run";
            default -> "parallel_build";
        };
    }

    String routeAfterBuild(RunState state) {
        return state.status() == RunStatus.STOPPED ? "stop_run" : "judge_compatibility";
    }

    /**
     * Compatible delivers. Incompatible replans while the iteration budget allows,
     * otherwise the run fails.
     */
    String routeAfterJudge(RunState state) {
        if (state.status() == RunStatus.STOPPED) {
            return "stop_run";
        }
        boolean compatible = state.judgment().map(j -> j.compatible()).orElse(false);
        if (compatible) {
            return "deliver_run";
        }
        if (state.iteration() >= state.maxIterations()) {
            log.info("Iteration budget of {} exhausted", state.maxIterations());
            return "fail_run";
        }
        return "replan_run";
    }

    String routeAfterReplan(RunState state) {
        return switch (state.status()) {
            case STOPPED -> "stop_run";
            case FAILED -> "fail_run";
            default -> "plan_run";
        };
    }

    public CompiledGraph<RunState> getCompiledGraph() {
        return compiledGraph;
    }
}
