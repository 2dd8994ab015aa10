package com.twinforge.core.state;

import com.twinforge.core.model.Contract;
import com.twinforge.core.model.FailureKind;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.PlanResult;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.model.SubsystemOutcome;
import com.twinforge.core.model.Target;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state of one run.
 * <p>
 * Nodes never mutate this object; each returns a map of updates that LangGraph4j merges
 * after the node completes. Per-target outcomes are written only by the build node, after the
 * coordinator's join. {@code errors} and {@code history} are appender channels; every other
 * channel is replaced by the latest update.
 */
public class RunState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("runId",           Channels.base(() -> "")),
        Map.entry("goal",            Channels.base(() -> "")),
        Map.entry("status",          Channels.base(() -> RunStatus.CREATED.name())),
        Map.entry("iteration",       Channels.base(() -> 0)),
        Map.entry("runConfig",       Channels.base((Reducer<RunConfig>) null)),
        Map.entry("planSummary",     Channels.base(() -> "")),
        Map.entry("planText",        Channels.base(() -> "")),
        Map.entry("contract",        Channels.base((Reducer<Contract>) null)),
        Map.entry("needsBackend",    Channels.base(() -> false)),
        Map.entry("needsFrontend",   Channels.base(() -> false)),
        Map.entry("backendOutcome",  Channels.base((Reducer<SubsystemOutcome>) null)),
        Map.entry("frontendOutcome", Channels.base((Reducer<SubsystemOutcome>) null)),
        Map.entry("judgment",        Channels.base((Reducer<JudgmentResult>) null)),
        Map.entry("feedback",        Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("failureKind",     Channels.base(() -> "")),
        Map.entry("stopReason",      Channels.base(() -> "")),
        Map.entry("finalStatus",     Channels.base(() -> "")),
        Map.entry("deliveredPaths",  Channels.base((Supplier<List<String>>) List::of)),

        Map.entry("errors",          Channels.appender(ArrayList::new)),
        Map.entry("history",         Channels.appender(ArrayList::new))
    );

    public RunState(Map<String, Object> initData) {
        super(initData);
    }

    public static String outcomeKey(Target target) {
        return target.wireName() + "Outcome";
    }

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public String goal() {
        return this.<String>value("goal").orElse("");
    }

    public RunStatus status() {
        return RunStatus.valueOf(this.<String>value("status").orElse(RunStatus.CREATED.name()));
    }

    /** Number of top-level iterations that have been judged so far. */
    public int iteration() {
        return this.<Integer>value("iteration").orElse(0);
    }

    public RunConfig runConfig() {
        return this.<RunConfig>value("runConfig").orElseGet(RunConfig::defaults);
    }

    public int maxIterations() {
        return runConfig().maxIterations();
    }

    public String planSummary() {
        return this.<String>value("planSummary").orElse("");
    }

    public String planText() {
        return this.<String>value("planText").orElse("");
    }

    public Contract contract() {
        return this.<Contract>value("contract").orElseGet(Contract::empty);
    }

    public boolean needsBackend() {
        return this.<Boolean>value("needsBackend").orElse(false);
    }

    public boolean needsFrontend() {
        return this.<Boolean>value("needsFrontend").orElse(false);
    }

    public boolean requires(Target target) {
        return target == Target.BACKEND ? needsBackend() : needsFrontend();
    }

    /**
     * The current plan as the planner returned it.
     */
    public PlanResult plan() {
        return new PlanResult(planSummary(), planText(), contract(), needsBackend(), needsFrontend());
    }

    public Optional<SubsystemOutcome> outcome(Target target) {
        return value(outcomeKey(target));
    }

    public Map<Target, SubsystemOutcome> outcomes() {
        var outcomes = new EnumMap<Target, SubsystemOutcome>(Target.class);
        for (Target target : Target.values()) {
            outcome(target).ifPresent(o -> outcomes.put(target, o));
        }
        return outcomes;
    }

    public Optional<JudgmentResult> judgment() {
        return value("judgment");
    }

    public List<String> feedback() {
        return this.<List<String>>value("feedback").orElse(List.of());
    }

    public Optional<FailureKind> failureKind() {
        String raw = this.<String>value("failureKind").orElse("");
        return raw.isBlank() ? Optional.empty() : Optional.of(FailureKind.valueOf(raw));
    }

    public String stopReason() {
        return this.<String>value("stopReason").orElse("");
    }

    public String finalStatus() {
        return this.<String>value("finalStatus").orElse("");
    }

    public List<String> deliveredPaths() {
        return this.<List<String>>value("deliveredPaths").orElse(List.of());
    }

    public List<String> errors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }

    /** One line per finished phase, oldest first. */
    public List<String> history() {
        return this.<List<String>>value("history").orElse(List.of());
    }
}
