package com.neuronplatform.orchestrator.trace;

import com.neuronplatform.common.dynamics.EdgeContribution;
import com.neuronplatform.common.dynamics.NodeActivation;
import com.neuronplatform.common.dynamics.StepRecord;
import com.neuronplatform.common.goal.GoalCandidate;
import com.neuronplatform.common.motor.WordCandidate;
import com.neuronplatform.orchestrator.perception.ConceptMatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Human-readable renderings of a {@link ThoughtTrace}.
 *
 * <p>{@link #compact} is the per-turn summary: five strongest initial activations, the
 * first, middle and last step, five routes, eight selected words.
 * {@link #full} prints every section in pipeline order.
 */
public final class TraceFormatter {

    public static final String COMPACT_HEADER = "─── THOUGHT TRACE ───";
    public static final String FULL_HEADER    = "═══ FULL THOUGHT TRACE ═══";

    private TraceFormatter() {}

    public static String compact(ThoughtTrace trace) {
        List<String> lines = new ArrayList<>();
        lines.add(COMPACT_HEADER);

        if (!trace.inputMapping().isEmpty()) {
            lines.add("  Input → Concepts:");
            for (ConceptMatch m : trace.inputMapping()) {
                lines.add("    " + m);
            }
        }

        if (!trace.initialActivations().isEmpty()) {
            lines.add("  Initial Activations:");
            for (Map.Entry<String, Double> e : byValueDescending(trace.initialActivations()).subList(0,
                    Math.min(5, trace.initialActivations().size()))) {
                lines.add(fmt("    %s: %.3f", e.getKey(), e.getValue()));
            }
        }

        if (!trace.modulators().isEmpty()) {
            lines.add("  Modulators: " + trace.modulators().entrySet().stream()
                .map(e -> fmt("%s=%.2f", e.getKey(), e.getValue()))
                .collect(Collectors.joining(", ")));
        }

        List<StepRecord> steps = trace.steps();
        if (!steps.isEmpty()) {
            List<StepRecord> shown = new ArrayList<>();
            int n = steps.size();
            shown.add(steps.get(0));
            if (n >= 3) shown.add(steps.get(n / 2));
            if (n >= 2) shown.add(steps.get(n - 1));

            lines.add("  Dynamics (selected steps):");
            for (StepRecord s : shown) {
                lines.add("    Step " + s.step() + ": [" + activations(s.topFiring(), 4, "%.2f") + "]");
            }
        }

        if (!trace.topEdges().isEmpty()) {
            lines.add("  Top Routes (edges):");
            for (EdgeContribution e : head(trace.topEdges(), 5)) {
                lines.add(fmt("    %s →(%s)→ %s  contrib=%.3f",
                    e.sourceId(), e.type().tag(), e.targetId(), e.contribution()));
            }
        }

        if (!trace.memoryEffects().isEmpty()) {
            lines.add("  Memory Boost:");
            trace.memoryEffects().forEach((id, boost) -> lines.add(fmt("    %s: +%.3f", id, boost)));
        }

        if (trace.selectedGoal() != null && !trace.selectedGoal().isEmpty()) {
            lines.add("  Goal: " + trace.selectedGoal());
            if (!trace.goalCandidates().isEmpty()) {
                lines.add("    Candidates: [" + head(trace.goalCandidates(), 4).stream()
                    .map(g -> fmt("%s=%.2f", g.goalId(), g.activation()))
                    .collect(Collectors.joining(", ")) + "]");
            }
        }

        if (!trace.selectedWords().isEmpty()) {
            lines.add("  Word Selection:");
            for (WordCandidate w : head(trace.selectedWords(), 8)) {
                lines.add(fmt("    '%s' score=%.3f (%s)", w.getWord(), w.getScore(), w.getReason()));
            }
        }

        if (!trace.finalWords().isEmpty()) {
            lines.add("  Output: " + String.join(" ", trace.finalWords()));
        }

        lines.add("─────────────────────");
        return String.join("\n", lines);
    }

    public static String full(ThoughtTrace trace) {
        List<String> lines = new ArrayList<>();
        lines.add(FULL_HEADER);

        lines.add("\n[INPUT MAPPING]");
        for (ConceptMatch m : trace.inputMapping()) {
            lines.add("  " + m);
        }

        lines.add("\n[INITIAL ACTIVATIONS]");
        for (Map.Entry<String, Double> e : byValueDescending(trace.initialActivations())) {
            if (e.getValue() > 0) lines.add(fmt("  %s: %.4f", e.getKey(), e.getValue()));
        }

        lines.add("\n[MODULATORS]");
        trace.modulators().forEach((k, v) -> lines.add(fmt("  %s: %.3f", k, v)));

        lines.add("\n[DYNAMICS STEPS]");
        for (StepRecord s : trace.steps()) {
            lines.add(fmt("  Step %2d: [", s.step()) + activations(s.topFiring(), 6, "%.3f") + "]");
        }

        lines.add("\n[TOP CONTRIBUTING EDGES]");
        for (EdgeContribution e : trace.topEdges()) {
            lines.add(fmt("  %s →(%s)→ %s  contribution=%.4f",
                e.sourceId(), e.type().tag(), e.targetId(), e.contribution()));
        }

        lines.add("\n[MEMORY EFFECTS]");
        if (trace.memoryEffects().isEmpty()) {
            lines.add("  (none)");
        } else {
            trace.memoryEffects().forEach((id, boost) -> lines.add(fmt("  %s: +%.4f", id, boost)));
        }

        lines.add("\n[GOAL SELECTION]");
        lines.add("  Selected: " + trace.selectedGoal());
        for (GoalCandidate g : trace.goalCandidates()) {
            String marker = g.goalId().equals(trace.selectedGoal()) ? " ◄" : "";
            lines.add(fmt("    %s: %.4f%s", g.goalId(), g.activation(), marker));
        }

        lines.add("\n[LANGUAGE CANDIDATES]");
        for (WordCandidate w : trace.languageCandidates()) {
            lines.add(fmt("  '%s' pos=%s score=%.3f | %s", w.getWord(), w.getPos().tag(), w.getScore(), w.getReason()));
        }

        lines.add("\n[SELECTED WORDS]");
        List<WordCandidate> selected = trace.selectedWords();
        for (int i = 0; i < selected.size(); i++) {
            WordCandidate w = selected.get(i);
            lines.add(fmt("  %d. '%s' pos=%s score=%.3f", i + 1, w.getWord(), w.getPos().tag(), w.getScore()));
        }

        lines.add("\n[OUTPUT] " + String.join(" ", trace.finalWords()));
        lines.add("══════════════════════════");
        return String.join("\n", lines);
    }

    private static String activations(List<NodeActivation> top, int limit, String valueFormat) {
        StringJoiner joiner = new StringJoiner(", ");
        for (NodeActivation a : head(top, limit)) {
            joiner.add(a.nodeId() + "=" + fmt(valueFormat, a.activation()));
        }
        return joiner.toString();
    }

    private static List<Map.Entry<String, Double>> byValueDescending(Map<String, Double> values) {
        List<Map.Entry<String, Double>> sorted = new ArrayList<>(values.entrySet());
        sorted.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));
        return sorted;
    }

    private static <T> List<T> head(List<T> list, int limit) {
        return list.subList(0, Math.min(limit, list.size()));
    }

    private static String fmt(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
