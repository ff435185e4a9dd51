package com.neuronplatform.common.motor;

import com.neuronplatform.common.graph.BrainGraph;
import com.neuronplatform.common.graph.Edge;
import com.neuronplatform.common.graph.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a settled graph plus the arbitrated goal into an utterance. No templates: words
 * come from firing nodes and are ordered by a part-of-speech walk over
 * {@link PosTransitionTable}.
 *
 * <h3>Candidate scoring</h3>
 * <pre>
 *   concept/topic/emotion origin : activation × 0.6
 *                                  + goalAffinity(goal) × |w|   (first goal→node edge only)
 *   motor/lexeme origin          : activation × 0.5
 *   form among recent words      : × 0.3
 * </pre>
 * Conceptual nodes are ranked by (concept first, then activation) and capped at
 * {@value #MAX_CONCEPTUAL_SOURCES}; motor/lexeme nodes are not capped.
 *
 * <h3>Walk</h3>
 * From {@code START}: eligible = unused candidates the current tag permits (else every
 * unused candidate; none left → stop). Candidates within {@value #TOP_TIER_RATIO} of the
 * best score form the top tier; a tier of more than one is sampled uniformly with the
 * caller's {@link RandomSource}. The chosen tag becomes the current state; {@code END}
 * or the word limit stops the walk, otherwise siblings from the same node are halved.
 *
 * <p>Never throws for sparse input: no candidates → {@value MotorResult#FALLBACK_TEXT}.
 */
public final class MotorGenerator {

    private static final Logger log = LoggerFactory.getLogger(MotorGenerator.class);

    public static final int DEFAULT_MAX_WORDS = 15;

    static final int    MAX_CONCEPTUAL_SOURCES = 25;
    static final int    RECENT_WINDOW          = 20;
    static final double CONCEPT_SCORE_FACTOR   = 0.6;
    static final double MOTOR_SCORE_FACTOR     = 0.5;
    static final double REPETITION_PENALTY     = 0.3;
    static final double TOP_TIER_RATIO         = 0.85;
    static final double DIVERSITY_DAMPING      = 0.5;

    private MotorGenerator() {}

    public static MotorResult generate(BrainGraph graph, VocabularyLookup vocabulary,
                                       String goalId, RandomSource random,
                                       List<String> recentWords) {
        return generate(graph, vocabulary, goalId, random, recentWords, DEFAULT_MAX_WORDS);
    }

    /**
     * @param graph       settled graph; read only
     * @param vocabulary  surface forms per node and tags per form
     * @param goalId      arbitrated goal; may name a node absent from the graph
     * @param random      caller-owned seeded source, advanced only on tier ties
     * @param recentWords recently emitted forms, oldest first; the last
     *                    {@value #RECENT_WINDOW} are penalised
     * @param maxWords    upper bound on the utterance length
     * @return generation trace, never null
     */
    public static MotorResult generate(BrainGraph graph, VocabularyLookup vocabulary,
                                       String goalId, RandomSource random,
                                       List<String> recentWords, int maxWords) {
        Set<String> recent = recentSet(recentWords);

        List<WordCandidate> candidates = new ArrayList<>();
        for (Node node : conceptualSources(graph)) {
            addConceptualCandidates(candidates, graph, vocabulary, node, goalId, recent);
        }
        for (Node node : graph.nodes()) {
            if (node.isFiring() && node.getCategory().isSpeechUnit()) {
                addMotorCandidates(candidates, vocabulary, node, recent);
            }
        }

        List<WordCandidate> considered = new ArrayList<>(candidates);
        considered.sort(Comparator.comparingDouble(WordCandidate::getScore).reversed());

        if (candidates.isEmpty()) {
            log.debug("[Motor] no candidates. goal={} → fallback", goalId);
            return MotorResult.fallback(considered);
        }

        List<WordCandidate> selected = assemble(candidates, random, maxWords);
        String text = selected.stream().map(WordCandidate::getWord).collect(Collectors.joining(" "));

        log.debug("[Motor] goal={} candidates={} selected={} text='{}'",
            goalId, candidates.size(), selected.size(), text);

        return new MotorResult(List.copyOf(considered), List.copyOf(selected), text);
    }

    // ── candidate building ───────────────────────────────────────────────────

    private static Set<String> recentSet(List<String> recentWords) {
        if (recentWords == null || recentWords.isEmpty()) return Set.of();
        int from = Math.max(0, recentWords.size() - RECENT_WINDOW);
        return new HashSet<>(recentWords.subList(from, recentWords.size()));
    }

    private static List<Node> conceptualSources(BrainGraph graph) {
        List<Node> sources = new ArrayList<>();
        for (Node n : graph.nodes()) {
            if (n.isFiring() && n.getCategory().isConceptual()) sources.add(n);
        }
        sources.sort(Comparator.comparingDouble(MotorGenerator::priority)
            .thenComparingDouble(Node::getActivation)
            .reversed());
        return sources.size() > MAX_CONCEPTUAL_SOURCES ? sources.subList(0, MAX_CONCEPTUAL_SOURCES) : sources;
    }

    private static double priority(Node n) {
        return switch (n.getCategory()) {
            case CONCEPT -> 1.0;
            default      -> 0.5;
        };
    }

    private static void addConceptualCandidates(List<WordCandidate> out, BrainGraph graph,
                                                VocabularyLookup vocabulary, Node node,
                                                String goalId, Set<String> recent) {
        double goalBonus = goalBonus(graph, goalId, node.getId());
        for (String form : vocabulary.wordsForConcept(node.getId())) {
            Optional<VocabularyEntry> entry = vocabulary.lookup(form);
            if (entry.isEmpty()) continue;

            WordCandidate c = new WordCandidate(form, node.getId(), node.getActivation(), entry.get().pos());
            double score = node.getActivation() * CONCEPT_SCORE_FACTOR + goalBonus;
            if (recent.contains(form)) score *= REPETITION_PENALTY;
            c.setScore(score);
            c.setReason(String.format(Locale.ROOT, "concept=%s act=%.2f goal_match=%s", node.getId(), node.getActivation(), goalId));
            out.add(c);
        }
    }

    private static void addMotorCandidates(List<WordCandidate> out, VocabularyLookup vocabulary,
                                           Node node, Set<String> recent) {
        for (String form : vocabulary.wordsForConcept(node.getId())) {
            Optional<VocabularyEntry> entry = vocabulary.lookup(form);
            if (entry.isEmpty()) continue;

            WordCandidate c = new WordCandidate(form, node.getId(), node.getActivation(), entry.get().pos());
            double score = node.getActivation() * MOTOR_SCORE_FACTOR;
            if (recent.contains(form)) score *= REPETITION_PENALTY;
            c.setScore(score);
            c.setReason("motor/lexeme node=" + node.getId());
            out.add(c);
        }
    }

    /** Affinity × |weight| of the first goal edge into {@code nodeId}; 0 when none. */
    private static double goalBonus(BrainGraph graph, String goalId, String nodeId) {
        if (goalId == null || !graph.contains(goalId)) return 0.0;
        for (Edge e : graph.outgoing(goalId)) {
            if (e.getTargetId().equals(nodeId)) {
                return GoalAffinity.boost(goalId) * Math.abs(e.getWeight());
            }
        }
        return 0.0;
    }

    // ── walk ─────────────────────────────────────────────────────────────────

    private static List<WordCandidate> assemble(List<WordCandidate> candidates,
                                                RandomSource random, int maxWords) {
        List<WordCandidate> selected = new ArrayList<>();
        Set<String> used = new HashSet<>();
        PartOfSpeech state = PartOfSpeech.START;

        for (int i = 0; i < maxWords; i++) {
            Set<PartOfSpeech> allowed = PosTransitionTable.allowedAfter(state);

            List<WordCandidate> eligible = new ArrayList<>();
            for (WordCandidate c : candidates) {
                if (allowed.contains(c.getPos()) && !used.contains(c.getWord())) eligible.add(c);
            }
            if (eligible.isEmpty()) {
                for (WordCandidate c : candidates) {
                    if (!used.contains(c.getWord())) eligible.add(c);
                }
                if (eligible.isEmpty()) break;
            }

            eligible.sort(Comparator.comparingDouble(WordCandidate::getScore).reversed());
            double floor = eligible.get(0).getScore() * TOP_TIER_RATIO;
            List<WordCandidate> tier = new ArrayList<>();
            for (WordCandidate c : eligible) {
                if (c.getScore() >= floor) tier.add(c);
            }

            WordCandidate chosen = tier.size() > 1
                ? tier.get(random.nextIntInclusive(0, tier.size() - 1))
                : tier.get(0);

            selected.add(chosen);
            used.add(chosen.getWord());
            state = chosen.getPos();

            if (state == PartOfSpeech.END || selected.size() >= maxWords) break;

            for (WordCandidate c : candidates) {
                if (c != chosen && c.getNodeId().equals(chosen.getNodeId())) {
                    c.setScore(c.getScore() * DIVERSITY_DAMPING);
                }
            }
        }
        return selected;
    }
}
