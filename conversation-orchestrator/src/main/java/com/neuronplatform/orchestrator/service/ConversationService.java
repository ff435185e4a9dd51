package com.neuronplatform.orchestrator.service;

import com.neuronplatform.common.dynamics.DynamicsConfig;
import com.neuronplatform.common.dynamics.DynamicsEngine;
import com.neuronplatform.common.dynamics.DynamicsResult;
import com.neuronplatform.common.dynamics.Modulators;
import com.neuronplatform.common.goal.GoalArbitrator;
import com.neuronplatform.common.goal.GoalResult;
import com.neuronplatform.common.graph.BrainGraph;
import com.neuronplatform.common.graph.Edge;
import com.neuronplatform.common.graph.NodeCategory;
import com.neuronplatform.common.motor.MotorGenerator;
import com.neuronplatform.common.motor.MotorResult;
import com.neuronplatform.common.motor.SeededRandomSource;
import com.neuronplatform.common.trace.TraceContextUtil;
import com.neuronplatform.orchestrator.lexicon.Lexicon;
import com.neuronplatform.orchestrator.logger.TurnFlowLogger;
import com.neuronplatform.orchestrator.memory.ConversationMemory;
import com.neuronplatform.orchestrator.perception.ConceptMatch;
import com.neuronplatform.orchestrator.perception.InputProcessor;
import com.neuronplatform.orchestrator.perception.PerceptionResult;
import com.neuronplatform.orchestrator.trace.ThoughtTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The conversation session: one graph, one lexicon, one memory, one seeded random
 * source, evolving modulators.
 *
 * <p>Turn pipeline:
 * <ol>
 *   <li>perception → concept weights</li>
 *   <li>memory boost merged additively into the injections</li>
 *   <li>dynamics with the session config and current modulators</li>
 *   <li>goal arbitration; no goal node → {@value #DEFAULT_GOAL}</li>
 *   <li>motor generation with the session random source and recent words</li>
 *   <li>recent words extended and cut to the last {@value #RECENT_WORDS_LIMIT}</li>
 *   <li>memory stores the turn</li>
 *   <li>modulators drift: a {@code ?} in the raw input raises curiosity, anything else
 *       lowers it; urgency always decays</li>
 * </ol>
 *
 * <p>The graph is mutated by every turn, so turns are serialised on the session.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    public static final String DEFAULT_GOAL       = "goal_inform";
    static final int           RECENT_WORDS_LIMIT = 30;

    static final double INITIAL_CURIOSITY = 0.5;
    static final double INITIAL_CALM      = 0.6;
    static final double INITIAL_URGENCY   = 0.3;

    static final double CURIOSITY_RISE  = 0.1;
    static final double CURIOSITY_DECAY = 0.05;
    static final double CURIOSITY_FLOOR = 0.2;
    static final double URGENCY_DECAY   = 0.02;
    static final double URGENCY_FLOOR   = 0.1;

    private final BrainGraph         graph;
    private final Lexicon            lexicon;
    private final DynamicsConfig     dynamicsConfig;
    private final TurnFlowLogger     turnFlowLogger;
    private final InputProcessor     perception;
    private final ConversationMemory memory = new ConversationMemory();

    private final List<String> recentWords = new ArrayList<>();
    private Modulators         modulators  = Modulators.of(INITIAL_CURIOSITY, INITIAL_CALM, INITIAL_URGENCY);
    private SeededRandomSource random;
    private long               seed;
    private int                turnCount;
    private boolean            debug;

    public ConversationService(BrainGraph graph,
                               Lexicon lexicon,
                               DynamicsConfig dynamicsConfig,
                               @Qualifier("conversationSeed") Long seed,
                               TurnFlowLogger turnFlowLogger) {
        this.graph          = graph;
        this.lexicon        = lexicon;
        this.dynamicsConfig = dynamicsConfig;
        this.turnFlowLogger = turnFlowLogger;
        this.perception     = new InputProcessor(lexicon);
        this.seed           = seed;
        this.random         = new SeededRandomSource(seed);
    }

    /**
     * Runs a turn off the event loop. The trace id is taken from the Reactor Context
     * written by the caller.
     */
    public Mono<TurnResult> turn(String input) {
        return Mono.deferContextual(ctx -> {
                String traceId = TraceContextUtil.getTraceId(ctx);
                return Mono.fromCallable(() -> processTurn(input, traceId));
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Runs one full turn synchronously.
     *
     * @throws IllegalArgumentException if {@code input} is null or blank
     */
    public synchronized TurnResult processTurn(String input, String traceId) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Turn text must not be blank");
        }

        int turnId = ++turnCount;
        long start = System.nanoTime();
        turnFlowLogger.log(TurnFlowLogger.TURN_RECEIVED, traceId, turnId, "chars=" + input.length());

        try {
            PerceptionResult perceived = perception.process(input);
            List<String> concepts = new ArrayList<>(perceived.activatedConcepts().keySet());
            turnFlowLogger.log(TurnFlowLogger.INPUT_PERCEIVED, traceId, turnId,
                "tokens=" + perceived.tokens().size() + " concepts=" + concepts.size());

            Map<String, Double> boost = memory.memoryBoost(concepts);
            Map<String, Double> injections = new LinkedHashMap<>(perceived.activatedConcepts());
            boost.forEach((id, b) -> injections.merge(id, b, Double::sum));
            turnFlowLogger.log(TurnFlowLogger.MEMORY_RECALLED, traceId, turnId, "boosted=" + boost.size());

            Modulators used = modulators;
            DynamicsResult dynamics = DynamicsEngine.run(graph, injections, dynamicsConfig, used);
            turnFlowLogger.log(TurnFlowLogger.DYNAMICS_SETTLED, traceId, turnId,
                "steps=" + dynamics.steps().size() + " topEdges=" + dynamics.topContributingEdges().size());

            GoalResult goals = GoalArbitrator.select(graph);
            String goal = goals.selected().orElse(DEFAULT_GOAL);
            turnFlowLogger.log(TurnFlowLogger.GOAL_SELECTED, traceId, turnId,
                String.format(Locale.ROOT, "goal=%s activation=%.3f", goal, goals.selectedActivation()));

            MotorResult motor = MotorGenerator.generate(graph, lexicon, goal, random, recentWords);
            List<String> words = motor.words();
            turnFlowLogger.log(TurnFlowLogger.RESPONSE_GENERATED, traceId, turnId,
                "words=" + words.size() + " candidates=" + motor.candidatesConsidered().size());

            recentWords.addAll(words);
            if (recentWords.size() > RECENT_WORDS_LIMIT) {
                recentWords.subList(0, recentWords.size() - RECENT_WORDS_LIMIT).clear();
            }

            memory.storeTurn(input, motor.finalText(), concepts, goal);
            modulators = drift(used, perceived.isQuestion());

            List<ConceptMatch> mapping = new ArrayList<>(perceived.matchedWords());
            mapping.addAll(perceived.matchedPhrases());

            ThoughtTrace trace = new ThoughtTrace(
                mapping,
                perceived.activatedConcepts(),
                used.asMap(),
                dynamics.steps(),
                dynamics.topContributingEdges(),
                Collections.unmodifiableMap(boost),
                goal,
                goals.candidates(),
                motor.candidatesConsidered(),
                motor.selectedWords(),
                words);

            double elapsed = (System.nanoTime() - start) / 1_000_000.0;
            turnFlowLogger.log(TurnFlowLogger.TURN_COMPLETED, traceId, turnId,
                String.format(Locale.ROOT, "elapsedMs=%.1f text='%s'", elapsed, motor.finalText()));
            return new TurnResult(turnId, motor.finalText(), trace, elapsed);

        } catch (RuntimeException e) {
            turnFlowLogger.logFailure(traceId, turnId, e);
            throw e;
        }
    }

    static Modulators drift(Modulators current, boolean question) {
        double curiosity = current.curiosity();
        curiosity = question
            ? Math.min(1.0, curiosity + CURIOSITY_RISE)
            : Math.max(CURIOSITY_FLOOR, curiosity - CURIOSITY_DECAY);
        double urgency = Math.max(URGENCY_FLOOR, current.get(Modulators.URGENCY, INITIAL_URGENCY) - URGENCY_DECAY);
        return current.with(Modulators.CURIOSITY, curiosity).with(Modulators.URGENCY, urgency);
    }

    // ── session operations ───────────────────────────────────────────────────

    public String startupSummary() {
        return String.join("\n",
            "Neuron Conversation Engine",
            "Mode: CPU-only | Deterministic",
            "Brain loaded: " + graph.summary(),
            "Lexicon loaded: " + lexicon.summary(),
            "Seed: " + seed(),
            "Type 'exit' to quit.");
    }

    public synchronized BrainStats brainStats() {
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        for (NodeCategory category : NodeCategory.values()) {
            byCategory.put(category.tag(), graph.nodesByCategory(category).size());
        }
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (Edge e : graph.edges()) {
            byType.merge(e.getType().tag(), 1, Integer::sum);
        }
        return new BrainStats(graph.nodeCount(), graph.edgeCount(), byCategory, byType);
    }

    public synchronized SessionProfile profile() {
        return new SessionProfile(turnCount, memory.episodes().size(), seed, modulators.asMap(), debug);
    }

    /** Re-creates the random source; memory, modulators and recent words are kept. */
    public synchronized void setSeed(long seed) {
        this.seed   = seed;
        this.random = new SeededRandomSource(seed);
        log.info("[Session] seed={}", seed);
    }

    public synchronized long seed() {
        return seed;
    }

    public synchronized boolean toggleDebug() {
        debug = !debug;
        return debug;
    }

    public synchronized boolean isDebug() {
        return debug;
    }

    public synchronized Modulators modulators() {
        return modulators;
    }

    public synchronized List<String> recentWords() {
        return List.copyOf(recentWords);
    }

    public synchronized int turnCount() {
        return turnCount;
    }
}
