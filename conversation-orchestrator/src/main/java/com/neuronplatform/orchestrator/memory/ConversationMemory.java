package com.neuronplatform.orchestrator.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-session recall.
 *
 * <p>Short-term memory keeps the last {@value #DEFAULT_SHORT_TERM_CAPACITY} exchanges;
 * episodic memory keeps the last {@value #DEFAULT_EPISODIC_CAPACITY} episodes. Episodes
 * sharing concepts with the current input are recalled and lend their concepts a small
 * activation boost:
 * <pre>
 *   relevance = overlap + (turnId / turnCounter) × 0.3
 *   boost     = min(0.4, 0.15 × episodes recalling the concept)
 * </pre>
 *
 * <p>Not thread-safe; owned by one conversation session.
 */
public class ConversationMemory {

    private static final Logger log = LoggerFactory.getLogger(ConversationMemory.class);

    public static final int DEFAULT_SHORT_TERM_CAPACITY = 5;
    public static final int DEFAULT_EPISODIC_CAPACITY   = 50;
    public static final int DEFAULT_TOP_K               = 3;

    static final double RECENCY_WEIGHT  = 0.3;
    static final double BOOST_PER_RECALL = 0.15;
    static final double MAX_BOOST        = 0.4;
    static final int    RECENT_EPISODES  = 3;

    private final int shortTermCapacity;
    private final int episodicCapacity;

    private final Deque<Exchange> shortTerm = new ArrayDeque<>();
    private final Deque<Episode>  episodes  = new ArrayDeque<>();
    private int turnCounter;

    public ConversationMemory() {
        this(DEFAULT_SHORT_TERM_CAPACITY, DEFAULT_EPISODIC_CAPACITY);
    }

    public ConversationMemory(int shortTermCapacity, int episodicCapacity) {
        if (shortTermCapacity < 1 || episodicCapacity < 1) {
            throw new IllegalArgumentException("Memory capacities must be positive");
        }
        this.shortTermCapacity = shortTermCapacity;
        this.episodicCapacity  = episodicCapacity;
    }

    public void storeTurn(String userText, String systemText, List<String> concepts, String goal) {
        turnCounter++;

        shortTerm.addLast(new Exchange(userText, systemText));
        if (shortTerm.size() > shortTermCapacity) shortTerm.removeFirst();

        episodes.addLast(new Episode(turnCounter, userText, systemText, concepts, goal));
        if (episodes.size() > episodicCapacity) episodes.removeFirst();
    }

    public List<Episode> retrieveRelevant(List<String> concepts) {
        return retrieveRelevant(concepts, DEFAULT_TOP_K);
    }

    /**
     * Episodes sharing at least one concept with {@code concepts}, most relevant first;
     * equal relevance keeps the older episode first.
     */
    public List<Episode> retrieveRelevant(List<String> concepts, int topK) {
        if (episodes.isEmpty() || concepts.isEmpty()) return List.of();

        Set<String> wanted = new HashSet<>(concepts);
        List<Map.Entry<Double, Episode>> scored = new ArrayList<>();
        for (Episode ep : episodes) {
            long overlap = ep.concepts().stream().distinct().filter(wanted::contains).count();
            if (overlap > 0) {
                double recency = (double) ep.turnId() / Math.max(1, turnCounter);
                scored.add(Map.entry(overlap + recency * RECENCY_WEIGHT, ep));
            }
        }
        scored.sort(Map.Entry.<Double, Episode>comparingByKey().reversed());

        List<Episode> top = new ArrayList<>();
        for (int i = 0; i < Math.min(topK, scored.size()); i++) {
            top.add(scored.get(i).getValue());
        }
        return top;
    }

    /** Concept id → additive boost from recalled episodes; empty when nothing is recalled. */
    public Map<String, Double> memoryBoost(List<String> currentConcepts) {
        Map<String, Double> boosts = new LinkedHashMap<>();
        List<Episode> recalled = retrieveRelevant(currentConcepts);
        for (Episode ep : recalled) {
            for (String concept : ep.concepts()) {
                boosts.merge(concept, BOOST_PER_RECALL, Double::sum);
            }
        }
        boosts.replaceAll((id, boost) -> Math.min(MAX_BOOST, boost));

        if (!recalled.isEmpty()) {
            log.debug("[Memory] recalled={} boosted={}", recalled.size(), boosts.keySet());
        }
        return boosts;
    }

    /** Concepts of the last three episodes, oldest first, duplicates kept. */
    public List<String> recentConcepts() {
        List<Episode> all = new ArrayList<>(episodes);
        List<String> concepts = new ArrayList<>();
        for (Episode ep : all.subList(Math.max(0, all.size() - RECENT_EPISODES), all.size())) {
            concepts.addAll(ep.concepts());
        }
        return concepts;
    }

    public List<Exchange> shortTerm() {
        return Collections.unmodifiableList(new ArrayList<>(shortTerm));
    }

    public List<Episode> episodes() {
        return Collections.unmodifiableList(new ArrayList<>(episodes));
    }

    public int turnCounter() {
        return turnCounter;
    }
}
