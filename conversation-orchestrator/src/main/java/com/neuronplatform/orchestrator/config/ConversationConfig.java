package com.neuronplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.neuronplatform.common.dynamics.DynamicsConfig;
import com.neuronplatform.common.graph.BrainGraph;
import com.neuronplatform.orchestrator.lexicon.Lexicon;
import com.neuronplatform.orchestrator.loader.GraphLoader;
import com.neuronplatform.orchestrator.loader.LexiconLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads the data files once at start-up. A file with any diagnostic fails the context.
 */
@Configuration
public class ConversationConfig {

    @Value("${conversation.data.graph:classpath:data/graph.brain}")
    private String graphLocation;

    @Value("${conversation.data.lexicon:classpath:data/lexicon.brain}")
    private String lexiconLocation;

    @Value("${conversation.seed:42}")
    private long seed;

    @Value("${conversation.dynamics.steps:20}")
    private int steps;

    @Value("${conversation.dynamics.inhibition-strength:0.15}")
    private double inhibitionStrength;

    @Value("${conversation.dynamics.competition-within-category:true}")
    private boolean competitionWithinCategory;

    @Bean
    public BrainGraph brainGraph(ResourceLoader resourceLoader) {
        return GraphLoader.load(resourceLoader.getResource(graphLocation));
    }

    @Bean
    public Lexicon lexicon(ResourceLoader resourceLoader) {
        return LexiconLoader.load(resourceLoader.getResource(lexiconLocation));
    }

    @Bean
    public DynamicsConfig dynamicsConfig() {
        return new DynamicsConfig(steps, inhibitionStrength, competitionWithinCategory);
    }

    @Bean
    public Long conversationSeed() {
        return seed;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
