package com.neuronplatform.orchestrator.shell;

import com.neuronplatform.common.dynamics.DynamicsConfig;
import com.neuronplatform.orchestrator.loader.GraphLoader;
import com.neuronplatform.orchestrator.loader.LexiconLoader;
import com.neuronplatform.orchestrator.logger.TurnFlowLogger;
import com.neuronplatform.orchestrator.service.ConversationService;
import com.neuronplatform.orchestrator.trace.TraceFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConversationShellTest {

    private ConversationService service;
    private ConversationShell   shell;
    private ByteArrayOutputStream buffer;
    private PrintStream           out;

    @BeforeEach
    void setUp() {
        service = new ConversationService(
            GraphLoader.load(new ClassPathResource("data/graph.brain")),
            LexiconLoader.load(new ClassPathResource("data/lexicon.brain")),
            DynamicsConfig.defaults(), 42L, new TurnFlowLogger());
        shell  = new ConversationShell(service);
        buffer = new ByteArrayOutputStream();
        out    = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("exit stops the loop")
    void exit() {
        assertFalse(shell.handle("exit", out));
        assertTrue(shell.handle("", out));
        assertTrue(output().contains("Goodbye!"));
    }

    @Test
    @DisplayName("debug toggles and adds the full trace to turns")
    void debug() {
        shell.handle("debug", out);
        assertTrue(output().contains("Debug mode: ON"));

        shell.handle("tell me about the lake", out);
        assertTrue(output().contains(TraceFormatter.FULL_HEADER));

        shell.handle("DEBUG", out);
        assertTrue(output().contains("Debug mode: OFF"));
    }

    @Test
    @DisplayName("a turn prints the reply, the compact trace and the elapsed time")
    void turn() {
        assertTrue(shell.handle("hello", out));

        String printed = output();
        assertTrue(printed.contains("Bot: "));
        assertTrue(printed.contains(TraceFormatter.COMPACT_HEADER));
        assertFalse(printed.contains(TraceFormatter.FULL_HEADER));
        assertTrue(printed.matches("(?s).*\\[\\d+\\.\\dms].*"));
        assertEquals(1, service.turnCount());
    }

    @Test
    @DisplayName("seed takes a number; anything else prints usage")
    void seed() {
        shell.handle("seed 99", out);
        assertEquals(99L, service.seed());
        assertTrue(output().contains("Seed set to 99"));

        shell.handle("seed abc", out);
        assertTrue(output().contains("Usage: seed <number>"));
        assertEquals(99L, service.seed());
        assertEquals(0, service.turnCount());
    }

    @Test
    @DisplayName("showbrain and profile render session state")
    void reports() {
        shell.handle("showbrain", out);
        shell.handle("profile", out);

        assertTrue(output().contains("Brain: "));
        assertTrue(output().contains("Node types:"));
        assertTrue(output().contains("Turns: 0"));
        assertTrue(output().contains("Seed: 42"));
    }

    @Test
    @DisplayName("the loop greets, runs lines until end of input and says goodbye")
    void loop() throws IOException {
        shell.run(new BufferedReader(new StringReader("hello\nprofile\n")), out);

        String printed = output();
        assertTrue(printed.startsWith("Neuron Conversation Engine"));
        assertTrue(printed.contains("Turns: 1"));
        assertTrue(printed.trim().endsWith("Goodbye!"));
    }
}
