package com.neuronplatform.orchestrator.shell;

import com.neuronplatform.common.trace.TraceContextUtil;
import com.neuronplatform.orchestrator.service.ConversationService;
import com.neuronplatform.orchestrator.service.TurnResult;
import com.neuronplatform.orchestrator.trace.TraceFormatter;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Interactive console over the session, enabled with {@code conversation.shell.enabled=true}.
 *
 * <pre>
 *   exit        quit
 *   debug       toggle the full trace
 *   showbrain   node and edge counts
 *   profile     turns, episodes, seed, modulators
 *   seed &lt;n&gt;    reseed the random source
 *   anything else is a turn
 * </pre>
 */
@Component
@ConditionalOnProperty(name = "conversation.shell.enabled", havingValue = "true")
public class ConversationShell implements CommandLineRunner {

    private final ConversationService conversationService;

    public ConversationShell(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @Override
    public void run(String... args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        run(in, System.out);
    }

    void run(BufferedReader in, PrintStream out) throws IOException {
        out.println(conversationService.startupSummary());
        out.println();

        while (true) {
            out.print("You: ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                out.println("Goodbye!");
                return;
            }
            if (!handle(line.strip(), out)) return;
        }
    }

    /** @return false when the shell should stop */
    boolean handle(String line, PrintStream out) {
        if (line.isEmpty()) return true;

        String command = line.toLowerCase(Locale.ROOT);
        switch (command) {
            case "exit" -> {
                out.println("Goodbye!");
                return false;
            }
            case "debug" -> {
                out.println("Debug mode: " + (conversationService.toggleDebug() ? "ON" : "OFF"));
                return true;
            }
            case "showbrain" -> {
                out.println(conversationService.brainStats().render());
                return true;
            }
            case "profile" -> {
                out.println(conversationService.profile().render());
                return true;
            }
            default -> {
                if (command.startsWith("seed ")) {
                    reseed(command, out);
                    return true;
                }
            }
        }

        TurnResult result = conversationService.processTurn(line, TraceContextUtil.newTraceId());
        out.println();
        out.println("Bot: " + result.response());
        out.println(TraceFormatter.compact(result.trace()));
        if (conversationService.isDebug()) {
            out.println(TraceFormatter.full(result.trace()));
        }
        out.printf(Locale.ROOT, "  [%.1fms]%n%n", result.elapsedMillis());
        return true;
    }

    private void reseed(String command, PrintStream out) {
        String[] parts = command.split("\\s+");
        try {
            long seed = Long.parseLong(parts[1]);
            conversationService.setSeed(seed);
            out.println("Seed set to " + seed);
        } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
            out.println("Usage: seed <number>");
        }
    }
}
