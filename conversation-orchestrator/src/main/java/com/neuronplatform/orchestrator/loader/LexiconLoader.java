package com.neuronplatform.orchestrator.loader;

import com.neuronplatform.common.motor.PartOfSpeech;
import com.neuronplatform.orchestrator.lexicon.Lexicon;
import com.neuronplatform.orchestrator.lexicon.LexiconEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Builds a {@link Lexicon} from a lexicon file.
 *
 * <pre>
 *   WORD|id|text|concept1,concept2|pos
 *   PHRASE|id|text|concepts|pos
 *   SYNONYM|synonym|canonical
 *   STOP|word
 * </pre>
 *
 * Texts are lower-cased. Diagnostics are aggregated as in {@link GraphLoader}.
 */
public final class LexiconLoader {

    private static final Logger log = LoggerFactory.getLogger(LexiconLoader.class);

    static final String KIND = "Lexicon";

    private LexiconLoader() {}

    /**
     * @throws DataLoadException carrying every diagnostic when the file is unusable
     */
    public static Lexicon load(Resource resource) {
        Lexicon lexicon = new Lexicon();
        List<String> diagnostics = new ArrayList<>();

        RecordFile.read(resource, KIND, (line, f) -> {
            try {
                switch (f[0]) {
                    case "WORD", "PHRASE" -> {
                        if (f.length < 5) {
                            diagnostics.add("Line " + line + ": " + f[0] + " record needs 5 fields, got " + f.length);
                            return;
                        }
                        LexiconEntry entry = new LexiconEntry(f[1], lower(f[2]), concepts(f[3]), wordTag(f[4]));
                        if (f[0].equals("WORD")) {
                            lexicon.addWord(entry);
                        } else {
                            lexicon.addPhrase(entry);
                        }
                    }
                    case "SYNONYM" -> {
                        if (f.length < 3) {
                            diagnostics.add("Line " + line + ": SYNONYM record needs 3 fields, got " + f.length);
                            return;
                        }
                        lexicon.addSynonym(lower(f[1]), lower(f[2]));
                    }
                    case "STOP" -> {
                        if (f.length < 2) {
                            diagnostics.add("Line " + line + ": STOP record needs 2 fields, got " + f.length);
                            return;
                        }
                        lexicon.addStopword(lower(f[1]));
                    }
                    default -> diagnostics.add("Line " + line + ": Unknown record type '" + f[0] + "'");
                }
            } catch (IllegalArgumentException e) {
                diagnostics.add("Line " + line + ": Parse error: " + e.getMessage());
            }
        });

        if (!diagnostics.isEmpty()) {
            log.error("[Loader] kind={} source={} diagnostics={}", KIND, resource.getDescription(), diagnostics.size());
            throw new DataLoadException(KIND, diagnostics);
        }

        log.info("[Loader] kind={} source={} loaded={} words={} phrases={} synonyms={} stopwords={}", KIND,
            resource.getDescription(), lexicon.summary(), lexicon.wordCount(), lexicon.phraseCount(),
            lexicon.synonymCount(), lexicon.stopwordCount());
        return lexicon;
    }

    private static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    private static List<String> concepts(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::strip)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    /** START is a walk state, never a word's tag. */
    private static PartOfSpeech wordTag(String tag) {
        PartOfSpeech pos = PartOfSpeech.fromTag(tag);
        if (pos == PartOfSpeech.START) {
            throw new IllegalArgumentException("START is not a word tag");
        }
        return pos;
    }
}
