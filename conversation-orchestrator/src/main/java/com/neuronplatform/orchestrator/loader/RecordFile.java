package com.neuronplatform.orchestrator.loader;

import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Line walker shared by the data loaders: {@code |}-separated records, blank lines and
 * {@code #} comments skipped, every field trimmed.
 */
final class RecordFile {

    @FunctionalInterface
    interface RecordHandler {
        void onRecord(int lineNumber, String[] fields);
    }

    private RecordFile() {}

    static void read(Resource resource, String kind, RecordHandler handler) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String raw;
            int lineNumber = 0;
            while ((raw = reader.readLine()) != null) {
                lineNumber++;
                String line = raw.strip();
                if (line.isEmpty() || line.startsWith("#")) continue;

                String[] fields = line.split("\\|", -1);
                for (int i = 0; i < fields.length; i++) {
                    fields[i] = fields[i].strip();
                }
                handler.onRecord(lineNumber, fields);
            }
        } catch (IOException e) {
            throw new DataLoadException(kind,
                "Cannot read " + resource.getDescription() + ": " + e.getMessage(), e);
        }
    }
}
