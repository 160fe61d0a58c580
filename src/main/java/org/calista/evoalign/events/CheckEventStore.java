package org.calista.evoalign.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.evoalign.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only JSONL log of check runs.
 */
public final class CheckEventStore {
    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public CheckEventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public void append(CheckEvent e) throws IOException {
        String line = mapper.writeValueAsString(e);
        io.appendJsonl(file, line);
    }

    /** Empty when nothing has been logged yet. */
    public List<String> readAllRawLines() throws IOException {
        if (!io.exists(file)) return List.of();
        return io.readJsonl(file);
    }

    public List<CheckEvent> readAll() throws IOException {
        List<String> lines = readAllRawLines();
        List<CheckEvent> out = new ArrayList<>(lines.size());
        for (String l : lines) out.add(mapper.readValue(l, CheckEvent.class));
        return out;
    }
}
