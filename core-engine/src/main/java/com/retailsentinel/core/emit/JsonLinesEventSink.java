package com.retailsentinel.core.emit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailsentinel.core.model.SentinelEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes events as JSON Lines, one envelope per line:
 *
 * <pre>
 * {"timestamp":"2025-08-13T16:00:30Z","event_id":"E000","event_data":{"event_name":"Scanner Avoidance",...}}
 * </pre>
 *
 * <p>
 * The writer is flushed after every batch so readers tailing the file see
 * complete lines.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesEventSink implements EventSink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesEventSink.class);

    private final Writer writer;
    private final ObjectMapper mapper = EventJson.newMapper();
    private long written;

    public JsonLinesEventSink(Writer writer) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    /**
     * Open (and truncate) a file sink, creating parent directories.
     *
     * @param path output file
     * @return the sink
     * @throws IOException if the file cannot be opened
     */
    public static JsonLinesEventSink toFile(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        LOG.info("Writing events to {}", path);
        return new JsonLinesEventSink(new BufferedWriter(
                new OutputStreamWriter(Files.newOutputStream(path), StandardCharsets.UTF_8)));
    }

    @Override
    public synchronized void publish(List<SentinelEvent> events) throws IOException {
        for (SentinelEvent event : events) {
            writer.write(mapper.writeValueAsString(event));
            writer.write('\n');
            written++;
        }
        writer.flush();
    }

    public synchronized long getWritten() {
        return written;
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
