package com.retailsentinel.core.runtime;

import com.retailsentinel.core.ingest.MalformedRecordException;
import com.retailsentinel.core.ingest.RecordParser;
import com.retailsentinel.core.model.RecordKind;
import com.retailsentinel.core.model.SensorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads the per-dataset JSON Lines files of a recorded session and returns
 * their records in timestamp order.
 *
 * <p>
 * Files are named after {@link RecordKind#getFileStem()} with a
 * {@code .jsonl} suffix ({@code pos_transactions.jsonl},
 * {@code rfid_readings.jsonl}, ...). Each line is a bare payload. Missing files
 * are skipped; malformed lines are logged and counted. The sort is stable, so
 * records with equal timestamps keep file order, and replaying the same
 * directory always yields the same sequence.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchReplay {

    private static final Logger LOG = LoggerFactory.getLogger(BatchReplay.class);

    private static final Comparator<SensorRecord> BY_TIME =
            Comparator.comparing(SensorRecord::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final RecordParser parser;
    private long malformedLines;

    public BatchReplay(RecordParser parser) {
        this.parser = parser;
    }

    /**
     * @param directory input directory
     * @return all records, sorted by timestamp
     * @throws IllegalStateException if a present file cannot be read
     */
    public List<SensorRecord> load(Path directory) {
        List<SensorRecord> records = new ArrayList<>();
        for (RecordKind kind : RecordKind.values()) {
            Path file = directory.resolve(kind.getFileStem() + ".jsonl");
            if (!Files.exists(file)) {
                LOG.warn("Input file {} not found, skipping", file);
                continue;
            }
            records.addAll(readFile(kind, file));
        }
        records.sort(BY_TIME);
        LOG.info("Loaded {} record(s) from {} ({} malformed line(s))", records.size(), directory, malformedLines);
        return records;
    }

    /**
     * Feed every record of a directory to a runtime, in timestamp order.
     *
     * @param directory input directory
     * @param runtime   started runtime
     * @return number of records submitted
     * @throws InterruptedException if interrupted while the queue is full
     */
    public int replay(Path directory, SentinelRuntime runtime) throws InterruptedException {
        int submitted = 0;
        for (SensorRecord record : load(directory)) {
            if (runtime.submit(record)) {
                submitted++;
            }
        }
        return submitted;
    }

    public long getMalformedLines() {
        return malformedLines;
    }

    private List<SensorRecord> readFile(RecordKind kind, Path file) {
        List<SensorRecord> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.addAll(parser.parsePayload(kind, line));
                } catch (MalformedRecordException e) {
                    malformedLines++;
                    LOG.warn("Skipping malformed line {}:{}: {}", file.getFileName(), lineNumber, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read input file: " + file, e);
        }
        return records;
    }
}
