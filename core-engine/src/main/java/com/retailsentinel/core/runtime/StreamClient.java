package com.retailsentinel.core.runtime;

import com.retailsentinel.core.ingest.MalformedRecordException;
import com.retailsentinel.core.ingest.RecordParser;
import com.retailsentinel.core.model.SensorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reads stream envelopes, one JSON object per line, from a TCP server and
 * submits the parsed records to a {@link SentinelRuntime}.
 *
 * <p>
 * Malformed lines are logged and counted; the connection stays open. The
 * client stops at end of stream, on {@link #stop()}, or on an I/O error.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamClient implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(StreamClient.class);

    private static final int CONNECT_TIMEOUT_MS = 5_000;

    private final String host;
    private final int port;
    private final RecordParser parser;
    private final SentinelRuntime runtime;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong lines = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private volatile Socket socket;

    public StreamClient(String host, int port, RecordParser parser, SentinelRuntime runtime) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.port = port;
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
    }

    @Override
    public void run() {
        running.set(true);
        try (Socket s = new Socket()) {
            socket = s;
            s.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MS);
            LOG.info("Connected to stream at {}:{}", host, port);
            consume(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            if (running.get()) {
                LOG.error("Stream connection to {}:{} failed: {}", host, port, e.getMessage(), e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Stream client interrupted");
        } finally {
            running.set(false);
            LOG.info("Stream client stopped after {} line(s), {} malformed", lines.get(), malformed.get());
        }
    }

    /**
     * Read envelopes until end of input or until stopped.
     *
     * @param input line-oriented JSON input
     * @throws IOException          if reading fails
     * @throws InterruptedException if interrupted while the queue is full
     */
    void consume(Reader input) throws IOException, InterruptedException {
        BufferedReader reader = new BufferedReader(input);
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            lines.incrementAndGet();
            try {
                for (SensorRecord record : parser.parseEnvelope(line)) {
                    if (!runtime.submit(record)) {
                        return;
                    }
                }
            } catch (MalformedRecordException e) {
                malformed.incrementAndGet();
                LOG.warn("Skipping malformed stream line: {}", e.getMessage());
            }
        }
    }

    /** Close the connection; {@link #run()} returns shortly after. */
    public void stop() {
        if (running.compareAndSet(true, false) && socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                LOG.warn("Error closing stream socket: {}", e.getMessage());
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getLines() {
        return lines.get();
    }

    public long getMalformed() {
        return malformed.get();
    }
}
