package com.retailsentinel.core.runtime;

import com.retailsentinel.core.config.ConfigLoader;
import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.emit.JsonLinesEventSink;
import com.retailsentinel.core.ingest.RecordParser;
import com.retailsentinel.core.ingest.ReferenceDataLoader;
import com.retailsentinel.core.model.ReferenceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Standalone entry point.
 *
 * <p>
 * In {@code batch} mode the recorded session in the input directory is
 * replayed and the process exits once every window has been flushed. In
 * {@code live} mode records are read from the TCP stream until it closes or
 * the JVM is stopped.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelApplication {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelApplication.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private SentinelApplication() {
        // entry point only
    }

    public static void main(String[] args) throws Exception {
        SentinelConfig config = ConfigLoader.load();
        RuntimeConfig runtimeConfig = RuntimeConfig.fromEnvironment();
        LOG.info("Starting retail sentinel with {}", runtimeConfig);

        ReferenceCatalog catalog = ReferenceDataLoader.fromDirectory(runtimeConfig.getReferenceDir());
        JsonLinesEventSink sink = openSink(runtimeConfig);
        Correlator correlator = new Correlator(config, catalog, sink);
        RecordQueue queue = new RecordQueue(runtimeConfig.getQueueCapacity(), runtimeConfig.getOverflowPolicy());
        SentinelRuntime runtime = new SentinelRuntime(correlator, queue, sink);

        DashboardServer dashboard = new DashboardServer(runtime::snapshot);
        if (runtimeConfig.getDashboardPort() >= 0) {
            dashboard.start(runtimeConfig.getDashboardPort());
        }

        runtime.start();
        RecordParser parser = new RecordParser();
        try {
            if (runtimeConfig.getMode() == RuntimeConfig.Mode.BATCH) {
                int submitted = new BatchReplay(parser).replay(runtimeConfig.getInputDir(), runtime);
                LOG.info("Replayed {} record(s)", submitted);
            } else {
                StreamClient client = new StreamClient(runtimeConfig.getStreamHost(),
                        runtimeConfig.getStreamPort(), parser, runtime);
                Runtime.getRuntime().addShutdownHook(new Thread(client::stop, "stream-client-shutdown"));
                client.run();
            }
        } finally {
            runtime.shutdown(SHUTDOWN_TIMEOUT);
            dashboard.stop();
            LOG.info("Wrote {} event(s) to {}", sink.getWritten(), runtimeConfig.getOutputPath());
        }
    }

    private static JsonLinesEventSink openSink(RuntimeConfig runtimeConfig) {
        try {
            return JsonLinesEventSink.toFile(runtimeConfig.getOutputPath());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot open output " + runtimeConfig.getOutputPath(), e);
        }
    }
}
