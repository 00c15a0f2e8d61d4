package com.retailsentinel.flink;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.model.ReferenceCatalog;
import com.retailsentinel.core.model.SensorRecord;
import com.retailsentinel.core.model.SentinelEvent;
import com.retailsentinel.core.runtime.Correlator;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that hosts one {@link Correlator} per
 * store key.
 *
 * <p>
 * The stream is keyed by a constant store id, so all records of the store
 * pass through a single operator instance in arrival order, as the
 * correlator requires. Events produced by each record are collected
 * directly.
 * </p>
 *
 * <h3>Idle Flush</h3>
 * <p>
 * Every record re-arms a processing-time timer. If no record arrives for
 * {@code idleFlushMs}, all open windows are flushed and their events emitted,
 * so the tail of a finite or paused stream is not held back.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * The correlator lives in a transient field created in {@link #open}; its
 * windows are not part of Flink checkpoints.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelatorProcessFunction
        extends KeyedProcessFunction<String, SensorRecord, SentinelEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(CorrelatorProcessFunction.class);

    private final SentinelConfig config;
    private final ReferenceCatalog catalog;
    private final long idleFlushMs;

    private transient Correlator correlator;
    private transient SentinelMetrics metrics;
    private transient long lastRecordAt;

    /**
     * @param config      validated detection configuration
     * @param catalog     reference data
     * @param idleFlushMs processing time without input before open windows are flushed
     */
    public CorrelatorProcessFunction(SentinelConfig config, ReferenceCatalog catalog, long idleFlushMs) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        if (idleFlushMs < 1) {
            throw new IllegalArgumentException("idleFlushMs must be >= 1, got: " + idleFlushMs);
        }
        this.idleFlushMs = idleFlushMs;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        // events are taken from the return values, so the sink has nothing to do
        correlator = new Correlator(config, catalog, events -> { });
        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup(),
                () -> correlator.getWindows().getDroppedLate(),
                () -> correlator.getEngine().getRuleFailures());
        LOG.info("CorrelatorProcessFunction opened with {} rule(s), catalog {}",
                correlator.getEngine().getRules().size(), catalog);
    }

    @Override
    public void close() {
        if (correlator != null && correlator.getWindows().liveWindowCount() > 0) {
            LOG.warn("CorrelatorProcessFunction closing with {} unflushed window(s)",
                    correlator.getWindows().liveWindowCount());
        }
        LOG.info("CorrelatorProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(SensorRecord record,
            KeyedProcessFunction<String, SensorRecord, SentinelEvent>.Context ctx,
            Collector<SentinelEvent> out) {
        long startNanos = System.nanoTime();

        collect(correlator.accept(record), out);
        metrics.incrementRecordsIngested();

        lastRecordAt = ctx.timerService().currentProcessingTime();
        ctx.timerService().registerProcessingTimeTimer(lastRecordAt + idleFlushMs);

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, SensorRecord, SentinelEvent>.OnTimerContext ctx,
            Collector<SentinelEvent> out) {
        if (timestamp < lastRecordAt + idleFlushMs || correlator.getWindows().liveWindowCount() == 0) {
            return;
        }
        List<SentinelEvent> flushed = correlator.flush();
        LOG.info("Idle for {} ms, flushed open windows ({} event(s))", idleFlushMs, flushed.size());
        collect(flushed, out);
    }

    private void collect(List<SentinelEvent> events, Collector<SentinelEvent> out) {
        for (SentinelEvent event : events) {
            out.collect(event);
        }
        if (!events.isEmpty()) {
            metrics.incrementEventsEmitted(events.size());
        }
    }
}
