package com.retailsentinel.core.runtime;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.context.ContextBuilder;
import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.detection.DetectionEngine;
import com.retailsentinel.core.detection.RuleFactory;
import com.retailsentinel.core.emit.DashboardAggregator;
import com.retailsentinel.core.emit.DashboardSnapshot;
import com.retailsentinel.core.emit.EventEmitter;
import com.retailsentinel.core.emit.EventSink;
import com.retailsentinel.core.model.ReferenceCatalog;
import com.retailsentinel.core.model.SensorRecord;
import com.retailsentinel.core.model.SentinelEvent;
import com.retailsentinel.core.window.CorrelationWindow;
import com.retailsentinel.core.window.IngestOutcome;
import com.retailsentinel.core.window.WindowManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The processing core: window manager, context builder, detection engine and
 * emitter wired together.
 *
 * <h3>Flow</h3>
 * <ol>
 * <li>{@link #accept(SensorRecord)} buffers the record and advances the
 * logical clock to its timestamp.</li>
 * <li>Every window the clock closes is built into a context and run through
 * the rules, in close order.</li>
 * <li>The resulting events are emitted as one batch and folded into the
 * dashboard snapshot.</li>
 * </ol>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Single-threaded by contract: all mutating calls must come from one
 * processing thread. {@link #snapshot()} may be called from any thread.
 * </p>
 *
 * @since 1.0.0
 */
public class Correlator {

    private static final Logger LOG = LoggerFactory.getLogger(Correlator.class);

    private final WindowManager windows;
    private final ContextBuilder contexts;
    private final DetectionEngine engine;
    private final EventEmitter emitter;
    private final DashboardAggregator dashboard;
    private long contextFailures;

    public Correlator(SentinelConfig config, ReferenceCatalog catalog, EventSink sink) {
        this(new WindowManager(config),
                new ContextBuilder(config, catalog),
                new DetectionEngine(RuleFactory.createEnabled(config)),
                new EventEmitter(config, sink),
                new DashboardAggregator(config.getRecentEventsLimit()));
    }

    public Correlator(WindowManager windows, ContextBuilder contexts, DetectionEngine engine,
                      EventEmitter emitter, DashboardAggregator dashboard) {
        this.windows = Objects.requireNonNull(windows, "windows must not be null");
        this.contexts = Objects.requireNonNull(contexts, "contexts must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.emitter = Objects.requireNonNull(emitter, "emitter must not be null");
        this.dashboard = Objects.requireNonNull(dashboard, "dashboard must not be null");
    }

    /**
     * Ingest one record and emit the events of every window it closes.
     *
     * @param record incoming record, may be invalid
     * @return events emitted by this call, in emission order
     */
    public List<SentinelEvent> accept(SensorRecord record) {
        IngestOutcome outcome = windows.ingest(record);
        if (outcome == IngestOutcome.REJECTED) {
            refreshDashboard();
            return List.of();
        }
        return process(windows.advance(record.getTimestamp()));
    }

    /**
     * Move the logical clock without a record, e.g. from a watermark.
     *
     * @param now candidate clock value
     * @return events emitted by this call
     */
    public List<SentinelEvent> advance(Instant now) {
        return process(windows.advance(now));
    }

    /**
     * Close every window and emit what they hold. Call on shutdown.
     *
     * @return events emitted by this call
     */
    public List<SentinelEvent> flush() {
        return process(windows.flush());
    }

    public DashboardSnapshot snapshot() {
        return dashboard.snapshot();
    }

    public WindowManager getWindows() {
        return windows;
    }

    public DetectionEngine getEngine() {
        return engine;
    }

    public EventEmitter getEmitter() {
        return emitter;
    }

    public long getContextFailures() {
        return contextFailures;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<SentinelEvent> process(List<CorrelationWindow> closed) {
        if (closed.isEmpty()) {
            refreshDashboard();
            return List.of();
        }
        List<SentinelEvent> candidates = new ArrayList<>();
        for (CorrelationWindow window : closed) {
            CorrelationContext context;
            try {
                context = contexts.build(window);
            } catch (Exception e) {
                contextFailures++;
                LOG.error("Failed to build context for {}: {}", window, e.getMessage(), e);
                continue;
            }
            candidates.addAll(engine.evaluate(context));
        }
        List<SentinelEvent> emitted = emitter.emit(candidates);
        dashboard.record(emitted);
        refreshDashboard();
        if (!emitted.isEmpty()) {
            LOG.debug("Closed {} window(s), emitted {} event(s)", closed.size(), emitted.size());
        }
        return emitted;
    }

    private void refreshDashboard() {
        dashboard.refresh(windows.getClock(), windows.getStations().all(),
                windows.getDroppedLate(), windows.getRejected(), engine.getRuleFailures());
    }
}
