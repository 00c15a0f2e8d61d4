package com.retailsentinel.core.runtime;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Typed, immutable settings of the standalone runtime, resolved from
 * environment variables.
 *
 * <h3>Environment</h3>
 * <table>
 * <caption>Variables and defaults</caption>
 * <tr><td>{@code SENTINEL_MODE}</td><td>{@code batch} or {@code live} ({@code batch})</td></tr>
 * <tr><td>{@code SENTINEL_INPUT_DIR}</td><td>{@code data/input}</td></tr>
 * <tr><td>{@code SENTINEL_REFERENCE_DIR}</td><td>input directory</td></tr>
 * <tr><td>{@code SENTINEL_OUTPUT_PATH}</td><td>{@code evidence/output/events.jsonl}</td></tr>
 * <tr><td>{@code SENTINEL_STREAM_HOST} / {@code SENTINEL_STREAM_PORT}</td><td>{@code localhost} / {@code 8765}</td></tr>
 * <tr><td>{@code SENTINEL_DASHBOARD_PORT}</td><td>{@code 8080}; {@code -1} disables the server</td></tr>
 * <tr><td>{@code SENTINEL_QUEUE_CAPACITY}</td><td>{@code 10000}</td></tr>
 * <tr><td>{@code SENTINEL_OVERFLOW_POLICY}</td><td>{@code block} or {@code drop_oldest} ({@code block})</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class RuntimeConfig {

    /** How records reach the runtime. */
    public enum Mode {
        /** Replay recorded JSON Lines files, then exit. */
        BATCH,
        /** Read the TCP stream until it ends or the process is stopped. */
        LIVE
    }

    private final Mode mode;
    private final Path inputDir;
    private final Path referenceDir;
    private final Path outputPath;
    private final String streamHost;
    private final int streamPort;
    private final int dashboardPort;
    private final int queueCapacity;
    private final OverflowPolicy overflowPolicy;

    private RuntimeConfig(Builder b) {
        this.mode = b.mode;
        this.inputDir = b.inputDir;
        this.referenceDir = b.referenceDir != null ? b.referenceDir : b.inputDir;
        this.outputPath = b.outputPath;
        this.streamHost = b.streamHost;
        this.streamPort = b.streamPort;
        this.dashboardPort = b.dashboardPort;
        this.queueCapacity = b.queueCapacity;
        this.overflowPolicy = b.overflowPolicy;
    }

    /**
     * @return configuration resolved from the environment
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static RuntimeConfig fromEnvironment() {
        try {
            String referenceDir = env("SENTINEL_REFERENCE_DIR", "");
            return new Builder()
                    .mode(Mode.valueOf(env("SENTINEL_MODE", "batch").trim().toUpperCase(Locale.ROOT)))
                    .inputDir(Path.of(env("SENTINEL_INPUT_DIR", "data/input")))
                    .referenceDir(referenceDir.isEmpty() ? null : Path.of(referenceDir))
                    .outputPath(Path.of(env("SENTINEL_OUTPUT_PATH", "evidence/output/events.jsonl")))
                    .streamHost(env("SENTINEL_STREAM_HOST", "localhost"))
                    .streamPort(Integer.parseInt(env("SENTINEL_STREAM_PORT", "8765")))
                    .dashboardPort(Integer.parseInt(env("SENTINEL_DASHBOARD_PORT", "8080")))
                    .queueCapacity(Integer.parseInt(env("SENTINEL_QUEUE_CAPACITY", "10000")))
                    .overflowPolicy(OverflowPolicy.parse(env("SENTINEL_OVERFLOW_POLICY", "block")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public Mode getMode() {
        return mode;
    }

    public Path getInputDir() {
        return inputDir;
    }

    public Path getReferenceDir() {
        return referenceDir;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public String getStreamHost() {
        return streamHost;
    }

    public int getStreamPort() {
        return streamPort;
    }

    /**
     * @return dashboard port, or {@code -1} when disabled
     */
    public int getDashboardPort() {
        return dashboardPort;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RuntimeConfig}; validates at {@link #build()}.
     */
    public static class Builder {
        private Mode mode = Mode.BATCH;
        private Path inputDir = Path.of("data/input");
        private Path referenceDir;
        private Path outputPath = Path.of("evidence/output/events.jsonl");
        private String streamHost = "localhost";
        private int streamPort = 8765;
        private int dashboardPort = 8080;
        private int queueCapacity = 10_000;
        private OverflowPolicy overflowPolicy = OverflowPolicy.BLOCK;

        public Builder mode(Mode v) {
            this.mode = v;
            return this;
        }

        public Builder inputDir(Path v) {
            this.inputDir = v;
            return this;
        }

        public Builder referenceDir(Path v) {
            this.referenceDir = v;
            return this;
        }

        public Builder outputPath(Path v) {
            this.outputPath = v;
            return this;
        }

        public Builder streamHost(String v) {
            this.streamHost = v;
            return this;
        }

        public Builder streamPort(int v) {
            this.streamPort = v;
            return this;
        }

        public Builder dashboardPort(int v) {
            this.dashboardPort = v;
            return this;
        }

        public Builder queueCapacity(int v) {
            this.queueCapacity = v;
            return this;
        }

        public Builder overflowPolicy(OverflowPolicy v) {
            this.overflowPolicy = v;
            return this;
        }

        /**
         * @return a validated {@link RuntimeConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RuntimeConfig build() {
            if (mode == null || inputDir == null || outputPath == null || overflowPolicy == null) {
                throw new IllegalArgumentException("mode, inputDir, outputPath and overflowPolicy are required");
            }
            if (streamHost == null || streamHost.isBlank()) {
                throw new IllegalArgumentException("streamHost must not be null or blank");
            }
            if (streamPort < 1 || streamPort > 65_535) {
                throw new IllegalArgumentException("streamPort must be in [1, 65535], got: " + streamPort);
            }
            if (dashboardPort < -1 || dashboardPort > 65_535) {
                throw new IllegalArgumentException("dashboardPort must be in [-1, 65535], got: " + dashboardPort);
            }
            if (queueCapacity < 1) {
                throw new IllegalArgumentException("queueCapacity must be >= 1, got: " + queueCapacity);
            }
            return new RuntimeConfig(this);
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "RuntimeConfig{" +
                "mode=" + mode +
                ", inputDir=" + inputDir +
                ", referenceDir=" + referenceDir +
                ", outputPath=" + outputPath +
                ", stream=" + streamHost + ':' + streamPort +
                ", dashboardPort=" + dashboardPort +
                ", queueCapacity=" + queueCapacity +
                ", overflowPolicy=" + overflowPolicy +
                '}';
    }
}
