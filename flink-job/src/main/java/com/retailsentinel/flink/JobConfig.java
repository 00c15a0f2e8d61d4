package com.retailsentinel.flink;

import java.io.Serializable;
import java.util.Properties;

/**
 * Settings of the Retail Sentinel Flink job, resolved from environment
 * variables. Detection thresholds are not here; they come from the YAML file
 * named by {@code SENTINEL_CONFIG_PATH} (bundled defaults when empty).
 *
 * <h3>Environment</h3>
 * <table>
 * <caption>Variables and defaults</caption>
 * <tr><td>{@code KAFKA_BOOTSTRAP_SERVERS}</td><td>{@code localhost:9092}</td></tr>
 * <tr><td>{@code KAFKA_RECORD_TOPIC} / {@code KAFKA_EVENT_TOPIC}</td><td>{@code sentinel-records} / {@code sentinel-events}</td></tr>
 * <tr><td>{@code KAFKA_GROUP_ID}</td><td>{@code retail-sentinel}</td></tr>
 * <tr><td>{@code FLINK_PARALLELISM}</td><td>{@code 1}</td></tr>
 * <tr><td>{@code FLINK_CHECKPOINT_INTERVAL_MS}</td><td>{@code 60000}</td></tr>
 * <tr><td>{@code SENTINEL_IDLE_FLUSH_MS}</td><td>{@code 60000}</td></tr>
 * <tr><td>{@code SENTINEL_CONFIG_PATH}</td><td>empty</td></tr>
 * <tr><td>{@code SENTINEL_REFERENCE_DIR}</td><td>{@code data/input}</td></tr>
 * <tr><td>{@code SENTINEL_STORE_ID}</td><td>{@code store-1}</td></tr>
 * <tr><td>{@code HEALTH_PORT}</td><td>{@code 8080}</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String kafkaBootstrapServers;
    private final String kafkaRecordTopic;
    private final String kafkaEventTopic;
    private final String kafkaGroupId;
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final long idleFlushMs;
    private final String sentinelConfigPath;
    private final String referenceDir;
    private final String storeId;
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaRecordTopic = b.kafkaRecordTopic;
        this.kafkaEventTopic = b.kafkaEventTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.idleFlushMs = b.idleFlushMs;
        this.sentinelConfigPath = b.sentinelConfigPath;
        this.referenceDir = b.referenceDir;
        this.storeId = b.storeId;
        this.healthPort = b.healthPort;
    }

    /**
     * @return configuration resolved from the environment
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaRecordTopic(env("KAFKA_RECORD_TOPIC", "sentinel-records"))
                    .kafkaEventTopic(env("KAFKA_EVENT_TOPIC", "sentinel-events"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "retail-sentinel"))
                    .parallelism(Integer.parseInt(env("FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env("FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .idleFlushMs(Long.parseLong(env("SENTINEL_IDLE_FLUSH_MS", "60000")))
                    .sentinelConfigPath(env("SENTINEL_CONFIG_PATH", ""))
                    .referenceDir(env("SENTINEL_REFERENCE_DIR", "data/input"))
                    .storeId(env("SENTINEL_STORE_ID", "store-1"))
                    .healthPort(Integer.parseInt(env("HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return producer properties for the events sink; the transaction timeout
     *         stays under the broker's default maximum
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaRecordTopic() {
        return kafkaRecordTopic;
    }

    public String getKafkaEventTopic() {
        return kafkaEventTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return processing time without input after which open windows are flushed
     */
    public long getIdleFlushMs() {
        return idleFlushMs;
    }

    /**
     * @return YAML thresholds file, or an empty string for the bundled defaults
     */
    public String getSentinelConfigPath() {
        return sentinelConfigPath;
    }

    public String getReferenceDir() {
        return referenceDir;
    }

    /**
     * @return key under which all records of the store are correlated
     */
    public String getStoreId() {
        return storeId;
    }

    public int getHealthPort() {
        return healthPort;
    }

    /**
     * Fluent builder for {@link JobConfig}; validates at {@link #build()}.
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaRecordTopic = "sentinel-records";
        private String kafkaEventTopic = "sentinel-events";
        private String kafkaGroupId = "retail-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private long idleFlushMs = 60_000;
        private String sentinelConfigPath = "";
        private String referenceDir = "data/input";
        private String storeId = "store-1";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaRecordTopic(String v) {
            this.kafkaRecordTopic = v;
            return this;
        }

        public Builder kafkaEventTopic(String v) {
            this.kafkaEventTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder idleFlushMs(long v) {
            this.idleFlushMs = v;
            return this;
        }

        public Builder sentinelConfigPath(String v) {
            this.sentinelConfigPath = v;
            return this;
        }

        public Builder referenceDir(String v) {
            this.referenceDir = v;
            return this;
        }

        public Builder storeId(String v) {
            this.storeId = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(kafkaBootstrapServers, "kafkaBootstrapServers");
            requireNonBlank(kafkaRecordTopic, "kafkaRecordTopic");
            requireNonBlank(kafkaEventTopic, "kafkaEventTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(referenceDir, "referenceDir");
            requireNonBlank(storeId, "storeId");
            if (sentinelConfigPath == null) {
                throw new IllegalArgumentException("sentinelConfigPath must not be null; use \"\" for defaults");
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1 || idleFlushMs < 1) {
                throw new IllegalArgumentException("checkpointIntervalMs and idleFlushMs must be >= 1, got: "
                        + checkpointIntervalMs + ", " + idleFlushMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException("healthPort must be in [1, 65535], got: " + healthPort);
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafka=" + kafkaBootstrapServers +
                ", topics=" + kafkaRecordTopic + "->" + kafkaEventTopic +
                ", groupId=" + kafkaGroupId +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", idleFlushMs=" + idleFlushMs +
                ", sentinelConfigPath=" + sentinelConfigPath +
                ", referenceDir=" + referenceDir +
                ", storeId=" + storeId +
                ", healthPort=" + healthPort +
                '}';
    }
}
