package com.retailsentinel.flink;

import com.retailsentinel.core.config.ConfigLoader;
import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.ingest.ReferenceDataLoader;
import com.retailsentinel.core.model.ReferenceCatalog;
import com.retailsentinel.core.model.SensorRecord;
import com.retailsentinel.core.model.SentinelEvent;
import com.retailsentinel.core.runtime.DashboardServer;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Main entry point for the Retail Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (records topic)
 *     -> Deserialize stream envelope -> SensorRecord(s)
 *     -> Key by store id (one correlator per store)
 *     -> CorrelatorProcessFunction (windows, rules, emission)
 *     -> Serialize SentinelEvent -> JSON
 *     -> Kafka (events topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings come from environment variables via {@link JobConfig};
 * detection thresholds from the YAML file read by {@link ConfigLoader}.
 * </p>
 *
 * <h3>Health endpoints</h3>
 * <p>
 * The job client serves {@code /health} and {@code /readiness} only. The
 * dashboard feed {@code /api/data} belongs to the standalone runtime.
 * </p>
 *
 * <h3>Time</h3>
 * <p>
 * The correlator keeps its own logical clock from record timestamps, so the
 * source runs without Flink watermarks.
 * </p>
 *
 * @since 1.0.0
 */
public final class StreamSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(StreamSentinelJob.class);

        private StreamSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Retail Sentinel with config: {}", config);

                // 2. Load thresholds and reference data
                SentinelConfig sentinelConfig = loadSentinelConfig(config);
                ReferenceCatalog catalog = ReferenceDataLoader.fromDirectory(Path.of(config.getReferenceDir()));

                // 3. Start health server (for K8s liveness and readiness) with shutdown hook.
                // Health endpoints only; correlator state lives in the task managers.
                DashboardServer healthServer = DashboardServer.healthOnly();
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                // 4. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 5. Build pipeline
                buildPipeline(env, config, sentinelConfig, catalog);

                // 6. Execute
                env.execute("Retail Sentinel: Correlation and Detection");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka -> Flink -> Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        SentinelConfig sentinelConfig,
                        ReferenceCatalog catalog) {
                KafkaSource<SensorRecord> kafkaSource = KafkaSource.<SensorRecord>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaRecordTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new RecordDeserializationSchema())
                                .build();

                DataStream<SensorRecord> records = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-records-source");

                String storeId = config.getStoreId();
                DataStream<SentinelEvent> events = records
                                .filter(Objects::nonNull)
                                .keyBy(record -> storeId, Types.STRING)
                                .process(new CorrelatorProcessFunction(sentinelConfig, catalog,
                                                config.getIdleFlushMs()))
                                .name("store-correlator");

                KafkaSink<SentinelEvent> kafkaSink = KafkaSink.<SentinelEvent>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaEventTopic())
                                                                .setValueSerializationSchema(
                                                                                new SentinelEventSerializationSchema())
                                                                .build())
                                .build();

                events.sinkTo(kafkaSink).name("kafka-events-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static SentinelConfig loadSentinelConfig(JobConfig config) {
                String path = config.getSentinelConfigPath();
                if (path != null && !path.isBlank()) {
                        return ConfigLoader.fromFile(path);
                }
                return ConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
