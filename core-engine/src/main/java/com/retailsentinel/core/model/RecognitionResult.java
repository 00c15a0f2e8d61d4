package com.retailsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Vision-based product identification at a station. The prediction may be
 * absent or low-confidence.
 *
 * @since 1.0.0
 */
public final class RecognitionResult implements SensorRecord {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final String stationId;
    private final String predictedSku;
    private final double confidence;
    private final String status;

    public RecognitionResult(Instant timestamp, String stationId, String predictedSku,
            double confidence, String status) {
        this.timestamp = timestamp;
        this.stationId = stationId;
        this.predictedSku = predictedSku;
        this.confidence = confidence;
        this.status = status;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String getStationId() {
        return stationId;
    }

    /**
     * @return the predicted SKU, or {@code null} if nothing was recognised
     */
    public String getPredictedSku() {
        return predictedSku;
    }

    /**
     * @return prediction confidence in {@code [0, 1]}
     */
    public double getConfidence() {
        return confidence;
    }

    @Override
    public String getStatus() {
        return status;
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.RECOGNITION;
    }

    @Override
    public boolean isValid() {
        return timestamp != null
                && stationId != null && !stationId.isBlank()
                && Double.isFinite(confidence) && confidence >= 0 && confidence <= 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RecognitionResult that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(stationId, that.stationId)
                && Objects.equals(predictedSku, that.predictedSku);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, stationId, predictedSku, confidence);
    }

    @Override
    public String toString() {
        return "RecognitionResult{" +
                "timestamp=" + timestamp +
                ", stationId='" + stationId + '\'' +
                ", predictedSku='" + predictedSku + '\'' +
                ", confidence=" + confidence +
                '}';
    }
}
