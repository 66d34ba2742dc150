package kiln.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import kiln.engine.metrics.MetricsSnapshot;
import kiln.engine.model.PoolMetrics;
import kiln.engine.model.WorkerMetrics;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for pool metrics.
 * GET /api/v1/metrics
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricsResponse(
        @JsonProperty("pool") PoolMetrics pool,
        @JsonProperty("workers") List<WorkerMetrics> workers,
        @JsonProperty("sampledAt") Instant sampledAt,
        @JsonProperty("windowThroughputPerSecond") Double windowThroughputPerSecond) {

    /**
     * @param latest last periodic sample, or null if there is none yet
     */
    public static MetricsResponse of(PoolMetrics pool, List<WorkerMetrics> workers, MetricsSnapshot latest) {
        return new MetricsResponse(
                pool,
                workers,
                latest != null ? latest.sampledAt() : null,
                latest != null ? latest.windowThroughputPerSecond() : null);
    }
}
