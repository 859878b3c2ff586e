package photoclinometry.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import photoclinometry.config.PhotoclinometryConfig;
import photoclinometry.domain.reconstruction.ReconstructionResult;

/**
 * Resumen serializable de una reconstrucción, pensado para la capa de exportación.
 */
public record ReconstructionSummary(
        @JsonProperty("width") int width,
        @JsonProperty("height") int height,
        @JsonProperty("sun_azimuth_deg") double sunAzimuthDeg,
        @JsonProperty("sun_elevation_deg") double sunElevationDeg,
        @JsonProperty("light_vector") double[] lightVector,
        @JsonProperty("pixel_scale_m") double pixelScaleMeters,
        @JsonProperty("min_height_m") double minHeightMeters,
        @JsonProperty("max_height_m") double maxHeightMeters,
        @JsonProperty("mean_height_m") double meanHeightMeters,
        @JsonProperty("converged") boolean converged,
        @JsonProperty("iterations") int iterations,
        @JsonProperty("evaluations") int evaluations,
        @JsonProperty("final_cost") double finalCost,
        @JsonProperty("message") String message,
        @JsonProperty("total_time_ms") long totalTimeMillis
) {
    public static ReconstructionSummary from(ReconstructionResult result, PhotoclinometryConfig config) {
        return new ReconstructionSummary(
                result.scaledDem().width(),
                result.scaledDem().height(),
                config.sunAzimuthDeg(),
                config.sunElevationDeg(),
                result.lightVector().toArray(),
                result.pixelScaleMeters(),
                result.statistics().min(),
                result.statistics().max(),
                result.statistics().mean(),
                result.convergence().converged(),
                result.convergence().iterations(),
                result.convergence().evaluations(),
                result.convergence().finalCost(),
                result.convergence().message(),
                result.elapsedMillis());
    }
}
