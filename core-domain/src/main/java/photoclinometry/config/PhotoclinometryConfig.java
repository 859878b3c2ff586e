package photoclinometry.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.With;
import photoclinometry.domain.exception.ConfigurationException;

/**
 * Objeto de valor inmutable con todos los parámetros de una reconstrucción
 * Shape-from-Shading (fotoclinometría).
 * <p>
 * Agrupa la geometría de iluminación, los parámetros del algoritmo de optimización
 * y la geometría de cámara/órbita necesaria para escalar el DEM a metros.
 * Las claves JSON usan snake_case ({@code sun_azimuth_deg}, ...). Las claves
 * desconocidas (coordenadas de esquina, proyección) se ignoran: pertenecen a la
 * exportación georreferenciada, que no forma parte de este motor.
 *
 * @param sunAzimuthDeg         Azimut solar en grados, medido en sentido horario desde el Norte.
 * @param sunElevationDeg       Elevación solar en grados sobre el horizonte.
 * @param initialSurface        Política de superficie inicial. Solo se admite {@code "flat"}.
 * @param regularizationLambda  Peso del término de suavidad (bi-Laplaciano). Mayor valor, DEM más suave.
 * @param maxIterations         Número máximo de iteraciones del optimizador L-BFGS.
 * @param spacecraftAltitudeKm  Altitud de la sonda sobre la superficie [km].
 * @param focalLengthMm         Distancia focal de la cámara [mm].
 * @param detectorPixelWidthUm  Ancho de un píxel del detector [µm].
 */
@Builder
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record PhotoclinometryConfig(
        // --- Geometría de Iluminación ---
        @JsonProperty("sun_azimuth_deg") double sunAzimuthDeg,
        @JsonProperty("sun_elevation_deg") double sunElevationDeg,

        // --- Parámetros del Algoritmo SFS ---
        @JsonProperty("initial_surface") String initialSurface,
        @JsonProperty("regularization_lambda") double regularizationLambda,
        @JsonProperty("max_iterations") int maxIterations,

        // --- Geometría de Cámara y Órbita (escalado físico) ---
        @JsonProperty("spacecraft_altitude_km") double spacecraftAltitudeKm,
        @JsonProperty("focal_length_mm") double focalLengthMm,
        @JsonProperty("detector_pixel_width_um") double detectorPixelWidthUm
) {
    public static final String FLAT_INITIAL_SURFACE = "flat";
    public static final double DEFAULT_REGULARIZATION_LAMBDA = 5e-3;
    public static final int DEFAULT_MAX_ITERATIONS = 150;
    public static final double DEFAULT_DETECTOR_PIXEL_WIDTH_UM = 7.0;

    /**
     * Configuración de referencia de la misión (imagen lunar de prueba).
     */
    public static PhotoclinometryConfig getReferenceMission() {
        return PhotoclinometryConfig.builder()
                .sunAzimuthDeg(101.554510)
                .sunElevationDeg(34.802249)
                .initialSurface(FLAT_INITIAL_SURFACE)
                .regularizationLambda(DEFAULT_REGULARIZATION_LAMBDA)
                .maxIterations(DEFAULT_MAX_ITERATIONS)
                .spacecraftAltitudeKm(95.85)
                .focalLengthMm(140.0)
                .detectorPixelWidthUm(DEFAULT_DETECTOR_PIXEL_WIDTH_UM)
                .build();
    }

    /**
     * Indica si la política de inicialización es la superficie plana.
     * La comparación es exacta (sensible a mayúsculas).
     */
    public boolean usesFlatInitialSurface() {
        return FLAT_INITIAL_SURFACE.equals(initialSurface);
    }

    /**
     * Valida la coherencia de todos los parámetros.
     *
     * @return esta misma configuración, para encadenar llamadas.
     * @throws ConfigurationException si algún parámetro no es utilizable.
     */
    public PhotoclinometryConfig validate() {
        if (!usesFlatInitialSurface()) {
            throw new ConfigurationException("Superficie inicial no soportada: '" + initialSurface
                    + "'. La carga de un DEM inicial no está implementada; use '" + FLAT_INITIAL_SURFACE + "'.");
        }
        if (!Double.isFinite(sunAzimuthDeg) || !Double.isFinite(sunElevationDeg)) {
            throw new ConfigurationException("Los ángulos solares deben ser finitos (azimut="
                    + sunAzimuthDeg + ", elevación=" + sunElevationDeg + ").");
        }
        if (!Double.isFinite(regularizationLambda) || regularizationLambda < 0) {
            throw new ConfigurationException("regularization_lambda debe ser finito y >= 0: " + regularizationLambda);
        }
        if (maxIterations <= 0) {
            throw new ConfigurationException("max_iterations debe ser positivo: " + maxIterations);
        }
        requirePositive("spacecraft_altitude_km", spacecraftAltitudeKm);
        requirePositive("focal_length_mm", focalLengthMm);
        requirePositive("detector_pixel_width_um", detectorPixelWidthUm);
        return this;
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new ConfigurationException(name + " debe ser finito y positivo: " + value);
        }
    }
}
