package photoclinometry.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import photoclinometry.config.PhotoclinometryConfig;
import photoclinometry.domain.surface.HeightField;

/**
 * Escalado físico del DEM relativo a metros.
 * <p>
 * La escala de píxel usa la aproximación de cámara estenopeica (distancia de
 * muestreo en superficie): {@code GSD = ancho_píxel · altitud / focal}.
 * El DEM resultante se centra en media cero: SFS solo recupera la forma relativa.
 */
@Slf4j
public final class PhysicalScaler {

    private PhysicalScaler() {}

    /**
     * @return Metros de superficie por píxel de imagen.
     */
    public static double pixelScaleMeters(PhotoclinometryConfig config) {
        double pixelWidthM = config.detectorPixelWidthUm() * 1e-6;
        double altitudeM = config.spacecraftAltitudeKm() * 1000.0;
        double focalLengthM = config.focalLengthMm() * 1e-3;
        return pixelWidthM * altitudeM / focalLengthM;
    }

    /**
     * Multiplica el DEM adimensional por la escala de píxel y le resta su media.
     */
    public static HeightField scaleToMeters(HeightField dem, PhotoclinometryConfig config) {
        double pixelScale = pixelScaleMeters(config);
        log.info("Escala de píxel estimada: {} m/píxel", String.format("%.2f", pixelScale));

        double[] scaled = dem.samples();
        for (int i = 0; i < scaled.length; i++) {
            scaled[i] *= pixelScale;
        }
        double mean = new HeightField(dem.width(), dem.height(), scaled).mean();
        for (int i = 0; i < scaled.length; i++) {
            scaled[i] -= mean;
        }
        return new HeightField(dem.width(), dem.height(), scaled);
    }
}
