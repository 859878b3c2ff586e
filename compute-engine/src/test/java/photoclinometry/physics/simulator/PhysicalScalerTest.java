package photoclinometry.physics.simulator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import photoclinometry.config.PhotoclinometryConfig;
import photoclinometry.domain.surface.HeightField;
import photoclinometry.factory.SyntheticSurfaceFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PhysicalScalerTest {

    private final PhotoclinometryConfig config = PhotoclinometryConfig.getReferenceMission();

    @Test
    @DisplayName("Escala de píxel de la misión de referencia: 7e-6 · 95850 / 0.14 ≈ 4.7925 m")
    void pixelScaleMeters_referenceMission() {
        assertThat(PhysicalScaler.pixelScaleMeters(config)).isCloseTo(4.7925, within(1e-9));
    }

    @Test
    @DisplayName("Escala de píxel proporcional a altitud y ancho de píxel, inversa a la focal")
    void pixelScaleMeters_shouldFollowPinholeGeometry() {
        PhotoclinometryConfig doubledAltitude = config.withSpacecraftAltitudeKm(2 * config.spacecraftAltitudeKm());
        PhotoclinometryConfig doubledFocal = config.withFocalLengthMm(2 * config.focalLengthMm());

        double base = PhysicalScaler.pixelScaleMeters(config);
        assertThat(PhysicalScaler.pixelScaleMeters(doubledAltitude)).isCloseTo(2 * base, within(1e-9));
        assertThat(PhysicalScaler.pixelScaleMeters(doubledFocal)).isCloseTo(base / 2, within(1e-9));
    }

    @Test
    @DisplayName("scaleToMeters: multiplica por la escala y centra en media cero")
    void scaleToMeters_shouldScaleAndCenter() {
        // ARRANGE
        HeightField dem = HeightField.of(new double[][]{{0.0, 1.0}, {2.0, 3.0}});
        double s = 4.7925;

        // ACT
        HeightField scaled = PhysicalScaler.scaleToMeters(dem, config);

        // ASSERT
        assertThat(scaled.get(0, 0)).isCloseTo(-1.5 * s, within(1e-9));
        assertThat(scaled.get(1, 0)).isCloseTo(-0.5 * s, within(1e-9));
        assertThat(scaled.get(0, 1)).isCloseTo(0.5 * s, within(1e-9));
        assertThat(scaled.get(1, 1)).isCloseTo(1.5 * s, within(1e-9));
        assertThat(scaled.mean()).isCloseTo(0.0, within(1e-12));
        // La entrada no se modifica
        assertThat(dem.get(1, 1)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("scaleToMeters: media cero para superficies arbitrarias")
    void scaleToMeters_shouldAlwaysProduceZeroMean() {
        for (long seed = 0; seed < 10; seed++) {
            HeightField dem = SyntheticSurfaceFactory.randomSurface(9, 7, 3.0 + seed, seed);

            HeightField scaled = PhysicalScaler.scaleToMeters(dem, config);

            assertThat(scaled.mean()).isCloseTo(0.0, within(1e-9));
            assertThat(scaled.max() - scaled.min())
                    .isCloseTo((dem.max() - dem.min()) * PhysicalScaler.pixelScaleMeters(config), within(1e-9));
        }
    }
}
