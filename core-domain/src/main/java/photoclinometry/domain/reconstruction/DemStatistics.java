package photoclinometry.domain.reconstruction;

import photoclinometry.domain.surface.HeightField;

/**
 * Estadísticas resumen de un DEM, consumidas por las capas de exportación y visualización.
 */
public record DemStatistics(double min, double max, double mean) {

    public static DemStatistics of(HeightField dem) {
        return new DemStatistics(dem.min(), dem.max(), dem.mean());
    }

    public double range() {
        return max - min;
    }
}
