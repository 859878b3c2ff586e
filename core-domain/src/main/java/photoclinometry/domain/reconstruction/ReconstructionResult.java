package photoclinometry.domain.reconstruction;

import lombok.Builder;
import photoclinometry.domain.illumination.LightVector;
import photoclinometry.domain.surface.HeightField;

/**
 * Resultado completo de una reconstrucción fotoclinométrica.
 *
 * @param relativeDem      DEM adimensional tal como sale del optimizador.
 * @param scaledDem        DEM en metros, centrado en media cero.
 * @param lightVector      Vector de iluminación usado.
 * @param pixelScaleMeters Escala de píxel estimada [m/píxel].
 * @param statistics       Estadísticas del DEM escalado.
 * @param convergence      Diagnóstico del optimizador.
 * @param elapsedMillis    Tiempo total de cómputo [ms].
 */
@Builder
public record ReconstructionResult(
        HeightField relativeDem,
        HeightField scaledDem,
        LightVector lightVector,
        double pixelScaleMeters,
        DemStatistics statistics,
        ConvergenceReport convergence,
        long elapsedMillis
) {}
