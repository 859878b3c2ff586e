package photoclinometry.physics.simulator;

import photoclinometry.domain.reconstruction.ConvergenceReport;
import photoclinometry.domain.surface.HeightField;

/**
 * Salida del driver de optimización.
 *
 * @param surface     Campo de alturas adimensional (mejor iterado).
 * @param report      Diagnóstico de convergencia.
 * @param costHistory Coste en cada iterado; {@code costHistory[0]} es el de la superficie inicial.
 */
public record OptimizedSurface(HeightField surface, ConvergenceReport report, double[] costHistory) {}
