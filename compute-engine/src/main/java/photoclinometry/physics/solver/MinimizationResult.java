package photoclinometry.physics.solver;

/**
 * Resultado de una minimización.
 *
 * @param point        Mejor iterado encontrado.
 * @param value        Coste en {@code point}.
 * @param iterations   Pasos aceptados.
 * @param evaluations  Evaluaciones de coste/gradiente realizadas.
 * @param converged    {@code true} si se cumplió un criterio de convergencia.
 * @param message      Motivo de parada.
 * @param valueHistory Coste en cada iterado, empezando por el punto inicial.
 */
public record MinimizationResult(
        double[] point,
        double value,
        int iterations,
        int evaluations,
        boolean converged,
        String message,
        double[] valueHistory
) {}
