package photoclinometry.domain.reconstruction;

/**
 * Diagnóstico de una ejecución del optimizador.
 * <p>
 * La no convergencia no es un error: el mejor iterado se devuelve igualmente y
 * la condición se comunica aquí, en {@code converged} y {@code message}.
 *
 * @param converged   {@code true} si se cumplió el criterio interno de convergencia.
 * @param iterations  Número de pasos aceptados.
 * @param evaluations Número de evaluaciones de coste/gradiente.
 * @param finalCost   Coste en el iterado devuelto.
 * @param message     Motivo de parada, legible por humanos.
 */
public record ConvergenceReport(
        boolean converged,
        int iterations,
        int evaluations,
        double finalCost,
        String message
) {}
