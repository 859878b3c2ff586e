package photoclinometry.physics.solver;

/**
 * Observador de progreso del optimizador. Se invoca una vez por paso aceptado
 * con el índice de iteración (empezando en 1). Solo tiene efectos de observabilidad:
 * nunca altera el resultado.
 */
@FunctionalInterface
public interface IterationObserver {

    IterationObserver NONE = iteration -> { };

    void onIteration(int iteration);
}
