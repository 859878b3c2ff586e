package photoclinometry.physics.solver;

/**
 * Oráculo conjunto de coste y gradiente sobre un vector de estado aplanado.
 */
public interface DifferentiableObjective {

    /**
     * Dimensión del vector de estado.
     */
    int dimension();

    /**
     * Evalúa coste y gradiente en {@code x}. No debe modificar {@code x}.
     */
    ObjectiveEvaluation evaluate(double[] x);
}
