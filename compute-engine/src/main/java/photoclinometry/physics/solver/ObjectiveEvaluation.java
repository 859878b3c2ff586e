package photoclinometry.physics.solver;

/**
 * Par (coste, gradiente) devuelto por un {@link DifferentiableObjective}.
 */
public record ObjectiveEvaluation(double value, double[] gradient) {}
