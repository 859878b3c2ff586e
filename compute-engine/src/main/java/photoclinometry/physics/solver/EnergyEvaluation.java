package photoclinometry.physics.solver;

/**
 * Desglose de una evaluación de la función de energía SFS.
 *
 * @param cost           Coste total {@code brillo + λ·suavidad}.
 * @param brightnessCost {@code 0.5·Σ(observada − predicha)²}.
 * @param smoothnessCost {@code 0.5·Σ(∇²Z)²} (sin ponderar por λ).
 * @param gradient       Gradiente del coste total, aplanado fila a fila.
 */
public record EnergyEvaluation(
        double cost,
        double brightnessCost,
        double smoothnessCost,
        double[] gradient
) {
    public ObjectiveEvaluation toObjectiveEvaluation() {
        return new ObjectiveEvaluation(cost, gradient);
    }
}
