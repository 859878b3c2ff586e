package photoclinometry.physics.solver.impl;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import photoclinometry.physics.i.ISolverComponent;
import photoclinometry.physics.solver.DifferentiableObjective;
import photoclinometry.physics.solver.IterationObserver;
import photoclinometry.physics.solver.MinimizationResult;
import photoclinometry.physics.solver.ObjectiveEvaluation;
import smile.math.BFGS;
import smile.math.DifferentiableMultivariateFunction;

import java.util.Arrays;
import java.util.Objects;

/**
 * Minimizador cuasi-Newton de memoria limitada (L-BFGS) delegado en
 * {@link BFGS#minimize(DifferentiableMultivariateFunction, int, double[], double, int)} de Smile.
 * <p>
 * Esta clase solo adapta el objetivo a la interfaz de Smile y traduce el resultado:
 * <ul>
 * <li>Smile pide el gradiente una vez en el punto inicial y una vez por paso aceptado
 *     (la búsqueda lineal solo evalúa el coste). Cada petición de gradiente posterior a la
 *     inicial se notifica al observador y se anota en el historial de coste.</li>
 * <li>Si Smile termina antes de agotar {@code maxIterations}, se cumplió uno de sus criterios
 *     de convergencia (gradiente relativo por debajo de {@code gradientTolerance} o paso nulo).</li>
 * <li>El límite de evaluaciones y el fallo de la búsqueda lineal interrumpen la ejecución;
 *     se devuelve el último punto aceptado.</li>
 * </ul>
 * La no convergencia nunca lanza excepción: se refleja en {@link MinimizationResult}.
 */
@Slf4j
@Getter
@Builder
public class LbfgsMinimizer implements ISolverComponent {

    public static final String MSG_CONVERGENCE = "CONVERGENCE: GRADIENT OR STEP BELOW TOLERANCE";
    public static final String MSG_MAX_ITERATIONS = "STOP: TOTAL NO. of ITERATIONS REACHED LIMIT";
    public static final String MSG_MAX_EVALUATIONS = "STOP: TOTAL NO. of f AND g EVALUATIONS EXCEEDS LIMIT";
    public static final String MSG_LINE_SEARCH_FAILED = "ABNORMAL_TERMINATION_IN_LNSRCH";
    public static final String MSG_NON_FINITE_START = "ABNORMAL: NON-FINITE COST OR GRADIENT AT START";

    /**
     * Número de pares de corrección almacenados.
     */
    @Builder.Default
    private final int memory = 10;

    @Builder.Default
    private final double gradientTolerance = 1e-5;

    @Builder.Default
    private final int maxEvaluations = 15000;

    @Override
    public String getName() {
        return "L-BFGS";
    }

    @Override
    public String getDescription() {
        return "Cuasi-Newton de memoria limitada (m=" + memory + ", Smile)";
    }

    /**
     * Minimiza {@code objective} partiendo de {@code initialPoint}.
     *
     * @param objective     Oráculo conjunto de coste y gradiente.
     * @param initialPoint  Punto de partida (no se modifica).
     * @param maxIterations Número máximo de pasos aceptados.
     * @param observer      Notificado una vez por paso aceptado.
     * @return El mejor iterado y sus metadatos de convergencia.
     */
    public MinimizationResult minimize(DifferentiableObjective objective, double[] initialPoint,
                                       int maxIterations, IterationObserver observer) {
        Objects.requireNonNull(objective, "El objetivo no puede ser nulo.");
        Objects.requireNonNull(observer, "El observador no puede ser nulo.");
        if (initialPoint.length != objective.dimension()) {
            throw new IllegalArgumentException("El punto inicial tiene dimensión " + initialPoint.length
                    + ", el objetivo espera " + objective.dimension());
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations debe ser positivo: " + maxIterations);
        }
        if (memory <= 0 || !(gradientTolerance > 0)) {
            throw new IllegalArgumentException("Configuración L-BFGS inválida: memory=" + memory
                    + ", gradientTolerance=" + gradientTolerance);
        }

        TrackedFunction function = new TrackedFunction(objective, maxEvaluations, observer);

        // Smile no admite gradiente nulo ni coste no finito en el punto inicial
        ObjectiveEvaluation start = function.evaluate(initialPoint);
        function.start(initialPoint, start.value());
        if (!Double.isFinite(start.value()) || !isFinite(start.gradient())) {
            return function.result(false, MSG_NON_FINITE_START);
        }
        if (maxAbs(start.gradient()) <= gradientTolerance) {
            return function.result(true, MSG_CONVERGENCE);
        }

        double[] x = initialPoint.clone();
        try {
            BFGS.minimize(function, memory, x, gradientTolerance, maxIterations);
        } catch (EvaluationBudgetExceeded e) {
            log.debug("Límite de {} evaluaciones alcanzado tras {} iteraciones.", maxEvaluations, function.iterations);
            return function.result(false, MSG_MAX_EVALUATIONS);
        } catch (IllegalArgumentException e) {
            // Smile la lanza cuando la dirección deja de ser de descenso (redondeo)
            log.debug("Búsqueda lineal abortada en iteración {}: {}", function.iterations, e.getMessage());
            return function.result(false, MSG_LINE_SEARCH_FAILED);
        }

        if (function.iterations < maxIterations) {
            return function.result(true, MSG_CONVERGENCE);
        }
        return function.result(false, MSG_MAX_ITERATIONS);
    }

    /**
     * Adaptador del objetivo a la interfaz de Smile. Cuenta evaluaciones y registra
     * cada punto aceptado, que es donde Smile solicita el gradiente.
     */
    private static final class TrackedFunction implements DifferentiableMultivariateFunction {

        private final DifferentiableObjective objective;
        private final int maxEvaluations;
        private final IterationObserver observer;
        private double[] history = new double[16];

        private int evaluations;
        private int gradientRequests;
        private int iterations;
        private double[] bestPoint;
        private double bestValue;

        TrackedFunction(DifferentiableObjective objective, int maxEvaluations, IterationObserver observer) {
            this.objective = objective;
            this.maxEvaluations = maxEvaluations;
            this.observer = observer;
        }

        ObjectiveEvaluation evaluate(double[] x) {
            if (evaluations >= maxEvaluations) {
                throw new EvaluationBudgetExceeded();
            }
            evaluations++;
            return objective.evaluate(x);
        }

        void start(double[] x, double value) {
            history[0] = value;
            bestPoint = x.clone();
            bestValue = value;
        }

        /**
         * Registra un punto aceptado. La primera petición de Smile es el punto inicial.
         */
        void accept(double[] x, double value) {
            if (gradientRequests++ == 0) {
                return;
            }
            iterations++;
            if (iterations == history.length) {
                history = Arrays.copyOf(history, 2 * history.length);
            }
            history[iterations] = value;
            bestPoint = x.clone();
            bestValue = value;
            observer.onIteration(iterations);
        }

        @Override
        public double f(double[] x) {
            return evaluate(x).value();
        }

        @Override
        public double g(double[] x, double[] gradient) {
            ObjectiveEvaluation evaluation = evaluate(x);
            System.arraycopy(evaluation.gradient(), 0, gradient, 0, gradient.length);
            accept(x, evaluation.value());
            return evaluation.value();
        }

        MinimizationResult result(boolean converged, String message) {
            return new MinimizationResult(bestPoint, bestValue, iterations, evaluations, converged, message,
                    Arrays.copyOf(history, iterations + 1));
        }
    }

    /**
     * Interrumpe la minimización de Smile al agotar el presupuesto de evaluaciones.
     */
    private static final class EvaluationBudgetExceeded extends RuntimeException {
        EvaluationBudgetExceeded() {
            super("Presupuesto de evaluaciones agotado", null, false, false);
        }
    }

    private static double maxAbs(double[] a) {
        double max = 0.0;
        for (double v : a) {
            max = Math.max(max, Math.abs(v));
        }
        return max;
    }

    private static boolean isFinite(double[] a) {
        for (double v : a) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }
}
