package photoclinometry.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import photoclinometry.physics.solver.DifferentiableObjective;
import photoclinometry.physics.solver.IterationObserver;
import photoclinometry.physics.solver.MinimizationResult;
import photoclinometry.physics.solver.ObjectiveEvaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@Slf4j
class LbfgsMinimizerTest {

    private final LbfgsMinimizer minimizer = LbfgsMinimizer.builder().build();

    /**
     * Función de Rosenbrock en 2D, mínimo en (1, 1).
     */
    private static final DifferentiableObjective ROSENBROCK = new DifferentiableObjective() {
        @Override
        public int dimension() {
            return 2;
        }

        @Override
        public ObjectiveEvaluation evaluate(double[] x) {
            double a = 1.0 - x[0];
            double b = x[1] - x[0] * x[0];
            double value = a * a + 100.0 * b * b;
            double[] gradient = {
                    -2.0 * a - 400.0 * x[0] * b,
                    200.0 * b
            };
            return new ObjectiveEvaluation(value, gradient);
        }
    };

    /**
     * Cuadrática separable mal condicionada: 0.5·Σ aᵢ(xᵢ − cᵢ)² con aᵢ = i+1.
     */
    private static DifferentiableObjective quadratic(double[] center) {
        return new DifferentiableObjective() {
            @Override
            public int dimension() {
                return center.length;
            }

            @Override
            public ObjectiveEvaluation evaluate(double[] x) {
                double value = 0.0;
                double[] gradient = new double[x.length];
                for (int i = 0; i < x.length; i++) {
                    double d = x[i] - center[i];
                    value += 0.5 * (i + 1) * d * d;
                    gradient[i] = (i + 1) * d;
                }
                return new ObjectiveEvaluation(value, gradient);
            }
        };
    }

    @Test
    @DisplayName("Rosenbrock: converge al mínimo (1, 1) desde el punto clásico (-1.2, 1)")
    void minimize_rosenbrock_shouldConverge() {
        MinimizationResult result = minimizer.minimize(ROSENBROCK, new double[]{-1.2, 1.0}, 500, IterationObserver.NONE);

        log.info("Rosenbrock: {} iteraciones, {} evaluaciones, motivo '{}'",
                result.iterations(), result.evaluations(), result.message());

        assertThat(result.converged()).isTrue();
        assertThat(result.point()[0]).isCloseTo(1.0, within(5e-3));
        assertThat(result.point()[1]).isCloseTo(1.0, within(1e-2));
        assertThat(result.value()).isLessThan(1e-5);
    }

    @Test
    @DisplayName("Cuadrática: converge al centro, notifica cada paso y el historial de coste es no creciente")
    void minimize_quadratic_shouldConvergeMonotonically() {
        double[] center = {3.0, -1.0, 0.5, 2.0, -4.0, 1.5, 0.0, -2.5, 1.0, 0.25};
        IterationObserver observer = mock(IterationObserver.class);

        MinimizationResult result = minimizer.minimize(quadratic(center), new double[center.length], 200, observer);

        assertThat(result.converged()).isTrue();
        assertThat(result.iterations()).isPositive().isLessThan(200);
        verify(observer, times(result.iterations())).onIteration(anyInt());
        verify(observer).onIteration(result.iterations());
        for (int i = 0; i < center.length; i++) {
            assertThat(result.point()[i]).isCloseTo(center[i], within(1e-4));
        }

        double[] history = result.valueHistory();
        assertThat(history).hasSize(result.iterations() + 1);
        assertThat(history[history.length - 1]).isEqualTo(result.value());
        for (int k = 1; k < history.length; k++) {
            assertThat(history[k]).as("Coste en iteración %d", k).isLessThanOrEqualTo(history[k - 1]);
        }
    }

    @Test
    @DisplayName("Límite de iteraciones: devuelve el mejor iterado sin convergencia ni excepción")
    void minimize_iterationCap_shouldReportNonConvergence() {
        IterationObserver observer = mock(IterationObserver.class);

        MinimizationResult result = minimizer.minimize(ROSENBROCK, new double[]{-1.2, 1.0}, 3, observer);

        assertThat(result.converged()).isFalse();
        assertThat(result.message()).isEqualTo(LbfgsMinimizer.MSG_MAX_ITERATIONS);
        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.valueHistory()).hasSize(4);
        assertThat(result.value()).isLessThan(ROSENBROCK.evaluate(new double[]{-1.2, 1.0}).value());

        // Una notificación por paso aceptado, índices desde 1
        verify(observer, times(3)).onIteration(anyInt());
        InOrder order = inOrder(observer);
        order.verify(observer).onIteration(1);
        order.verify(observer).onIteration(2);
        order.verify(observer).onIteration(3);
    }

    @Test
    @DisplayName("Punto inicial ya óptimo: cero iteraciones y sin llamadas al observador")
    void minimize_startAtOptimum_shouldStopImmediately() {
        double[] center = {1.0, 2.0, 3.0};
        IterationObserver observer = mock(IterationObserver.class);

        MinimizationResult result = minimizer.minimize(quadratic(center), center.clone(), 50, observer);

        assertThat(result.converged()).isTrue();
        assertThat(result.iterations()).isZero();
        assertThat(result.evaluations()).isEqualTo(1);
        assertThat(result.message()).isEqualTo(LbfgsMinimizer.MSG_CONVERGENCE);
        verifyNoInteractions(observer);
    }

    @Test
    @DisplayName("Coste no finito en el punto inicial: terminación anómala sin iterar")
    void minimize_nonFiniteStart_shouldAbort() {
        DifferentiableObjective broken = new DifferentiableObjective() {
            @Override
            public int dimension() {
                return 2;
            }

            @Override
            public ObjectiveEvaluation evaluate(double[] x) {
                return new ObjectiveEvaluation(Double.NaN, new double[]{0.0, 0.0});
            }
        };

        MinimizationResult result = minimizer.minimize(broken, new double[2], 10, IterationObserver.NONE);

        assertThat(result.converged()).isFalse();
        assertThat(result.iterations()).isZero();
        assertThat(result.message()).isEqualTo(LbfgsMinimizer.MSG_NON_FINITE_START);
    }

    @Test
    @DisplayName("El punto inicial del llamador no se modifica")
    void minimize_shouldNotMutateInitialPoint() {
        double[] start = {-1.2, 1.0};

        minimizer.minimize(ROSENBROCK, start, 20, IterationObserver.NONE);

        assertThat(start).containsExactly(-1.2, 1.0);
    }

    @Test
    @DisplayName("Argumentos inválidos: dimensión incoherente o límite de iteraciones no positivo")
    void minimize_invalidArguments_shouldThrow() {
        assertThatThrownBy(() -> minimizer.minimize(ROSENBROCK, new double[3], 10, IterationObserver.NONE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dimensión");
        assertThatThrownBy(() -> minimizer.minimize(ROSENBROCK, new double[2], 0, IterationObserver.NONE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Builder: valores por defecto y configuración personalizada")
    void builder_shouldExposeDefaultsAndOverrides() {
        assertThat(minimizer.getMemory()).isEqualTo(10);
        assertThat(minimizer.getGradientTolerance()).isEqualTo(1e-5);
        assertThat(minimizer.getMaxEvaluations()).isEqualTo(15000);

        LbfgsMinimizer custom = LbfgsMinimizer.builder().memory(3).maxEvaluations(5).build();
        MinimizationResult result = custom.minimize(ROSENBROCK, new double[]{-1.2, 1.0}, 1000, IterationObserver.NONE);

        assertThat(custom.getMemory()).isEqualTo(3);
        assertThat(result.converged()).isFalse();
        assertThat(result.message()).isEqualTo(LbfgsMinimizer.MSG_MAX_EVALUATIONS);
        assertThat(result.evaluations()).isEqualTo(5);
        assertThat(result.valueHistory()).hasSize(result.iterations() + 1);
    }
}
