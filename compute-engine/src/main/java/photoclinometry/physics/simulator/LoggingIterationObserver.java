package photoclinometry.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import photoclinometry.physics.solver.IterationObserver;

/**
 * Informa del progreso de la optimización por el log: cada iteración a nivel DEBUG
 * y cada 10% del presupuesto de iteraciones a nivel INFO.
 */
@Slf4j
public class LoggingIterationObserver implements IterationObserver {

    private final int maxIterations;
    private final int reportEvery;

    public LoggingIterationObserver(int maxIterations) {
        this.maxIterations = maxIterations;
        this.reportEvery = Math.max(1, maxIterations / 10);
    }

    @Override
    public void onIteration(int iteration) {
        if (iteration % reportEvery == 0 || iteration == maxIterations) {
            log.info("Optimización L-BFGS: iteración {}/{} ({}%)", iteration, maxIterations,
                    (100 * iteration) / maxIterations);
        } else {
            log.debug("Optimización L-BFGS: iteración {}/{}", iteration, maxIterations);
        }
    }
}
