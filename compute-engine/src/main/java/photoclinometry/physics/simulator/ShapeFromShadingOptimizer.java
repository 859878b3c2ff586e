package photoclinometry.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import photoclinometry.config.PhotoclinometryConfig;
import photoclinometry.domain.exception.ConfigurationException;
import photoclinometry.domain.illumination.LightVector;
import photoclinometry.domain.image.ObservedImage;
import photoclinometry.domain.reconstruction.ConvergenceReport;
import photoclinometry.domain.surface.HeightField;
import photoclinometry.physics.model.IlluminationGeometry;
import photoclinometry.physics.solver.GradientScheme;
import photoclinometry.physics.solver.IterationObserver;
import photoclinometry.physics.solver.MinimizationResult;
import photoclinometry.physics.solver.impl.LbfgsMinimizer;
import photoclinometry.physics.solver.impl.ShapeFromShadingEnergy;

import java.util.Objects;

/**
 * Driver de optimización: busca el campo de alturas cuya imagen simulada mejor
 * reproduce la observada, minimizando {@link ShapeFromShadingEnergy} con L-BFGS.
 * <p>
 * Síncrono y de un solo hilo. El driver es el único propietario del estado del
 * campo de alturas durante la ejecución y no mantiene estado global entre llamadas.
 */
@Slf4j
public class ShapeFromShadingOptimizer {

    @Getter
    private final LbfgsMinimizer minimizer;
    @Getter
    private final GradientScheme gradientScheme;

    public ShapeFromShadingOptimizer() {
        this(LbfgsMinimizer.builder().build(), GradientScheme.ADJOINT);
    }

    public ShapeFromShadingOptimizer(LbfgsMinimizer minimizer, GradientScheme gradientScheme) {
        this.minimizer = Objects.requireNonNull(minimizer, "El minimizador no puede ser nulo.");
        this.gradientScheme = Objects.requireNonNull(gradientScheme, "El esquema de gradiente no puede ser nulo.");
    }

    /**
     * Superficie inicial según la política configurada.
     *
     * @throws ConfigurationException si la política no es {@code "flat"}.
     */
    public static HeightField initialSurface(PhotoclinometryConfig config, int width, int height) {
        if (!config.usesFlatInitialSurface()) {
            throw new ConfigurationException("Superficie inicial no soportada: '" + config.initialSurface()
                    + "'. La carga de un DEM inicial no está implementada.");
        }
        return HeightField.zeros(width, height);
    }

    public OptimizedSurface optimize(ObservedImage observed, PhotoclinometryConfig config) {
        return optimize(observed, config, new LoggingIterationObserver(config.maxIterations()));
    }

    public OptimizedSurface optimize(ObservedImage observed, PhotoclinometryConfig config, IterationObserver observer) {
        config.validate();
        LightVector light = IlluminationGeometry.lightVector(config.sunAzimuthDeg(), config.sunElevationDeg());
        return optimize(observed, config, light, observer);
    }

    /**
     * Ejecuta la optimización completa.
     *
     * @param observed Imagen observada normalizada.
     * @param config   Configuración de la ejecución (se valida antes de cualquier paso).
     * @param light    Vector de iluminación derivado de la configuración.
     * @param observer Observador de progreso, una llamada por paso aceptado.
     * @return El mejor iterado y su diagnóstico. La no convergencia se refleja en el informe.
     * @throws ConfigurationException si la configuración no es válida.
     */
    public OptimizedSurface optimize(ObservedImage observed, PhotoclinometryConfig config,
                                     LightVector light, IterationObserver observer) {
        Objects.requireNonNull(observed, "La imagen observada no puede ser nula.");
        config.validate();

        int width = observed.getWidth();
        int height = observed.getHeight();
        HeightField initial = initialSurface(config, width, height);

        ShapeFromShadingEnergy energy = new ShapeFromShadingEnergy(
                observed, light, config.regularizationLambda(), gradientScheme);

        log.info("Iniciando optimización {} sobre {} ({}x{}, λ={}, máx. {} iteraciones)",
                minimizer.getName(), energy.getName(), width, height,
                config.regularizationLambda(), config.maxIterations());

        MinimizationResult result = minimizer.minimize(energy, initial.samples(), config.maxIterations(), observer);

        if (!result.converged()) {
            log.warn("ADVERTENCIA: el optimizador no convergió. Motivo: {}", result.message());
        } else {
            log.info("Optimización convergida en {} iteraciones ({} evaluaciones). Coste final: {}",
                    result.iterations(), result.evaluations(), result.value());
        }

        ConvergenceReport report = new ConvergenceReport(result.converged(), result.iterations(),
                result.evaluations(), result.value(), result.message());
        HeightField surface = new HeightField(width, height, result.point());
        return new OptimizedSurface(surface, report, result.valueHistory());
    }
}
