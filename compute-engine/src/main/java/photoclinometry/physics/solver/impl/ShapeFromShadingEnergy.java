package photoclinometry.physics.solver.impl;

import lombok.Getter;
import photoclinometry.domain.illumination.LightVector;
import photoclinometry.domain.image.ObservedImage;
import photoclinometry.domain.surface.HeightField;
import photoclinometry.domain.surface.NormalField;
import photoclinometry.physics.i.ISolverComponent;
import photoclinometry.physics.model.FiniteDifference;
import photoclinometry.physics.model.LambertianReflectanceModel;
import photoclinometry.physics.model.SurfaceNormalModel;
import photoclinometry.physics.solver.DifferentiableObjective;
import photoclinometry.physics.solver.EnergyEvaluation;
import photoclinometry.physics.solver.GradientScheme;
import photoclinometry.physics.solver.ObjectiveEvaluation;

import java.util.Objects;

/**
 * Función de energía Shape-from-Shading: coste y gradiente analítico respecto a
 * cada muestra del campo de alturas.
 * <p>
 * {@code Coste = 0.5·Σ(I_obs − I_pred(Z))² + λ·0.5·Σ(∇²Z)²}
 * <ul>
 * <li>Término de brillo: reflectancia lambertiana de las normales de {@code Z}.</li>
 * <li>Término de suavidad: Laplaciano de 5 puntos con frontera de ceros; su gradiente
 *     es el bi-Laplaciano {@code ∇²(∇²Z)}.</li>
 * </ul>
 * Los denominadores se acotan a {@link #DENOMINATOR_FLOOR} para que el gradiente
 * siga siendo finito en zonas degeneradas.
 * <p>
 * La imagen observada se referencia, no se copia. Cada evaluación es pura.
 */
public class ShapeFromShadingEnergy implements DifferentiableObjective, ISolverComponent {

    public static final double DENOMINATOR_FLOOR = 1e-9;

    @Getter
    private final ObservedImage observed;
    @Getter
    private final LightVector light;
    @Getter
    private final double lambda;
    @Getter
    private final GradientScheme gradientScheme;

    private final int width;
    private final int height;

    public ShapeFromShadingEnergy(ObservedImage observed, LightVector light, double lambda) {
        this(observed, light, lambda, GradientScheme.ADJOINT);
    }

    public ShapeFromShadingEnergy(ObservedImage observed, LightVector light, double lambda, GradientScheme gradientScheme) {
        this.observed = Objects.requireNonNull(observed, "La imagen observada no puede ser nula.");
        this.light = Objects.requireNonNull(light, "El vector de luz no puede ser nulo.");
        this.gradientScheme = Objects.requireNonNull(gradientScheme, "El esquema de gradiente no puede ser nulo.");
        this.lambda = lambda;
        this.width = observed.getWidth();
        this.height = observed.getHeight();
    }

    @Override
    public String getName() {
        return "SFS-Lambert-BiLaplace";
    }

    @Override
    public String getDescription() {
        return "Error cuadrático de brillo lambertiano + λ·0.5·Σ(∇²Z)², gradiente " + gradientScheme;
    }

    @Override
    public int dimension() {
        return width * height;
    }

    @Override
    public ObjectiveEvaluation evaluate(double[] x) {
        return costAndGradient(x).toObjectiveEvaluation();
    }

    public EnergyEvaluation costAndGradient(HeightField z) {
        if (z.width() != width || z.height() != height) {
            throw new IllegalArgumentException("El campo de alturas " + z.width() + "x" + z.height()
                    + " no coincide con la imagen " + width + "x" + height);
        }
        return costAndGradient(z.samples());
    }

    /**
     * Evalúa coste y gradiente sobre el campo de alturas aplanado fila a fila.
     */
    public EnergyEvaluation costAndGradient(double[] z) {
        int n = dimension();
        if (z.length != n) {
            throw new IllegalArgumentException("Se esperaban " + n + " alturas y se recibieron " + z.length);
        }

        // 1. Modelo de formación de imagen
        double[] p = FiniteDifference.gradientX(z, width, height);
        double[] q = FiniteDifference.gradientY(z, width, height);
        NormalField normals = SurfaceNormalModel.fromSlopes(p, q, width, height);
        double[] predicted = LambertianReflectanceModel.predict(normals, light);

        // 2. Término de brillo
        double[] error = new double[n];
        double brightnessCost = 0.0;
        for (int i = 0; i < n; i++) {
            error[i] = observed.get(i) - predicted[i];
            brightnessCost += error[i] * error[i];
        }
        brightnessCost *= 0.5;

        // 3. Término de suavidad
        double[] laplacian = FiniteDifference.laplacian(z, width, height);
        double smoothnessCost = 0.0;
        for (double value : laplacian) {
            smoothnessCost += value * value;
        }
        smoothnessCost *= 0.5;

        // 4. Gradiente
        double[] brightnessGradient = gradientScheme == GradientScheme.ADJOINT
                ? adjointBrightnessGradient(p, q, error, predicted)
                : divergenceBrightnessGradient(p, q, error);
        double[] biLaplacian = FiniteDifference.laplacian(laplacian, width, height);

        double[] gradient = new double[n];
        for (int i = 0; i < n; i++) {
            gradient[i] = brightnessGradient[i] + lambda * biLaplacian[i];
        }

        double cost = brightnessCost + lambda * smoothnessCost;
        return new EnergyEvaluation(cost, brightnessCost, smoothnessCost, gradient);
    }

    /**
     * Gradiente exacto del término de brillo.
     * <p>
     * Con {@code r = N·L} y {@code s² = 1+p²+q²}:
     * {@code -∂r/∂p·s³ = Lx(1+q²) − p·q·Ly + p·Lz} y
     * {@code -∂r/∂q·s³ = Ly(1+p²) − p·q·Lx + q·Lz}.
     * En píxeles en sombra ({@code r <= 0}) la reflectancia recortada no depende de Z.
     */
    private double[] adjointBrightnessGradient(double[] p, double[] q, double[] error, double[] predicted) {
        int n = error.length;
        double lx = light.east();
        double ly = light.north();
        double lz = light.up();

        double[] weightP = new double[n];
        double[] weightQ = new double[n];
        for (int i = 0; i < n; i++) {
            if (predicted[i] <= 0.0) continue;
            double pi = p[i];
            double qi = q[i];
            double denom = Math.max(Math.pow(1.0 + pi * pi + qi * qi, 1.5), DENOMINATOR_FLOOR);
            weightP[i] = error[i] * (lx * (1.0 + qi * qi) - pi * qi * ly + pi * lz) / denom;
            weightQ[i] = error[i] * (ly * (1.0 + pi * pi) - pi * qi * lx + qi * lz) / denom;
        }

        double[] fromP = FiniteDifference.gradientXTranspose(weightP, width, height);
        double[] fromQ = FiniteDifference.gradientYTranspose(weightQ, width, height);
        double[] gradient = new double[n];
        for (int i = 0; i < n; i++) {
            gradient[i] = fromP[i] + fromQ[i];
        }
        return gradient;
    }

    /**
     * Aproximación por divergencia negativa del campo {@code (dE/dp, dE/dq)}.
     */
    private double[] divergenceBrightnessGradient(double[] p, double[] q, double[] error) {
        int n = error.length;
        double lx = light.east();
        double ly = light.north();
        double lz = light.up();

        double[] dEdp = new double[n];
        double[] dEdq = new double[n];
        for (int i = 0; i < n; i++) {
            double denom = Math.max(Math.pow(1.0 + p[i] * p[i] + q[i] * q[i], 1.5), DENOMINATOR_FLOOR);
            dEdp[i] = error[i] * (lx - lz * p[i]) / denom;
            dEdq[i] = error[i] * (ly - lz * q[i]) / denom;
        }

        double[] dx = FiniteDifference.gradientX(dEdp, width, height);
        double[] dy = FiniteDifference.gradientY(dEdq, width, height);
        double[] gradient = new double[n];
        for (int i = 0; i < n; i++) {
            gradient[i] = -(dx[i] + dy[i]);
        }
        return gradient;
    }
}
