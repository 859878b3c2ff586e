package photoclinometry.physics.model;

import photoclinometry.domain.surface.HeightField;
import photoclinometry.domain.surface.NormalField;

/**
 * Calcula las normales de superficie a partir del campo de alturas.
 * <p>
 * Normal sin normalizar: {@code (-p, -q, 1)}, con {@code p} y {@code q} las pendientes
 * en X e Y según {@link FiniteDifference}. El divisor de normalización se acota
 * inferiormente a {@link #EPSILON}; en esa rama degenerada la normal no se vuelve
 * a normalizar.
 * <p>
 * Stateless y Thread-Safe. Se recalcula en cada evaluación.
 */
public final class SurfaceNormalModel {

    public static final double EPSILON = 1e-9;

    private SurfaceNormalModel() {}

    public static NormalField normals(HeightField z) {
        return normals(z.samples(), z.width(), z.height());
    }

    public static NormalField normals(double[] z, int width, int height) {
        double[] p = FiniteDifference.gradientX(z, width, height);
        double[] q = FiniteDifference.gradientY(z, width, height);
        return fromSlopes(p, q, width, height);
    }

    /**
     * Construye las normales a partir de pendientes ya calculadas.
     *
     * @param p Pendiente en X por píxel.
     * @param q Pendiente en Y por píxel.
     */
    public static NormalField fromSlopes(double[] p, double[] q, int width, int height) {
        int n = width * height;
        if (p.length != n || q.length != n) {
            throw new IllegalArgumentException("Las pendientes deben tener " + n + " muestras.");
        }
        double[] east = new double[n];
        double[] north = new double[n];
        double[] up = new double[n];

        for (int i = 0; i < n; i++) {
            double nx = -p[i];
            double ny = -q[i];
            double norm = Math.sqrt(nx * nx + ny * ny + 1.0);
            double safeNorm = Math.max(norm, EPSILON);

            east[i] = nx / safeNorm;
            north[i] = ny / safeNorm;
            up[i] = 1.0 / safeNorm;
        }
        return new NormalField(width, height, east, north, up);
    }
}
