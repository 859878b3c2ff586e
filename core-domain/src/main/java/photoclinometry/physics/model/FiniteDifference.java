package photoclinometry.physics.model;

/**
 * Operadores en diferencias finitas sobre rejillas aplanadas fila a fila
 * ({@code index = y * width + x}).
 * <p>
 * Convención de derivada: diferencias centrales en el interior y diferencias
 * laterales de primer orden en los bordes. El Laplaciano usa la plantilla de
 * 5 puntos con relleno de ceros fuera de la rejilla.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class FiniteDifference {

    private FiniteDifference() {}

    /**
     * Pendiente en X (columnas), {@code p = dZ/dx}.
     */
    public static double[] gradientX(double[] f, int width, int height) {
        requireShape(f, width, height);
        requireAxis("X", width);
        double[] out = new double[f.length];
        for (int y = 0; y < height; y++) {
            differentiate(f, out, y * width, 1, width);
        }
        return out;
    }

    /**
     * Pendiente en Y (filas), {@code q = dZ/dy}.
     */
    public static double[] gradientY(double[] f, int width, int height) {
        requireShape(f, width, height);
        requireAxis("Y", height);
        double[] out = new double[f.length];
        for (int x = 0; x < width; x++) {
            differentiate(f, out, x, width, height);
        }
        return out;
    }

    /**
     * Aplica la traspuesta del operador {@link #gradientX}: {@code Dxᵀ·w}.
     * Es la derivada exacta de {@code Σ w·(Dx·f)} respecto a {@code f}.
     */
    public static double[] gradientXTranspose(double[] w, int width, int height) {
        requireShape(w, width, height);
        requireAxis("X", width);
        double[] out = new double[w.length];
        for (int y = 0; y < height; y++) {
            differentiateTranspose(w, out, y * width, 1, width);
        }
        return out;
    }

    /**
     * Aplica la traspuesta del operador {@link #gradientY}: {@code Dyᵀ·w}.
     */
    public static double[] gradientYTranspose(double[] w, int width, int height) {
        requireShape(w, width, height);
        requireAxis("Y", height);
        double[] out = new double[w.length];
        for (int x = 0; x < width; x++) {
            differentiateTranspose(w, out, x, width, height);
        }
        return out;
    }

    /**
     * Laplaciano discreto de 5 puntos con frontera de ceros. El operador es simétrico,
     * por lo que aplicarlo dos veces da el gradiente exacto de {@code 0.5·Σ(∇²f)²}.
     */
    public static double[] laplacian(double[] f, int width, int height) {
        requireShape(f, width, height);
        double[] out = new double[f.length];
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                int i = row + x;
                double left = x > 0 ? f[i - 1] : 0.0;
                double right = x < width - 1 ? f[i + 1] : 0.0;
                double up = y > 0 ? f[i - width] : 0.0;
                double down = y < height - 1 ? f[i + width] : 0.0;
                out[i] = left + right + up + down - 4.0 * f[i];
            }
        }
        return out;
    }

    // --- Kernels 1D sobre una línea con desplazamiento y paso ---

    private static void differentiate(double[] f, double[] out, int offset, int stride, int n) {
        int last = offset + (n - 1) * stride;
        out[offset] = f[offset + stride] - f[offset];
        for (int k = 1; k < n - 1; k++) {
            int i = offset + k * stride;
            out[i] = 0.5 * (f[i + stride] - f[i - stride]);
        }
        out[last] = f[last] - f[last - stride];
    }

    private static void differentiateTranspose(double[] w, double[] out, int offset, int stride, int n) {
        int last = offset + (n - 1) * stride;
        // Fila 0 del operador: f[1] - f[0]
        out[offset] -= w[offset];
        out[offset + stride] += w[offset];
        for (int k = 1; k < n - 1; k++) {
            int i = offset + k * stride;
            double half = 0.5 * w[i];
            out[i + stride] += half;
            out[i - stride] -= half;
        }
        // Fila n-1: f[n-1] - f[n-2]
        out[last] += w[last];
        out[last - stride] -= w[last];
    }

    private static void requireShape(double[] f, int width, int height) {
        if (f.length != width * height) {
            throw new IllegalArgumentException("El array tiene " + f.length + " muestras, se esperaban "
                    + width + "x" + height);
        }
    }

    private static void requireAxis(String axis, int n) {
        if (n < 2) {
            throw new IllegalArgumentException("El eje " + axis + " necesita al menos 2 muestras para derivar: " + n);
        }
    }
}
