package photoclinometry.domain.surface;

import java.util.Objects;

/**
 * Campo de normales de superficie, una por píxel, derivado de un {@link HeightField}.
 * <p>
 * Cada normal es unitaria salvo en la rama degenerada en la que la norma del vector
 * sin normalizar cae por debajo del épsilon: ahí se divide por el épsilon y el
 * vector resultante no se vuelve a normalizar.
 */
public record NormalField(int width, int height, double[] east, double[] north, double[] up) {

    public NormalField {
        Objects.requireNonNull(east, "Componente Este nula.");
        Objects.requireNonNull(north, "Componente Norte nula.");
        Objects.requireNonNull(up, "Componente vertical nula.");
        int n = width * height;
        if (east.length != n || north.length != n || up.length != n) {
            throw new IllegalArgumentException("Las tres componentes deben tener " + n + " muestras.");
        }
    }

    /**
     * Devuelve la normal del píxel como {@code [este, norte, arriba]}.
     */
    public double[] normalAt(int x, int y) {
        int i = y * width + x;
        return new double[]{east[i], north[i], up[i]};
    }

    public double normAt(int x, int y) {
        int i = y * width + x;
        return Math.sqrt(east[i] * east[i] + north[i] * north[i] + up[i] * up[i]);
    }
}
