package photoclinometry.domain.image;

import java.util.Objects;

/**
 * Imagen observada en escala de grises, con brillo normalizado como reflectancia en [0, 1].
 * <p>
 * El albedo se asume uniforme y absorbido por la normalización. La imagen es de solo
 * lectura: {@link #wrap(int, int, double[])} referencia el array del llamador sin
 * copiarlo, y cada evaluación de la función de energía lee directamente de él.
 */
public final class ObservedImage {

    private final int width;
    private final int height;
    private final double[] brightness;

    private ObservedImage(int width, int height, double[] brightness) {
        Objects.requireNonNull(brightness, "El array de brillo no puede ser nulo.");
        // Las diferencias finitas necesitan al menos dos muestras por eje
        if (width < 2 || height < 2) {
            throw new IllegalArgumentException("La imagen debe ser al menos de 2x2 píxeles: " + width + "x" + height);
        }
        if (brightness.length != width * height) {
            throw new IllegalArgumentException("Se esperaban " + (width * height)
                    + " muestras de brillo y se recibieron " + brightness.length);
        }
        this.width = width;
        this.height = height;
        this.brightness = brightness;
    }

    /**
     * Envuelve un array aplanado fila a fila sin copiarlo. El llamador conserva
     * la propiedad y no debe modificarlo mientras dure la reconstrucción.
     */
    public static ObservedImage wrap(int width, int height, double[] brightness) {
        return new ObservedImage(width, height, brightness);
    }

    /**
     * Copia una rejilla {@code grid[y][x]} rectangular.
     */
    public static ObservedImage of(double[][] grid) {
        Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        if (grid.length == 0) {
            throw new IllegalArgumentException("La rejilla no puede estar vacía.");
        }
        int h = grid.length;
        int w = grid[0].length;
        double[] flat = new double[w * h];
        for (int y = 0; y < h; y++) {
            if (grid[y].length != w) {
                throw new IllegalArgumentException("La fila " + y + " no es rectangular.");
            }
            System.arraycopy(grid[y], 0, flat, y * w, w);
        }
        return new ObservedImage(w, h, flat);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return brightness.length;
    }

    /**
     * Brillo en el índice aplanado {@code y * width + x}.
     */
    public double get(int index) {
        return brightness[index];
    }

    public double get(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Píxel (" + x + ", " + y + ") fuera de " + width + "x" + height);
        }
        return brightness[y * width + x];
    }

    public double[] toArray() {
        return brightness.clone();
    }

    @Override
    public String toString() {
        return "ObservedImage{" + width + "x" + height + "}";
    }
}
