package photoclinometry.domain.surface;

import org.apache.commons.math3.stat.StatUtils;

import java.util.Arrays;
import java.util.Objects;

/**
 * Campo de alturas {@code Z[y][x]}: una muestra de elevación por píxel de la imagen.
 * <p>
 * Las muestras se almacenan aplanadas en orden fila a fila ({@code index = y * width + x}),
 * el mismo orden que usa el optimizador para su vector de estado.
 * <p>
 * Objeto de valor inmutable: el constructor copia el array recibido y
 * {@link #samples()} devuelve una copia.
 *
 * @param width   Número de columnas (eje X, Este).
 * @param height  Número de filas (eje Y).
 * @param samples Alturas aplanadas (adimensionales o en metros según el contexto).
 */
public record HeightField(int width, int height, double[] samples) {

    public HeightField {
        Objects.requireNonNull(samples, "El array de alturas no puede ser nulo.");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensiones inválidas: " + width + "x" + height);
        }
        if (samples.length != width * height) {
            throw new IllegalArgumentException("Se esperaban " + (width * height)
                    + " muestras para " + width + "x" + height + " y se recibieron " + samples.length);
        }
        samples = samples.clone();
    }

    /**
     * Superficie plana de altura cero.
     */
    public static HeightField zeros(int width, int height) {
        return new HeightField(width, height, new double[width * height]);
    }

    /**
     * Construye el campo a partir de una rejilla {@code grid[y][x]} rectangular.
     */
    public static HeightField of(double[][] grid) {
        Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        if (grid.length == 0 || grid[0].length == 0) {
            throw new IllegalArgumentException("La rejilla no puede estar vacía.");
        }
        int h = grid.length;
        int w = grid[0].length;
        double[] flat = new double[w * h];
        for (int y = 0; y < h; y++) {
            if (grid[y].length != w) {
                throw new IllegalArgumentException("La fila " + y + " tiene " + grid[y].length + " columnas, se esperaban " + w);
            }
            System.arraycopy(grid[y], 0, flat, y * w, w);
        }
        return new HeightField(w, h, flat);
    }

    /**
     * Devuelve una copia de las muestras aplanadas.
     */
    @Override
    public double[] samples() {
        return samples.clone();
    }

    public int size() {
        return samples.length;
    }

    public double get(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Píxel (" + x + ", " + y + ") fuera de " + width + "x" + height);
        }
        return samples[y * width + x];
    }

    public double[][] toGrid() {
        double[][] grid = new double[height][width];
        for (int y = 0; y < height; y++) {
            System.arraycopy(samples, y * width, grid[y], 0, width);
        }
        return grid;
    }

    public double min() {
        return StatUtils.min(samples);
    }

    public double max() {
        return StatUtils.max(samples);
    }

    public double mean() {
        return StatUtils.mean(samples);
    }

    // equals y hashCode sobre el contenido del array, no sobre su identidad.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HeightField other = (HeightField) o;
        return width == other.width && height == other.height && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(width, height);
        result = 31 * result + Arrays.hashCode(samples);
        return result;
    }

    @Override
    public String toString() {
        return "HeightField{" + width + "x" + height + ", min=" + min() + ", max=" + max() + "}";
    }
}
