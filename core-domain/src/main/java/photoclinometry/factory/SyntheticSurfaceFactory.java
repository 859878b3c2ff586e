package photoclinometry.factory;

import photoclinometry.domain.illumination.LightVector;
import photoclinometry.domain.image.ObservedImage;
import photoclinometry.domain.surface.HeightField;
import photoclinometry.physics.model.LambertianReflectanceModel;

import java.util.Random;

/**
 * Fábrica de superficies sintéticas y de sus imágenes renderizadas.
 * <p>
 * Sirve para construir escenas de validación con solución conocida: se genera
 * un relieve, se ilumina con el modelo lambertiano y la imagen resultante se
 * entrega al reconstructor.
 */
public class SyntheticSurfaceFactory {

    /**
     * Relieve gaussiano centrado en la rejilla.
     *
     * @param amplitude Altura máxima del relieve (adimensional, en unidades de píxel).
     * @param sigma     Desviación típica en píxeles.
     */
    public static HeightField gaussianBump(int width, int height, double amplitude, double sigma) {
        double cx = (width - 1) / 2.0;
        double cy = (height - 1) / 2.0;
        double twoSigma2 = 2.0 * sigma * sigma;
        double[] z = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double r2 = (x - cx) * (x - cx) + (y - cy) * (y - cy);
                z[y * width + x] = amplitude * Math.exp(-r2 / twoSigma2);
            }
        }
        return new HeightField(width, height, z);
    }

    /**
     * Plano inclinado {@code Z = slopeX·x + slopeY·y}.
     */
    public static HeightField tiltedPlane(int width, int height, double slopeX, double slopeY) {
        double[] z = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                z[y * width + x] = slopeX * x + slopeY * y;
            }
        }
        return new HeightField(width, height, z);
    }

    /**
     * Relieve aleatorio uniforme en {@code [-amplitude, amplitude]}, reproducible por semilla.
     */
    public static HeightField randomSurface(int width, int height, double amplitude, long seed) {
        Random random = new Random(seed);
        double[] z = new double[width * height];
        for (int i = 0; i < z.length; i++) {
            z[i] = amplitude * (2.0 * random.nextDouble() - 1.0);
        }
        return new HeightField(width, height, z);
    }

    /**
     * Imagen que observaría la cámara sobre la superficie dada.
     */
    public static ObservedImage render(HeightField surface, LightVector light) {
        return LambertianReflectanceModel.predictedImage(surface, light);
    }
}
