package photoclinometry.physics.model;

import photoclinometry.domain.illumination.LightVector;
import photoclinometry.domain.image.ObservedImage;
import photoclinometry.domain.surface.HeightField;
import photoclinometry.domain.surface.NormalField;

/**
 * Modelo de formación de imagen con reflectancia lambertiana:
 * {@code I = max(0, N · L)}.
 * <p>
 * El albedo se asume 1 (absorbido en la normalización de la imagen observada).
 * Las caras orientadas en contra de la luz producen brillo cero (auto-sombreado).
 * <p>
 * Stateless y Thread-Safe.
 */
public final class LambertianReflectanceModel {

    private LambertianReflectanceModel() {}

    /**
     * Brillo predicho por píxel a partir de un campo de normales.
     */
    public static double[] predict(NormalField normals, LightVector light) {
        double[] east = normals.east();
        double[] north = normals.north();
        double[] up = normals.up();
        double[] image = new double[east.length];
        for (int i = 0; i < image.length; i++) {
            double reflectance = light.dot(east[i], north[i], up[i]);
            image[i] = Math.max(0.0, reflectance);
        }
        return image;
    }

    /**
     * Renderiza el campo de alturas como imagen observada sintética.
     */
    public static ObservedImage predictedImage(HeightField z, LightVector light) {
        double[] image = predict(SurfaceNormalModel.normals(z), light);
        return ObservedImage.wrap(z.width(), z.height(), image);
    }
}
