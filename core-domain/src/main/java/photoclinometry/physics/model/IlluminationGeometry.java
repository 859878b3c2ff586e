package photoclinometry.physics.model;

import photoclinometry.domain.illumination.LightVector;

/**
 * Geometría de iluminación: convierte el azimut y la elevación solares en un
 * vector de luz unitario en el marco +X Este, +Y Norte, +Z Arriba.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class IlluminationGeometry {

    private IlluminationGeometry() {}

    /**
     * @param azimuthDeg   Azimut en grados, sentido horario desde el Norte.
     * @param elevationDeg Elevación en grados sobre el horizonte.
     * @return Vector unitario hacia el Sol.
     */
    public static LightVector lightVector(double azimuthDeg, double elevationDeg) {
        double az = Math.toRadians(azimuthDeg);
        double el = Math.toRadians(elevationDeg);

        double z = Math.sin(el);
        double horizontal = Math.cos(el);
        double x = horizontal * Math.sin(az); // Este
        double y = horizontal * Math.cos(az); // Norte

        double norm = Math.sqrt(x * x + y * y + z * z);
        return new LightVector(x / norm, y / norm, z / norm);
    }
}
