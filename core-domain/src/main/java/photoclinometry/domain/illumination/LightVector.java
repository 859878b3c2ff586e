package photoclinometry.domain.illumination;

/**
 * Vector unitario que apunta hacia la fuente de luz, en el marco Este/Norte/Arriba.
 *
 * @param east  Componente X (Este).
 * @param north Componente Y (Norte).
 * @param up    Componente Z (vertical).
 */
public record LightVector(double east, double north, double up) {

    public double norm() {
        return Math.sqrt(east * east + north * north + up * up);
    }

    public double dot(double nx, double ny, double nz) {
        return east * nx + north * ny + up * nz;
    }

    public double[] toArray() {
        return new double[]{east, north, up};
    }
}
