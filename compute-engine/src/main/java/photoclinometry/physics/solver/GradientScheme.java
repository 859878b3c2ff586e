package photoclinometry.physics.solver;

/**
 * Esquema de cálculo del gradiente del término de brillo.
 */
public enum GradientScheme {
    /**
     * Derivada exacta del coste discreto: traspuesta del operador de diferencias
     * finitas aplicada a las sensibilidades completas de la reflectancia.
     * Coincide con la derivada numérica del coste.
     */
    ADJOINT,

    /**
     * Aproximación por divergencia {@code -(∂x(dE/dp) + ∂y(dE/dq))} con
     * {@code dE/dp = E·(Lx − Lz·p)/(1+p²+q²)^1.5}. Se conserva para reproducir
     * los resultados del flujo de referencia.
     */
    DIVERGENCE
}
