package photoclinometry.physics.i;

/**
 * Contrato base para cualquier componente numérico del sistema.
 * Permite tratar a funciones de energía y optimizadores de forma polimórfica
 * para tareas de logging, identificación y depuración.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "L-BFGS", "SFS-Lambert-BiLaplace").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
