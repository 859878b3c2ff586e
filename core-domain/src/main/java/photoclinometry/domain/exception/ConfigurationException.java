package photoclinometry.domain.exception;

/**
 * Error fatal de configuración. Se lanza antes de ejecutar cualquier paso del
 * optimizador (ej: política de superficie inicial no soportada).
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
