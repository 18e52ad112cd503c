package dao.relay.oracle.model;

/**
 * Invalid configuration or a contract that does not match the expected ABI. Fatal at startup.
 */
public class OracleConfigurationException extends RuntimeException {

    public OracleConfigurationException(String message) {
        super(message);
    }

    public OracleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
