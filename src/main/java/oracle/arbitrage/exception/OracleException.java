package oracle.arbitrage.exception;

/**
 * Base class for failures tied to a single network.
 */
public class OracleException extends RuntimeException {
    private final String network;

    public OracleException(String network, String message) {
        super("[" + network + "] " + message);
        this.network = network;
    }

    public OracleException(String network, String message, Throwable cause) {
        super("[" + network + "] " + message, cause);
        this.network = network;
    }

    public String getNetwork() {
        return network;
    }
}
