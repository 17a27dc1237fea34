package oracle.arbitrage.exception;

/**
 * Connection failure, timeout or malformed response from a network's RPC endpoint.
 */
public class SourceUnavailableException extends OracleException {

    public SourceUnavailableException(String network, String message) {
        super(network, message);
    }

    public SourceUnavailableException(String network, String message, Throwable cause) {
        super(network, message, cause);
    }
}
