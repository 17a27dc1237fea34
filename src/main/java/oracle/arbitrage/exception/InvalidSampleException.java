package oracle.arbitrage.exception;

public class InvalidSampleException extends OracleException {

    public InvalidSampleException(String network, String message) {
        super(network, message);
    }
}
