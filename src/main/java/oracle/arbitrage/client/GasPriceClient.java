package oracle.arbitrage.client;

import java.io.IOException;
import java.math.BigInteger;

public interface GasPriceClient {

    /**
     * Current gas price of the network, in wei.
     */
    BigInteger gasPrice(String network) throws IOException;
}
