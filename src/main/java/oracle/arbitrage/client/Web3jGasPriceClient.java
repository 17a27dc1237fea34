package oracle.arbitrage.client;

import lombok.RequiredArgsConstructor;
import org.web3j.protocol.core.methods.response.EthGasPrice;

import java.io.IOException;
import java.math.BigInteger;

@RequiredArgsConstructor
public class Web3jGasPriceClient implements GasPriceClient {
    private final Web3jConnections connections;

    @Override
    public BigInteger gasPrice(String network) throws IOException {
        EthGasPrice response = connections.get(network).ethGasPrice().send();
        if (response.hasError()) {
            throw new IOException("eth_gasPrice failed on " + network + ": " + response.getError().getMessage());
        }
        return response.getGasPrice();
    }
}
