package oracle.arbitrage.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.model.FeedRoundData;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.abi.datatypes.generated.Uint80;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads Chainlink aggregator feeds with plain {@code eth_call}s.
 * Feed decimals never change, so they are fetched once per feed.
 */
@Slf4j
@RequiredArgsConstructor
public class ChainlinkFeedClient implements FeedClient {
    static final Function LATEST_ROUND_DATA = new Function(
            "latestRoundData",
            Collections.emptyList(),
            List.<TypeReference<?>>of(
                    new TypeReference<Uint80>() {},   // roundId
                    new TypeReference<Int256>() {},   // answer
                    new TypeReference<Uint256>() {},  // startedAt
                    new TypeReference<Uint256>() {},  // updatedAt
                    new TypeReference<Uint80>() {}    // answeredInRound
            ));

    static final Function DECIMALS = new Function(
            "decimals",
            Collections.emptyList(),
            List.<TypeReference<?>>of(new TypeReference<Uint8>() {}));

    private final Web3jConnections connections;
    private final Map<String, Integer> decimalsCache = new ConcurrentHashMap<>();

    @Override
    public FeedRoundData latestRoundData(String network, String feedAddress) throws IOException {
        int decimals = decimals(network, feedAddress);

        List<Type> values = call(network, feedAddress, LATEST_ROUND_DATA);
        if (values.size() != LATEST_ROUND_DATA.getOutputParameters().size()) {
            throw new IOException("Unexpected latestRoundData response from " + feedAddress + ": " + values);
        }

        FeedRoundData round = FeedRoundData.builder()
                .roundId((BigInteger) values.get(0).getValue())
                .answer((BigInteger) values.get(1).getValue())
                .updatedAt((BigInteger) values.get(3).getValue())
                .decimals(decimals)
                .build();
        log.debug("Feed {} on {} answered {}", feedAddress, network, round);
        return round;
    }

    private int decimals(String network, String feedAddress) throws IOException {
        String key = network + ":" + feedAddress.toLowerCase();
        Integer cached = decimalsCache.get(key);
        if (cached != null) {
            return cached;
        }
        List<Type> values = call(network, feedAddress, DECIMALS);
        if (values.isEmpty()) {
            throw new IOException("Empty decimals() response from " + feedAddress);
        }
        int decimals = ((BigInteger) values.get(0).getValue()).intValueExact();
        decimalsCache.put(key, decimals);
        return decimals;
    }

    private List<Type> call(String network, String contractAddress, Function function) throws IOException {
        EthCall response = connections.get(network)
                .ethCall(Transaction.createEthCallTransaction(null, contractAddress, FunctionEncoder.encode(function)),
                        DefaultBlockParameterName.LATEST)
                .send();

        if (response.hasError()) {
            throw new IOException(function.getName() + "() failed on " + contractAddress + ": "
                    + response.getError().getMessage());
        }
        if (response.getValue() == null || response.getValue().equals("0x")) {
            throw new IOException("Empty " + function.getName() + "() response from " + contractAddress);
        }
        return FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
    }
}
