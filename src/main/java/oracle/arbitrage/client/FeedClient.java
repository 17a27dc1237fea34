package oracle.arbitrage.client;

import oracle.arbitrage.model.FeedRoundData;

import java.io.IOException;

/**
 * Read-only query against a network's price feed contract.
 */
public interface FeedClient {

    FeedRoundData latestRoundData(String network, String feedAddress) throws IOException;
}
