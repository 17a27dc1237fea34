package oracle.arbitrage.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Raw answer of an aggregator feed: {@code latestRoundData()} plus {@code decimals()}.
 */
@Value
@Builder
public class FeedRoundData {
    BigInteger roundId;
    BigInteger answer;
    BigInteger updatedAt;
    int decimals;
}
