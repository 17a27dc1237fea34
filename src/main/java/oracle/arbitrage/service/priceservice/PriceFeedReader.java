package oracle.arbitrage.service.priceservice;

import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.client.FeedClient;
import oracle.arbitrage.exception.FeedNotFoundException;
import oracle.arbitrage.exception.InvalidSampleException;
import oracle.arbitrage.exception.OracleException;
import oracle.arbitrage.exception.SourceUnavailableException;
import oracle.arbitrage.model.FeedRoundData;
import oracle.arbitrage.model.PriceSample;
import oracle.arbitrage.registry.NetworkEndpointRegistry;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * Reads one asset price from one network and scales it to a plain decimal.
 * Does not retry; a failed read is reported to the caller as an {@link OracleException}.
 */
@Slf4j
public class PriceFeedReader {
    private final NetworkEndpointRegistry registry;
    private final FeedClient feedClient;
    private final Duration maxFeedAge;
    private final Clock clock;

    public PriceFeedReader(NetworkEndpointRegistry registry, FeedClient feedClient, Duration maxFeedAge, Clock clock) {
        this.registry = registry;
        this.feedClient = feedClient;
        this.maxFeedAge = maxFeedAge;
        this.clock = clock;
    }

    public PriceSample readPrice(String network, String asset) {
        String feedAddress = registry.feedAddress(network, asset)
                .orElseThrow(() -> new FeedNotFoundException(network, asset));

        FeedRoundData round;
        try {
            round = feedClient.latestRoundData(network, feedAddress);
        } catch (OracleException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new SourceUnavailableException(network,
                    "Price feed " + feedAddress + " for " + asset + " unreachable: " + e.getMessage(), e);
        }

        if (round == null || round.getAnswer() == null || round.getUpdatedAt() == null || round.getDecimals() < 0) {
            throw new SourceUnavailableException(network, "Malformed answer from feed " + feedAddress + ": " + round);
        }

        Instant now = clock.instant();
        Instant updatedAt = updatedAt(network, feedAddress, round);
        if (maxFeedAge != null && Duration.between(updatedAt, now).compareTo(maxFeedAge) > 0) {
            throw new InvalidSampleException(network,
                    "Feed " + feedAddress + " for " + asset + " is stale, last update " + updatedAt);
        }

        BigDecimal price = new BigDecimal(round.getAnswer()).movePointLeft(round.getDecimals());
        log.debug("Price for {} on {}: {}", asset, network, price);

        return PriceSample.builder()
                .network(network)
                .asset(asset)
                .price(price)
                .observedAt(now)
                .updatedAt(updatedAt)
                .roundId(round.getRoundId())
                .build();
    }

    // updatedAt is a uint256 on chain; anything outside the Instant range is a broken answer
    private static Instant updatedAt(String network, String feedAddress, FeedRoundData round) {
        try {
            return Instant.ofEpochSecond(round.getUpdatedAt().longValueExact());
        } catch (ArithmeticException | DateTimeException e) {
            throw new SourceUnavailableException(network,
                    "Malformed updatedAt " + round.getUpdatedAt() + " from feed " + feedAddress, e);
        }
    }
}
