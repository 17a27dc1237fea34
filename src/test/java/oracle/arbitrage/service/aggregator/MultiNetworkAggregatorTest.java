package oracle.arbitrage.service.aggregator;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import oracle.arbitrage.client.FeedClient;
import oracle.arbitrage.model.FeedRoundData;
import oracle.arbitrage.model.PriceSet;
import oracle.arbitrage.registry.NetworkEndpointRegistry;
import oracle.arbitrage.service.priceservice.PriceFeedReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static oracle.arbitrage.TestFixtures.CLOCK;
import static oracle.arbitrage.TestFixtures.ETH;
import static oracle.arbitrage.TestFixtures.NOW;
import static oracle.arbitrage.TestFixtures.registry;
import static org.junit.jupiter.api.Assertions.*;

class MultiNetworkAggregatorTest {

    private ExecutorService executor;
    private Scheduler scheduler;
    private SimpleMeterRegistry meterRegistry;
    private NetworkEndpointRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        scheduler = Schedulers.fromExecutorService(executor);
        meterRegistry = new SimpleMeterRegistry();
        registry = registry("mainnet", "optimism", "polygon");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldCollectOneSamplePerNetwork() {
        MultiNetworkAggregator aggregator = aggregator(fixedPrices(Map.of(
                "mainnet", "3000", "optimism", "3010", "polygon", "2990")), Duration.ofSeconds(1));

        PriceSet set = aggregator.collectPrices(ETH).block(Duration.ofSeconds(5));

        assertNotNull(set);
        assertEquals(ETH, set.getAsset());
        assertEquals(Set.of("mainnet", "optimism", "polygon"), set.networks());
        assertEquals(0, new BigDecimal("3010").compareTo(set.priceOf("optimism").orElseThrow()));
    }

    @Test
    void shouldDropFailingNetworkAndKeepOthers() {
        FeedClient client = (network, address) -> {
            if (network.equals("polygon")) {
                throw new IOException("503 Service Unavailable");
            }
            return answer("3000");
        };

        PriceSet set = aggregator(client, Duration.ofSeconds(1)).collectPrices(ETH).block(Duration.ofSeconds(5));

        assertEquals(Set.of("mainnet", "optimism"), set.networks());
        assertEquals(1.0, meterRegistry.counter("oracle.samples.dropped",
                "network", "polygon", "reason", "unavailable").count());
    }

    @Test
    void timedOutNetworkDoesNotBlockOthers() {
        FeedClient client = (network, address) -> {
            if (network.equals("optimism")) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return answer("3000");
        };
        MultiNetworkAggregator aggregator = aggregator(client, Duration.ofMillis(200));

        StepVerifier.create(aggregator.collectPrices(ETH))
                .assertNext(set -> assertEquals(Set.of("mainnet", "polygon"), set.networks()))
                .expectComplete()
                .verify(Duration.ofSeconds(2));

        assertEquals(1.0, meterRegistry.counter("oracle.samples.dropped",
                "network", "optimism", "reason", "timeout").count());
    }

    @Test
    void shouldReturnEmptySetWhenAllNetworksFail() {
        FeedClient client = (network, address) -> {
            throw new IOException("down");
        };

        PriceSet set = aggregator(client, Duration.ofSeconds(1)).collectPrices(ETH).block(Duration.ofSeconds(5));

        assertNotNull(set);
        assertTrue(set.isEmpty());
    }

    @Test
    void shouldSkipNetworksWithoutFeedForAsset() {
        PriceSet set = aggregator(fixedPrices(Map.of("mainnet", "1", "optimism", "1", "polygon", "1")),
                Duration.ofSeconds(1)).collectPrices("BTC_USD").block(Duration.ofSeconds(5));

        assertTrue(set.isEmpty());
        assertEquals("BTC_USD", set.getAsset());
    }

    @Test
    void shouldRecordReadTimings() {
        aggregator(fixedPrices(Map.of("mainnet", "1", "optimism", "1", "polygon", "1")), Duration.ofSeconds(1))
                .collectPrices(ETH).block(Duration.ofSeconds(5));

        assertEquals(1, meterRegistry.get("oracle.feed.read").tag("network", "mainnet").timer().count());
    }

    private MultiNetworkAggregator aggregator(FeedClient client, Duration timeout) {
        PriceFeedReader reader = new PriceFeedReader(registry, client, null, CLOCK);
        return new MultiNetworkAggregator(registry, reader, scheduler, timeout, meterRegistry);
    }

    private static FeedClient fixedPrices(Map<String, String> prices) {
        return (network, address) -> answer(prices.get(network));
    }

    private static FeedRoundData answer(String price) {
        return FeedRoundData.builder()
                .roundId(BigInteger.ONE)
                .answer(new BigInteger(price))
                .updatedAt(BigInteger.valueOf(NOW.getEpochSecond()))
                .decimals(0)
                .build();
    }
}
