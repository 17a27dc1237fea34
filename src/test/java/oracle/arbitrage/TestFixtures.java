package oracle.arbitrage;

import oracle.arbitrage.model.NetworkEndpoint;
import oracle.arbitrage.model.PriceSample;
import oracle.arbitrage.model.PriceSet;
import oracle.arbitrage.registry.NetworkEndpointRegistry;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TestFixtures {
    public static final String ETH = "ETH_USD";
    public static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private TestFixtures() {
    }

    public static PriceSample sample(String network, String price) {
        return PriceSample.builder()
                .network(network)
                .asset(ETH)
                .price(new BigDecimal(price))
                .observedAt(NOW)
                .updatedAt(NOW.minusSeconds(30))
                .build();
    }

    /**
     * Alternating network/price pairs, e.g. {@code priceSet("A", "100", "B", "103")}.
     */
    public static PriceSet priceSet(String... networkPrices) {
        List<PriceSample> samples = new ArrayList<>();
        for (int i = 0; i < networkPrices.length; i += 2) {
            samples.add(sample(networkPrices[i], networkPrices[i + 1]));
        }
        return PriceSet.of(ETH, samples);
    }

    public static NetworkEndpoint endpoint(String id, Map<String, String> feeds) {
        return NetworkEndpoint.builder()
                .id(id)
                .rpcUrl("http://localhost:8545/" + id)
                .chainId(id.hashCode())
                .feeds(feeds)
                .gasLimit(200_000)
                .build();
    }

    /**
     * Registry where every named network has an ETH_USD feed.
     */
    public static NetworkEndpointRegistry registry(String... networks) {
        List<NetworkEndpoint> endpoints = new ArrayList<>();
        for (String network : networks) {
            Map<String, String> feeds = new LinkedHashMap<>();
            feeds.put(ETH, "0xfeed" + network);
            endpoints.add(endpoint(network, feeds));
        }
        return new NetworkEndpointRegistry(endpoints);
    }
}
