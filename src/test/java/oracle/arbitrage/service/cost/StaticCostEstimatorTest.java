package oracle.arbitrage.service.cost;

import oracle.arbitrage.model.CostEstimate;
import oracle.arbitrage.registry.NetworkEndpointRegistry;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static oracle.arbitrage.TestFixtures.ETH;
import static oracle.arbitrage.TestFixtures.endpoint;
import static org.junit.jupiter.api.Assertions.*;

class StaticCostEstimatorTest {

    @Test
    void shouldReturnConfiguredCostsAndSkipUnpricedNetworks() {
        NetworkEndpointRegistry registry = new NetworkEndpointRegistry(List.of(
                endpoint("mainnet", Map.of(ETH, "0x1")).toBuilder().staticCost(new BigDecimal("6.00")).build(),
                endpoint("polygon", Map.of(ETH, "0x2")).toBuilder().staticCost(new BigDecimal("0.02")).build(),
                endpoint("optimism", Map.of(ETH, "0x3"))));

        StepVerifier.create(new StaticCostEstimator(registry).getCosts())
                .assertNext(estimate -> {
                    assertEquals(Optional.of(new BigDecimal("6.00")), estimate.costFor("mainnet"));
                    assertEquals(Optional.of(new BigDecimal("0.02")), estimate.costFor("polygon"));
                    assertTrue(estimate.costFor("optimism").isEmpty());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectNegativeCost() {
        NetworkEndpointRegistry registry = new NetworkEndpointRegistry(List.of(
                endpoint("mainnet", Map.of(ETH, "0x1")).toBuilder().staticCost(new BigDecimal("-1")).build()));

        assertThrows(IllegalArgumentException.class, () -> new StaticCostEstimator(registry));
    }

    @Test
    void emptyEstimateHasNoCosts() {
        assertTrue(CostEstimate.empty().asMap().isEmpty());
    }
}
