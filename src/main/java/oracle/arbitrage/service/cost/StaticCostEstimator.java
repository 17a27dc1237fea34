package oracle.arbitrage.service.cost;

import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.model.CostEstimate;
import oracle.arbitrage.model.NetworkEndpoint;
import oracle.arbitrage.registry.NetworkEndpointRegistry;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed per-network costs taken from {@code oracle.networks.<id>.static-cost}.
 */
@Slf4j
public class StaticCostEstimator implements CostEstimator {
    private final CostEstimate costs;

    public StaticCostEstimator(NetworkEndpointRegistry registry) {
        Map<String, BigDecimal> byNetwork = new LinkedHashMap<>();
        for (NetworkEndpoint endpoint : registry.endpoints()) {
            if (endpoint.getStaticCost() != null) {
                byNetwork.put(endpoint.getId(), endpoint.getStaticCost());
            }
        }
        this.costs = new CostEstimate(byNetwork);
        log.info("Static cost estimates: {}", byNetwork);
    }

    @Override
    public Mono<CostEstimate> getCosts() {
        return Mono.just(costs);
    }
}
