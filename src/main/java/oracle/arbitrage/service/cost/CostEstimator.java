package oracle.arbitrage.service.cost;

import oracle.arbitrage.model.CostEstimate;
import reactor.core.publisher.Mono;

/**
 * Supplies a fresh per-network execution cost each time a deviation is triggered.
 */
public interface CostEstimator {

    Mono<CostEstimate> getCosts();
}
