package oracle.arbitrage.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-network execution cost, expressed in the same unit as the asset price.
 */
@ToString
@EqualsAndHashCode
public final class CostEstimate {
    private static final CostEstimate EMPTY = new CostEstimate(Collections.emptyMap());

    private final Map<String, BigDecimal> costs;

    public CostEstimate(Map<String, BigDecimal> costs) {
        Map<String, BigDecimal> copy = new TreeMap<>();
        costs.forEach((network, cost) -> {
            if (cost == null || cost.signum() < 0) {
                throw new IllegalArgumentException("Cost for " + network + " must be non-negative, got " + cost);
            }
            copy.put(network, cost);
        });
        this.costs = Collections.unmodifiableMap(copy);
    }

    public static CostEstimate empty() {
        return EMPTY;
    }

    public Optional<BigDecimal> costFor(String network) {
        return Optional.ofNullable(costs.get(network));
    }

    public Map<String, BigDecimal> asMap() {
        return costs;
    }
}
