package oracle.arbitrage.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Prices of one asset collected across networks in a single round, keyed by network.
 * May hold fewer networks than are registered when some reads failed.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PriceSet {
    private final String asset;
    private final Map<String, PriceSample> samples;

    public PriceSet(String asset, Map<String, PriceSample> samples) {
        this.asset = Objects.requireNonNull(asset, "asset");
        Map<String, PriceSample> sorted = new TreeMap<>();
        samples.forEach((network, sample) -> {
            if (!asset.equals(sample.getAsset())) {
                throw new IllegalArgumentException(
                        "Sample for " + sample.getAsset() + " on " + network + " does not belong to " + asset);
            }
            sorted.put(network, sample);
        });
        this.samples = Collections.unmodifiableMap(sorted);
    }

    public static PriceSet of(String asset, Collection<PriceSample> samples) {
        Map<String, PriceSample> byNetwork = new TreeMap<>();
        for (PriceSample sample : samples) {
            if (byNetwork.putIfAbsent(sample.getNetwork(), sample) != null) {
                throw new IllegalArgumentException("Duplicate sample for network " + sample.getNetwork());
            }
        }
        return new PriceSet(asset, byNetwork);
    }

    public static PriceSet empty(String asset) {
        return new PriceSet(asset, Collections.emptyMap());
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public Set<String> networks() {
        return samples.keySet();
    }

    public Optional<BigDecimal> priceOf(String network) {
        return Optional.ofNullable(samples.get(network)).map(PriceSample::getPrice);
    }

    public PriceSet filter(Predicate<PriceSample> predicate) {
        Map<String, PriceSample> kept = new TreeMap<>();
        samples.forEach((network, sample) -> {
            if (predicate.test(sample)) {
                kept.put(network, sample);
            }
        });
        return new PriceSet(asset, kept);
    }
}
