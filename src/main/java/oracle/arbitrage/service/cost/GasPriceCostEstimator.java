package oracle.arbitrage.service.cost;

import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.client.GasPriceClient;
import oracle.arbitrage.exception.InvalidSampleException;
import oracle.arbitrage.model.CostEstimate;
import oracle.arbitrage.model.NetworkEndpoint;
import oracle.arbitrage.model.PriceSample;
import oracle.arbitrage.registry.NetworkEndpointRegistry;
import oracle.arbitrage.service.priceservice.PriceFeedReader;
import org.web3j.utils.Convert;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;

/**
 * Live cost of one transaction per network: gas price x gas limit, converted to the quote
 * currency through the network's native asset feed. Networks without a native asset feed,
 * or whose reads fail, are left out of the estimate.
 */
@Slf4j
public class GasPriceCostEstimator implements CostEstimator {
    private final NetworkEndpointRegistry registry;
    private final GasPriceClient gasPriceClient;
    private final PriceFeedReader reader;
    private final Scheduler scheduler;
    private final Duration callTimeout;

    public GasPriceCostEstimator(
            NetworkEndpointRegistry registry,
            GasPriceClient gasPriceClient,
            PriceFeedReader reader,
            Scheduler scheduler,
            Duration callTimeout) {
        this.registry = registry;
        this.gasPriceClient = gasPriceClient;
        this.reader = reader;
        this.scheduler = scheduler;
        this.callTimeout = callTimeout;
    }

    @Override
    public Mono<CostEstimate> getCosts() {
        return Flux.fromIterable(registry.endpoints())
                .filter(endpoint -> endpoint.getNativeAsset() != null)
                .flatMap(endpoint -> estimate(endpoint)
                        .map(cost -> Map.entry(endpoint.getId(), cost))
                        .onErrorResume(e -> {
                            log.warn("No cost estimate for {}: {}", endpoint.getId(), e.getMessage());
                            return Mono.empty();
                        }))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue)
                .map(CostEstimate::new)
                .doOnNext(estimate -> log.debug("Gas cost estimate: {}", estimate));
    }

    private Mono<BigDecimal> estimate(NetworkEndpoint endpoint) {
        return Mono.fromCallable(() -> {
                    BigInteger gasPriceWei = gasPriceClient.gasPrice(endpoint.getId());
                    PriceSample nativePrice = reader.readPrice(endpoint.getId(), endpoint.getNativeAsset());
                    if (nativePrice.getPrice().signum() <= 0) {
                        throw new InvalidSampleException(endpoint.getId(),
                                "Non-positive native price " + nativePrice.getPrice() + " for " + endpoint.getNativeAsset());
                    }
                    BigDecimal feeWei = new BigDecimal(gasPriceWei).multiply(BigDecimal.valueOf(endpoint.getGasLimit()));
                    return Convert.fromWei(feeWei, Convert.Unit.ETHER).multiply(nativePrice.getPrice());
                })
                .subscribeOn(scheduler)
                .timeout(callTimeout);
    }
}
