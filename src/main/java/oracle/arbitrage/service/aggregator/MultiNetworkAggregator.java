package oracle.arbitrage.service.aggregator;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.config.metrics.TimerUtils;
import oracle.arbitrage.exception.FeedNotFoundException;
import oracle.arbitrage.exception.InvalidSampleException;
import oracle.arbitrage.exception.SourceUnavailableException;
import oracle.arbitrage.model.PriceSample;
import oracle.arbitrage.model.PriceSet;
import oracle.arbitrage.registry.NetworkEndpointRegistry;
import oracle.arbitrage.service.priceservice.PriceFeedReader;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Fans a price read out to every registered network and collects whatever comes back.
 * A failing or slow network is dropped from the round, never the round itself.
 */
@Slf4j
public class MultiNetworkAggregator {
    private final NetworkEndpointRegistry registry;
    private final PriceFeedReader reader;
    private final Scheduler scheduler;
    private final Duration callTimeout;
    private final MeterRegistry meterRegistry;

    public MultiNetworkAggregator(
            NetworkEndpointRegistry registry,
            PriceFeedReader reader,
            Scheduler scheduler,
            Duration callTimeout,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.reader = reader;
        this.scheduler = scheduler;
        this.callTimeout = callTimeout;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Completes once every network read has succeeded, failed or timed out.
     * Emits an empty set when nothing succeeded.
     */
    public Mono<PriceSet> collectPrices(String asset) {
        return Flux.fromIterable(registry.networks())
                .flatMap(network -> readPrice(network, asset))
                .collectList()
                .map(samples -> PriceSet.of(asset, samples))
                .doOnNext(priceSet -> log.debug("Collected {} of {} prices for {}: {}",
                        priceSet.size(), registry.networks().size(), asset, priceSet.networks()));
    }

    private Mono<PriceSample> readPrice(String network, String asset) {
        return TimerUtils.timedMono(
                        () -> Mono.fromCallable(() -> reader.readPrice(network, asset))
                                .subscribeOn(scheduler)
                                .timeout(callTimeout),
                        meterRegistry, "oracle.feed.read", "network", network)
                .onErrorResume(error -> {
                    dropSample(network, asset, error);
                    return Mono.empty();
                });
    }

    private void dropSample(String network, String asset, Throwable error) {
        String reason = reasonOf(error);
        meterRegistry.counter("oracle.samples.dropped", "network", network, "reason", reason).increment();
        if (error instanceof TimeoutException) {
            log.warn("Price read for {} on {} timed out after {}", asset, network, callTimeout);
        } else if (error instanceof FeedNotFoundException) {
            log.debug("Skipping {} on {}: {}", asset, network, error.getMessage());
        } else {
            log.warn("Dropping {} sample from {} ({}): {}", asset, network, reason, error.getMessage());
        }
    }

    private static String reasonOf(Throwable error) {
        if (error instanceof TimeoutException) {
            return "timeout";
        } else if (error instanceof FeedNotFoundException) {
            return "not_found";
        } else if (error instanceof SourceUnavailableException) {
            return "unavailable";
        } else if (error instanceof InvalidSampleException) {
            return "invalid";
        }
        return "error";
    }
}
