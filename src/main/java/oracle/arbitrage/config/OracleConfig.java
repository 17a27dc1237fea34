package oracle.arbitrage.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import oracle.arbitrage.client.FeedClient;
import oracle.arbitrage.client.GasPriceClient;
import oracle.arbitrage.registry.NetworkEndpointRegistry;
import oracle.arbitrage.service.OracleService;
import oracle.arbitrage.service.aggregator.MultiNetworkAggregator;
import oracle.arbitrage.service.cost.CostEstimator;
import oracle.arbitrage.service.cost.GasPriceCostEstimator;
import oracle.arbitrage.service.cost.StaticCostEstimator;
import oracle.arbitrage.service.deviation.DeviationDetector;
import oracle.arbitrage.service.monitor.OpportunityMonitor;
import oracle.arbitrage.service.priceservice.PriceFeedReader;
import oracle.arbitrage.service.recommendation.RecommendationEngine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Wires the oracle pipeline from {@link OracleProperties}.
 */
@Configuration
public class OracleConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NetworkEndpointRegistry networkEndpointRegistry(OracleProperties props) {
        return NetworkEndpointRegistry.fromProperties(props);
    }

    @Bean
    public PriceFeedReader priceFeedReader(NetworkEndpointRegistry registry, FeedClient feedClient,
                                           OracleProperties props, Clock clock) {
        return new PriceFeedReader(registry, feedClient, props.getMaxFeedAge(), clock);
    }

    @Bean
    public MultiNetworkAggregator multiNetworkAggregator(NetworkEndpointRegistry registry, PriceFeedReader reader,
                                                         Scheduler priceFeedScheduler, OracleProperties props,
                                                         MeterRegistry meterRegistry) {
        return new MultiNetworkAggregator(registry, reader, priceFeedScheduler, props.getCallTimeout(), meterRegistry);
    }

    @Bean
    public DeviationDetector deviationDetector(Clock clock) {
        return new DeviationDetector(clock);
    }

    @Bean
    public RecommendationEngine recommendationEngine(OracleProperties props) {
        return new RecommendationEngine(props.getMissingCostPolicy());
    }

    @Bean
    @ConditionalOnProperty(prefix = "oracle.cost", name = "mode", havingValue = "static", matchIfMissing = true)
    public CostEstimator staticCostEstimator(NetworkEndpointRegistry registry) {
        return new StaticCostEstimator(registry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "oracle.cost", name = "mode", havingValue = "gas-price")
    public CostEstimator gasPriceCostEstimator(NetworkEndpointRegistry registry, GasPriceClient gasPriceClient,
                                               PriceFeedReader reader, Scheduler priceFeedScheduler,
                                               OracleProperties props) {
        return new GasPriceCostEstimator(registry, gasPriceClient, reader, priceFeedScheduler, props.getCallTimeout());
    }

    @Bean
    public OracleService oracleService(MultiNetworkAggregator aggregator, DeviationDetector detector,
                                       RecommendationEngine recommendationEngine, CostEstimator costEstimator,
                                       NetworkEndpointRegistry registry, OracleProperties props, Clock clock) {
        return new OracleService(aggregator, detector, recommendationEngine, costEstimator,
                props.getThresholdPercent(), props.getCost().getTimeout(), monitoredAssets(props, registry), clock);
    }

    @Bean
    public OpportunityMonitor opportunityMonitor(OracleService oracleService, OracleProperties props,
                                                 NetworkEndpointRegistry registry,
                                                 Counter roundsCompletedCounter,
                                                 Counter deviationsTriggeredCounter,
                                                 Counter roundFailuresCounter) {
        return new OpportunityMonitor(
                oracleService,
                List.copyOf(monitoredAssets(props, registry)),
                props.getPollInterval(),
                props.getMonitor().isEnabled(),
                Schedulers.parallel(),
                roundsCompletedCounter,
                deviationsTriggeredCounter,
                roundFailuresCounter);
    }

    // oracle.assets when set, otherwise every asset with a feed somewhere
    private static Set<String> monitoredAssets(OracleProperties props, NetworkEndpointRegistry registry) {
        return props.getAssets().isEmpty()
                ? registry.assets()
                : new LinkedHashSet<>(props.getAssets());
    }
}
