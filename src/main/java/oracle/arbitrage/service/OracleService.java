package oracle.arbitrage.service;

import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.model.CostEstimate;
import oracle.arbitrage.model.DeviationReport;
import oracle.arbitrage.model.OpportunityRound;
import oracle.arbitrage.model.TradeRecommendation;
import oracle.arbitrage.service.aggregator.MultiNetworkAggregator;
import oracle.arbitrage.service.cost.CostEstimator;
import oracle.arbitrage.service.deviation.DeviationDetector;
import oracle.arbitrage.service.recommendation.RecommendationEngine;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Aggregation, detection and ranking for one asset, on demand.
 */
@Slf4j
public class OracleService {
    private final MultiNetworkAggregator aggregator;
    private final DeviationDetector detector;
    private final RecommendationEngine recommendationEngine;
    private final CostEstimator costEstimator;
    private final BigDecimal thresholdPercent;
    private final Duration costTimeout;
    private final Set<String> assets;
    private final Clock clock;

    public OracleService(
            MultiNetworkAggregator aggregator,
            DeviationDetector detector,
            RecommendationEngine recommendationEngine,
            CostEstimator costEstimator,
            BigDecimal thresholdPercent,
            Duration costTimeout,
            Set<String> assets,
            Clock clock) {
        this.aggregator = aggregator;
        this.detector = detector;
        this.recommendationEngine = recommendationEngine;
        this.costEstimator = costEstimator;
        this.thresholdPercent = thresholdPercent;
        this.costTimeout = costTimeout;
        this.assets = Set.copyOf(assets);
        this.clock = clock;
    }

    public boolean supportsAsset(String asset) {
        return assets.contains(asset);
    }

    public Set<String> getAssets() {
        return assets;
    }

    @Observed(name = "oracle.deviation", contextualName = "current-deviation")
    public Mono<DeviationReport> getCurrentDeviation(String asset) {
        return aggregator.collectPrices(asset)
                .map(priceSet -> detector.detectDeviation(priceSet, thresholdPercent));
    }

    /**
     * One full evaluation: deviation, then, only when the threshold is exceeded,
     * a fresh cost estimate and the ranked recommendations.
     */
    @Observed(name = "oracle.evaluate", contextualName = "evaluate-opportunities")
    public Mono<OpportunityRound> evaluate(String asset) {
        return getCurrentDeviation(asset)
                .flatMap(report -> {
                    if (report.isInsufficientData()) {
                        log.info("Insufficient data for {}: {} valid sample(s)", asset, report.getPriceSet().size());
                        return Mono.just(round(report, List.of(), null));
                    }
                    if (!report.isExceedsThreshold()) {
                        log.debug("{} deviation {}% within threshold {}%",
                                asset, report.getDeviationPercent(), report.getThresholdPercent());
                        return Mono.just(round(report, List.of(), null));
                    }
                    return fetchCosts()
                            .map(costs -> round(report, recommendationEngine.recommend(report, costs), costs));
                });
    }

    private Mono<CostEstimate> fetchCosts() {
        return costEstimator.getCosts()
                .timeout(costTimeout)
                .defaultIfEmpty(CostEstimate.empty())
                .onErrorResume(e -> {
                    log.warn("Cost estimate unavailable, ranking without costs: {}", e.getMessage());
                    return Mono.just(CostEstimate.empty());
                });
    }

    private OpportunityRound round(DeviationReport report, List<TradeRecommendation> recommendations, CostEstimate costs) {
        return OpportunityRound.builder()
                .asset(report.getAsset())
                .deviationReport(report)
                .recommendations(recommendations)
                .costEstimate(costs)
                .completedAt(clock.instant())
                .build();
    }
}
