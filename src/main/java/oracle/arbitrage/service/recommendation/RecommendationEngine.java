package oracle.arbitrage.service.recommendation;

import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.model.CostEstimate;
import oracle.arbitrage.model.DeviationReport;
import oracle.arbitrage.model.PriceSample;
import oracle.arbitrage.model.TradeRecommendation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ranks every buy-low/sell-high network pair of a report by profit net of execution cost.
 */
@Slf4j
public class RecommendationEngine {
    static final Comparator<TradeRecommendation> RANKING =
            Comparator.comparing(TradeRecommendation::getPotentialProfit, Comparator.reverseOrder())
                    .thenComparing(TradeRecommendation::getBuyNetwork)
                    .thenComparing(TradeRecommendation::getSellNetwork);

    private final MissingCostPolicy missingCostPolicy;

    public RecommendationEngine(MissingCostPolicy missingCostPolicy) {
        this.missingCostPolicy = missingCostPolicy;
    }

    /**
     * Recommendations ordered by potential profit, best first.
     * The threshold gate is the caller's concern; a report below threshold is still ranked.
     */
    public List<TradeRecommendation> recommend(DeviationReport report, CostEstimate costEstimate) {
        if (!report.isExceedsThreshold()) {
            log.debug("Ranking {} below threshold ({}%)", report.getAsset(), report.getDeviationPercent());
        }

        List<PriceSample> samples = new ArrayList<>(report.getPriceSet().getSamples().values());
        List<TradeRecommendation> recommendations = new ArrayList<>();

        for (int i = 0; i < samples.size(); i++) {
            for (int j = i + 1; j < samples.size(); j++) {
                PriceSample first = samples.get(i);
                PriceSample second = samples.get(j);
                boolean firstBuys = buysFirst(first, second);
                PriceSample buy = firstBuys ? first : second;
                PriceSample sell = firstBuys ? second : first;

                Optional<BigDecimal> buyCost = costEstimate.costFor(buy.getNetwork());
                Optional<BigDecimal> sellCost = costEstimate.costFor(sell.getNetwork());
                Set<String> unpriced = new LinkedHashSet<>();
                if (buyCost.isEmpty()) {
                    unpriced.add(buy.getNetwork());
                }
                if (sellCost.isEmpty()) {
                    unpriced.add(sell.getNetwork());
                }
                if (!unpriced.isEmpty() && missingCostPolicy == MissingCostPolicy.EXCLUDE) {
                    log.debug("Skipping {} -> {}: no cost estimate for {}", buy.getNetwork(), sell.getNetwork(), unpriced);
                    continue;
                }

                Map<String, BigDecimal> costs = new LinkedHashMap<>();
                costs.put(buy.getNetwork(), buyCost.orElse(BigDecimal.ZERO));
                costs.put(sell.getNetwork(), sellCost.orElse(BigDecimal.ZERO));

                BigDecimal priceDifference = sell.getPrice().subtract(buy.getPrice());
                BigDecimal potentialProfit = priceDifference
                        .subtract(costs.get(buy.getNetwork()).add(costs.get(sell.getNetwork())));

                recommendations.add(TradeRecommendation.builder()
                        .asset(report.getAsset())
                        .buyNetwork(buy.getNetwork())
                        .sellNetwork(sell.getNetwork())
                        .buyPrice(buy.getPrice())
                        .sellPrice(sell.getPrice())
                        .priceDifference(priceDifference)
                        .estimatedCosts(Map.copyOf(costs))
                        .potentialProfit(potentialProfit)
                        .unpricedNetworks(Set.copyOf(unpriced))
                        .build());
            }
        }

        recommendations.sort(RANKING);
        return List.copyOf(recommendations);
    }

    // lower price buys; on equal prices the network id decides
    private static boolean buysFirst(PriceSample first, PriceSample second) {
        int byPrice = first.getPrice().compareTo(second.getPrice());
        return byPrice < 0 || (byPrice == 0 && first.getNetwork().compareTo(second.getNetwork()) <= 0);
    }
}
