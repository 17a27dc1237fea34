package oracle.arbitrage.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of evaluating one asset in a monitoring round.
 */
@Value
@Builder
public class OpportunityRound {
    String asset;
    DeviationReport deviationReport;
    List<TradeRecommendation> recommendations;
    CostEstimate costEstimate;      // null unless the deviation was triggered
    Instant completedAt;

    public boolean isTriggered() {
        return deviationReport.isExceedsThreshold();
    }

    public Optional<TradeRecommendation> bestRecommendation() {
        return recommendations.isEmpty() ? Optional.empty() : Optional.of(recommendations.get(0));
    }
}
