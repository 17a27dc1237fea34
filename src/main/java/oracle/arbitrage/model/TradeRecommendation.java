package oracle.arbitrage.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

@Value
@Builder
public class TradeRecommendation {
    String asset;
    String buyNetwork;
    String sellNetwork;
    BigDecimal buyPrice;
    BigDecimal sellPrice;
    BigDecimal priceDifference;
    Map<String, BigDecimal> estimatedCosts;
    BigDecimal potentialProfit;
    // networks whose cost was missing and counted as zero
    Set<String> unpricedNetworks;

    public boolean isProfitable() {
        return potentialProfit.signum() > 0;
    }
}
