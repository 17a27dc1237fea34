package oracle.arbitrage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class DeviationReport {
    String asset;
    BigDecimal deviationPercent;
    BigDecimal thresholdPercent;
    /** Only the samples that took part in the comparison. */
    PriceSet priceSet;
    boolean exceedsThreshold;
    DeviationStatus status;
    @Singular
    List<String> warnings;
    Instant evaluatedAt;

    public boolean isInsufficientData() {
        return status == DeviationStatus.INSUFFICIENT_DATA;
    }
}
