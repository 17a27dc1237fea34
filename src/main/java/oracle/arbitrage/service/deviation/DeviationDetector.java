package oracle.arbitrage.service.deviation;

import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.exception.InvalidSampleException;
import oracle.arbitrage.model.DeviationReport;
import oracle.arbitrage.model.DeviationStatus;
import oracle.arbitrage.model.PriceSample;
import oracle.arbitrage.model.PriceSet;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Measures the spread between the highest and lowest price of a round.
 * Stateless; the same input always yields the same report.
 */
@Slf4j
public class DeviationDetector {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Clock clock;

    public DeviationDetector(Clock clock) {
        this.clock = clock;
    }

    public DeviationReport detectDeviation(PriceSet priceSet, BigDecimal thresholdPercent) {
        Objects.requireNonNull(thresholdPercent, "thresholdPercent");
        String asset = priceSet.getAsset();

        List<String> warnings = new ArrayList<>();
        PriceSet valid = priceSet.filter(sample -> {
            if (sample.getPrice() != null && sample.getPrice().signum() > 0) {
                return true;
            }
            InvalidSampleException invalid = new InvalidSampleException(sample.getNetwork(),
                    "Non-positive price " + sample.getPrice() + " for " + asset + " dropped");
            log.warn(invalid.getMessage());
            warnings.add(invalid.getMessage());
            return false;
        });

        DeviationReport.DeviationReportBuilder report = DeviationReport.builder()
                .asset(asset)
                .thresholdPercent(thresholdPercent)
                .priceSet(valid)
                .warnings(warnings)
                .evaluatedAt(clock.instant());

        if (valid.size() < 2) {
            log.debug("Insufficient data for {}: {} valid sample(s)", asset, valid.size());
            return report
                    .deviationPercent(BigDecimal.ZERO)
                    .exceedsThreshold(false)
                    .status(DeviationStatus.INSUFFICIENT_DATA)
                    .build();
        }

        BigDecimal max = valid.getSamples().values().stream().map(PriceSample::getPrice).max(BigDecimal::compareTo).orElseThrow();
        BigDecimal min = valid.getSamples().values().stream().map(PriceSample::getPrice).min(BigDecimal::compareTo).orElseThrow();

        BigDecimal deviationPercent = max.subtract(min)
                .divide(min, MathContext.DECIMAL128)
                .multiply(HUNDRED);
        boolean exceeds = deviationPercent.compareTo(thresholdPercent) > 0;

        return report
                .deviationPercent(deviationPercent)
                .exceedsThreshold(exceeds)
                .status(exceeds ? DeviationStatus.THRESHOLD_EXCEEDED : DeviationStatus.WITHIN_THRESHOLD)
                .build();
    }
}
