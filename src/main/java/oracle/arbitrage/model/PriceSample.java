package oracle.arbitrage.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class PriceSample {
    String network;
    String asset;
    BigDecimal price;
    // time of the read on our side
    Instant observedAt;
    // time the feed itself last reported
    Instant updatedAt;
    BigInteger roundId;
}
