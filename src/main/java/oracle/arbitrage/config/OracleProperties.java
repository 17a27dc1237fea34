package oracle.arbitrage.config;

import lombok.Data;
import oracle.arbitrage.service.recommendation.MissingCostPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "oracle")
public class OracleProperties {
    private List<String> assets = new ArrayList<>();
    private BigDecimal thresholdPercent = new BigDecimal("0.5");
    private Duration pollInterval = Duration.ofSeconds(60);
    private Duration callTimeout = Duration.ofSeconds(3);
    private Duration maxFeedAge;                 // null disables the staleness check
    private int readerThreads = 8;
    private MissingCostPolicy missingCostPolicy = MissingCostPolicy.ASSUME_ZERO;
    private Monitor monitor = new Monitor();
    private Cost cost = new Cost();
    private Map<String, Network> networks = new LinkedHashMap<>();

    @Data
    public static class Network {
        private String rpcUrl;
        private long chainId;
        private Map<String, String> feeds = new LinkedHashMap<>();   // asset -> feed address
        private String nativeAsset;
        private long gasLimit = 200_000;
        private BigDecimal staticCost;
    }

    @Data
    public static class Monitor {
        private boolean enabled = true;
    }

    @Data
    public static class Cost {
        private String mode = "static";          // static | gas-price
        private Duration timeout = Duration.ofSeconds(5);
    }
}
