package oracle.arbitrage.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class NetworkEndpoint {
    String id;
    String rpcUrl;
    long chainId;
    Map<String, String> feeds;      // asset -> feed contract address
    String nativeAsset;
    long gasLimit;
    BigDecimal staticCost;
}
