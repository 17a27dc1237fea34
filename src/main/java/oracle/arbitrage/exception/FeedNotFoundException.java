package oracle.arbitrage.exception;

/**
 * The network or the asset feed is not present in the endpoint registry.
 */
public class FeedNotFoundException extends OracleException {
    private final String asset;

    public FeedNotFoundException(String network, String asset) {
        super(network, "No price feed configured for " + asset);
        this.asset = asset;
    }

    public String getAsset() {
        return asset;
    }
}
