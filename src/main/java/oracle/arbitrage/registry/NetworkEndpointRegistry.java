package oracle.arbitrage.registry;

import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.config.OracleProperties;
import oracle.arbitrage.exception.FeedNotFoundException;
import oracle.arbitrage.model.NetworkEndpoint;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static mapping of network id to connection parameters and per-asset feed addresses.
 * Immutable once built.
 */
@Slf4j
public final class NetworkEndpointRegistry {
    private final Map<String, NetworkEndpoint> endpoints;

    public NetworkEndpointRegistry(Collection<NetworkEndpoint> endpoints) {
        if (endpoints.isEmpty()) {
            throw new IllegalStateException("Network endpoint registry is empty: configure at least one oracle.networks entry");
        }
        Map<String, NetworkEndpoint> byId = new LinkedHashMap<>();
        for (NetworkEndpoint endpoint : endpoints) {
            if (endpoint.getRpcUrl() == null || endpoint.getRpcUrl().isBlank()) {
                throw new IllegalStateException("Network " + endpoint.getId() + " has no rpc-url");
            }
            if (byId.put(endpoint.getId(), endpoint) != null) {
                throw new IllegalStateException("Network " + endpoint.getId() + " is configured twice");
            }
        }
        this.endpoints = Collections.unmodifiableMap(byId);
    }

    public static NetworkEndpointRegistry fromProperties(OracleProperties props) {
        List<NetworkEndpoint> endpoints = props.getNetworks().entrySet().stream()
                .map(e -> NetworkEndpoint.builder()
                        .id(e.getKey())
                        .rpcUrl(e.getValue().getRpcUrl())
                        .chainId(e.getValue().getChainId())
                        .feeds(Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue().getFeeds())))
                        .nativeAsset(e.getValue().getNativeAsset())
                        .gasLimit(e.getValue().getGasLimit())
                        .staticCost(e.getValue().getStaticCost())
                        .build())
                .toList();
        NetworkEndpointRegistry registry = new NetworkEndpointRegistry(endpoints);
        log.info("Network endpoint registry initialized for networks: {}", registry.networks());
        return registry;
    }

    public Set<String> networks() {
        return endpoints.keySet();
    }

    public Collection<NetworkEndpoint> endpoints() {
        return endpoints.values();
    }

    public NetworkEndpoint endpoint(String network) {
        NetworkEndpoint endpoint = endpoints.get(network);
        if (endpoint == null) {
            throw new FeedNotFoundException(network, "any asset (unknown network)");
        }
        return endpoint;
    }

    public Optional<String> feedAddress(String network, String asset) {
        return Optional.ofNullable(endpoints.get(network))
                .map(endpoint -> endpoint.getFeeds().get(asset))
                .filter(address -> !address.isBlank());
    }

    /**
     * Every asset that has a feed on at least one network.
     */
    public Set<String> assets() {
        Set<String> assets = new TreeSet<>();
        endpoints.values().forEach(endpoint -> assets.addAll(endpoint.getFeeds().keySet()));
        return assets;
    }
}
