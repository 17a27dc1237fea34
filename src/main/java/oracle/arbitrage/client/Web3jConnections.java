package oracle.arbitrage.client;

import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.exception.FeedNotFoundException;
import oracle.arbitrage.model.NetworkEndpoint;
import oracle.arbitrage.registry.NetworkEndpointRegistry;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One {@link Web3j} handle per network, shared by every round.
 */
@Slf4j
public class Web3jConnections {
    private final Map<String, Web3j> connections;

    public Web3jConnections(Map<String, Web3j> connections) {
        this.connections = Collections.unmodifiableMap(new LinkedHashMap<>(connections));
    }

    public static Web3jConnections fromRegistry(NetworkEndpointRegistry registry) {
        Map<String, Web3j> connections = new LinkedHashMap<>();
        for (NetworkEndpoint endpoint : registry.endpoints()) {
            connections.put(endpoint.getId(), Web3j.build(new HttpService(endpoint.getRpcUrl())));
            log.info("Web3j connection created for network {} (chainId {})", endpoint.getId(), endpoint.getChainId());
        }
        return new Web3jConnections(connections);
    }

    public Web3j get(String network) {
        Web3j web3j = connections.get(network);
        if (web3j == null) {
            throw new FeedNotFoundException(network, "any asset (no connection)");
        }
        return web3j;
    }

    public void shutdown() {
        connections.forEach((network, web3j) -> {
            try {
                web3j.shutdown();
            } catch (Exception e) {
                log.warn("Error closing web3j connection for {}: {}", network, e.getMessage());
            }
        });
    }
}
