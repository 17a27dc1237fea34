package oracle.arbitrage.config.webclient;

import oracle.arbitrage.client.ChainlinkFeedClient;
import oracle.arbitrage.client.FeedClient;
import oracle.arbitrage.client.GasPriceClient;
import oracle.arbitrage.client.Web3jConnections;
import oracle.arbitrage.client.Web3jGasPriceClient;
import oracle.arbitrage.registry.NetworkEndpointRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class Web3jConfig {

    @Bean(destroyMethod = "shutdown")
    public Web3jConnections web3jConnections(NetworkEndpointRegistry registry) {
        return Web3jConnections.fromRegistry(registry);
    }

    @Bean
    public FeedClient chainlinkFeedClient(Web3jConnections connections) {
        return new ChainlinkFeedClient(connections);
    }

    @Bean
    public GasPriceClient gasPriceClient(Web3jConnections connections) {
        return new Web3jGasPriceClient(connections);
    }
}
