package oracle.arbitrage.controller;

import lombok.RequiredArgsConstructor;
import oracle.arbitrage.model.NetworkEndpoint;
import oracle.arbitrage.model.OpportunityRound;
import oracle.arbitrage.registry.NetworkEndpointRegistry;
import oracle.arbitrage.service.OracleService;
import oracle.arbitrage.service.monitor.OpportunityMonitor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Configuration
@RequiredArgsConstructor
public class OracleController {
    private final OracleService oracleService;
    private final OpportunityMonitor opportunityMonitor;
    private final NetworkEndpointRegistry registry;

    @Bean
    public RouterFunction<ServerResponse> oracleRoutes() {
        return RouterFunctions.route()
                .path("/oracle", this::buildOracleRoutes)
                .build();
    }

    private RouterFunction<ServerResponse> buildOracleRoutes() {
        return RouterFunctions.route()
                .GET("/deviation", this::handleCurrentDeviation)
                .GET("/rounds/latest", this::handleLatestRounds)
                .GET("/rounds/stream", this::handleRoundStream)
                .GET("/networks", this::handleNetworks)
                .build();
    }

    private Mono<ServerResponse> handleCurrentDeviation(ServerRequest request) {
        Optional<String> asset = request.queryParam("asset").filter(value -> !value.isBlank());
        if (asset.isEmpty()) {
            return ServerResponse.badRequest().bodyValue(Map.of("error", "query parameter 'asset' is required"));
        }
        if (!oracleService.supportsAsset(asset.get())) {
            return ServerResponse.notFound().build();
        }
        return oracleService.getCurrentDeviation(asset.get())
                .flatMap(report -> ServerResponse.ok().bodyValue(report));
    }

    private Mono<ServerResponse> handleLatestRounds(ServerRequest request) {
        Map<String, OpportunityRound> latest = opportunityMonitor.latestRounds();
        return request.queryParam("asset")
                .map(asset -> Optional.ofNullable(latest.get(asset))
                        .map(round -> ServerResponse.ok().bodyValue(round))
                        .orElseGet(() -> ServerResponse.notFound().build()))
                .orElseGet(() -> ServerResponse.ok().bodyValue(latest));
    }

    private Mono<ServerResponse> handleRoundStream(ServerRequest request) {
        return ServerResponse.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(opportunityMonitor.rounds(), OpportunityRound.class);
    }

    // rpc urls may embed API keys, so they stay out of the response
    private Mono<ServerResponse> handleNetworks(ServerRequest request) {
        Map<String, Object> networks = new LinkedHashMap<>();
        for (NetworkEndpoint endpoint : registry.endpoints()) {
            networks.put(endpoint.getId(), Map.of(
                    "chainId", endpoint.getChainId(),
                    "assets", endpoint.getFeeds().keySet()));
        }
        return ServerResponse.ok().bodyValue(networks);
    }
}
