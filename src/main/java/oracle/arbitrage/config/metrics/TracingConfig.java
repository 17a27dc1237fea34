package oracle.arbitrage.config.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.DefaultClientRequestObservationConvention;

@Configuration
public class TracingConfig {

    /**
     * Enables {@code @Observed} on {@link oracle.arbitrage.service.OracleService}.
     */
    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }

    // only builders taken from the context are customized (the Telegram client)
    @Bean
    public WebClientCustomizer alertClientObservationCustomizer(ObservationRegistry observationRegistry) {
        return webClientBuilder -> webClientBuilder
                .observationRegistry(observationRegistry)
                .observationConvention(new DefaultClientRequestObservationConvention("oracle.alerts.http.requests"));
    }

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTags(
            @Value("${spring.application.name:oracle-arbitrage}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
