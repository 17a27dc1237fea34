package oracle.arbitrage.config.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import oracle.arbitrage.service.monitor.OpportunityMonitor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter roundsCompletedCounter(MeterRegistry registry) {
        return Counter.builder("oracle.rounds.completed")
                .description("Number of monitoring rounds completed")
                .register(registry);
    }

    @Bean
    public Counter deviationsTriggeredCounter(MeterRegistry registry) {
        return Counter.builder("oracle.deviations.triggered")
                .description("Number of asset evaluations whose deviation exceeded the threshold")
                .register(registry);
    }

    @Bean
    public Counter roundFailuresCounter(MeterRegistry registry) {
        return Counter.builder("oracle.rounds.failed")
                .description("Number of asset evaluations that failed")
                .register(registry);
    }

    @Bean
    public Gauge activeRecommendationsGauge(MeterRegistry registry, OpportunityMonitor opportunityMonitor) {
        return Gauge.builder("oracle.recommendations.active", opportunityMonitor::activeRecommendations)
                .description("Profitable recommendations in the latest round of each asset")
                .register(registry);
    }

    @Bean
    public Counter telegramNotificationsCounter(MeterRegistry registry) {
        return Counter.builder("telegram.notifications.sent")
                .description("Number of Telegram notifications sent")
                .register(registry);
    }
}
