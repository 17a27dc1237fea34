package oracle.arbitrage.telegram;

import io.github.cdimascio.dotenv.Dotenv;
import io.micrometer.core.instrument.Counter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.model.DeviationReport;
import oracle.arbitrage.model.OpportunityRound;
import oracle.arbitrage.model.TradeRecommendation;
import oracle.arbitrage.service.monitor.OpportunityMonitor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Sends a Telegram alert for every monitoring round that found a profitable route.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramNotificationService {

    private final WebClient telegramWebClient;
    private final Dotenv dotenv;
    private final Counter telegramNotificationsCounter;
    private final OpportunityMonitor opportunityMonitor;

    @Value("${telegram.enabled:false}")
    private boolean telegramEnabled;

    @Value("${telegram.retry.max-attempts:3}")
    private int maxRetryAttempts;

    @Value("${telegram.retry.initial-backoff:1000}")
    private long initialBackoffMillis;

    @Value("${telegram.retry.max-backoff:10000}")
    private long maxBackoffMillis;

    @Value("${telegram.rate-limit.messages-per-minute:20}")
    private int maxMessagesPerMinute;

    @Value("${telegram.max-routes:3}")
    private int maxRoutesPerMessage;

    private final AtomicInteger messagesSentInCurrentMinute = new AtomicInteger(0);
    private volatile long currentMinuteStartTime = System.currentTimeMillis();
    private Disposable subscription;

    @PostConstruct
    public void subscribeToRounds() {
        subscription = opportunityMonitor.rounds()
                .filter(round -> round.isTriggered() && round.bestRecommendation()
                        .map(TradeRecommendation::isProfitable).orElse(false))
                .concatMap(this::sendOpportunityNotification)
                .subscribe(
                        sent -> log.debug("Telegram alert processed, sent={}", sent),
                        error -> log.error("Telegram alert stream failed: {}", error.getMessage(), error));
        log.info("Telegram alerts {}", telegramEnabled ? "enabled" : "disabled");
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.dispose();
        }
    }

    /**
     * Sends the round's deviation and best routes to the configured chat.
     *
     * @return Mono<Boolean> indicating success or failure
     */
    public Mono<Boolean> sendOpportunityNotification(OpportunityRound round) {
        if (!telegramEnabled) {
            log.debug("Telegram notifications are disabled");
            return Mono.just(false);
        }

        if (!checkAndUpdateRateLimit()) {
            log.warn("Telegram rate limit reached. Skipping notification for {}", round.getAsset());
            return Mono.just(false);
        }

        String chatId = dotenv.get("TELEGRAM_CHAT_ID", "");
        String message = formatOpportunityMessage(round);

        return telegramWebClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/sendMessage")
                        .queryParam("chat_id", chatId)
                        .queryParam("text", "{text}")
                        .queryParam("parse_mode", "HTML")
                        .build(message))
                .retrieve()
                .bodyToMono(String.class)
                .retryWhen(createRetrySpec())
                .map(response -> {
                    log.info("Telegram notification sent successfully for {}", round.getAsset());
                    telegramNotificationsCounter.increment();
                    return true;
                })
                .onErrorResume(e -> {
                    log.error("Failed to send Telegram notification: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    String formatOpportunityMessage(OpportunityRound round) {
        DeviationReport report = round.getDeviationReport();
        String prices = report.getPriceSet().getSamples().values().stream()
                .map(sample -> "  • " + sample.getNetwork() + ": " + sample.getPrice())
                .collect(Collectors.joining("\n"));
        String routes = round.getRecommendations().stream()
                .filter(TradeRecommendation::isProfitable)
                .limit(maxRoutesPerMessage)
                .map(r -> String.format("  • buy %s → sell %s: +%s (diff %s, costs %s)",
                        r.getBuyNetwork(), r.getSellNetwork(), r.getPotentialProfit(),
                        r.getPriceDifference(), r.getEstimatedCosts().values().stream()
                                .reduce(BigDecimal.ZERO, BigDecimal::add)))
                .collect(Collectors.joining("\n"));

        return String.format(
                "🚨 <b>ORACLE PRICE DEVIATION</b> 🚨\n\n" +
                        "💰 <b>Asset</b>: %s\n" +
                        "📈 <b>Deviation</b>: %s%% (threshold %s%%)\n" +
                        "📊 <b>Prices</b>:\n%s\n" +
                        "↔️ <b>Best routes</b>:\n%s\n" +
                        "⏰ <b>Evaluated</b>: %s",
                round.getAsset(),
                report.getDeviationPercent().setScale(2, RoundingMode.HALF_UP),
                report.getThresholdPercent(),
                prices,
                routes,
                report.getEvaluatedAt()
        );
    }

    /**
     * @return true if message can be sent, false if rate limit is reached
     */
    private boolean checkAndUpdateRateLimit() {
        long currentTime = System.currentTimeMillis();
        if (currentTime - currentMinuteStartTime >= 60_000) {
            log.debug("Resetting Telegram rate limit counter. Previous count: {}", messagesSentInCurrentMinute.get());
            messagesSentInCurrentMinute.set(0);
            currentMinuteStartTime = currentTime;
        }
        return messagesSentInCurrentMinute.incrementAndGet() <= maxMessagesPerMinute;
    }

    private Retry createRetrySpec() {
        return Retry.backoff(maxRetryAttempts, Duration.ofMillis(initialBackoffMillis))
                .maxBackoff(Duration.ofMillis(maxBackoffMillis))
                .filter(this::shouldRetry)
                .doBeforeRetry(retrySignal ->
                        log.info("Retrying Telegram notification after error. Attempt {}/{}",
                                retrySignal.totalRetries() + 1, maxRetryAttempts));
    }

    // 429, 5xx and connection problems are worth another attempt
    private boolean shouldRetry(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            WebClientResponseException ex = (WebClientResponseException) throwable;
            HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
            return status.equals(HttpStatus.TOO_MANY_REQUESTS) || status.is5xxServerError();
        }
        return throwable instanceof WebClientRequestException || throwable instanceof IOException;
    }
}
