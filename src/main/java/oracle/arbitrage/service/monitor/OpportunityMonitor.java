package oracle.arbitrage.service.monitor;

import io.micrometer.core.instrument.Counter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import oracle.arbitrage.model.OpportunityRound;
import oracle.arbitrage.model.TradeRecommendation;
import oracle.arbitrage.service.OracleService;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.math.RoundingMode;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Re-evaluates every configured asset on a fixed interval and publishes each result.
 * Rounds never overlap: a tick that fires while a round is still running is skipped.
 */
@Slf4j
public class OpportunityMonitor {

    private final OracleService oracleService;
    private final List<String> assets;
    private final Duration pollInterval;
    private final boolean autoStart;
    private final Scheduler tickScheduler;
    private final Counter roundsCompletedCounter;
    private final Counter deviationsTriggeredCounter;
    private final Counter roundFailuresCounter;

    private final Sinks.Many<OpportunityRound> rounds = Sinks.many().multicast().directBestEffort();
    private final Map<String, OpportunityRound> latestRounds = new ConcurrentHashMap<>();
    private final AtomicReference<MonitorState> state = new AtomicReference<>(MonitorState.IDLE);
    private Disposable subscription;

    public OpportunityMonitor(
            OracleService oracleService,
            List<String> assets,
            Duration pollInterval,
            boolean autoStart,
            Scheduler tickScheduler,
            Counter roundsCompletedCounter,
            Counter deviationsTriggeredCounter,
            Counter roundFailuresCounter) {
        if (assets.isEmpty()) {
            throw new IllegalStateException("No assets configured for monitoring: set oracle.assets");
        }
        this.oracleService = oracleService;
        this.assets = List.copyOf(assets);
        this.pollInterval = pollInterval;
        this.autoStart = autoStart;
        this.tickScheduler = tickScheduler;
        this.roundsCompletedCounter = roundsCompletedCounter;
        this.deviationsTriggeredCounter = deviationsTriggeredCounter;
        this.roundFailuresCounter = roundFailuresCounter;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initAfterStartup() {
        if (autoStart) {
            start();
        } else {
            log.info("Opportunity monitor auto-start disabled");
        }
    }

    public synchronized void start() {
        if (state.get() == MonitorState.STOPPED) {
            throw new IllegalStateException("Opportunity monitor has been stopped");
        }
        if (subscription != null && !subscription.isDisposed()) {
            log.warn("Opportunity monitor already running");
            return;
        }
        log.info("Starting opportunity monitor for {} every {}", assets, pollInterval);
        subscription = Flux.interval(Duration.ZERO, pollInterval, tickScheduler)
                .onBackpressureDrop(tick -> log.warn("Skipping tick {}: previous round still running", tick))
                .flatMap(tick -> runRound(), 1)
                .subscribe();
    }

    @PreDestroy
    public synchronized void stop() {
        if (state.getAndSet(MonitorState.STOPPED) == MonitorState.STOPPED) {
            return;
        }
        if (subscription != null) {
            subscription.dispose();
        }
        rounds.tryEmitComplete();
        log.info("Opportunity monitor stopped");
    }

    private Mono<Void> runRound() {
        if (state.getAndUpdate(s -> s == MonitorState.STOPPED ? s : MonitorState.POLLING) == MonitorState.STOPPED) {
            return Mono.empty();
        }
        log.debug("Monitoring round started for {}", assets);

        return Flux.fromIterable(assets)
                .concatMap(asset -> oracleService.evaluate(asset)
                        .doOnNext(this::publish)
                        .onErrorResume(error -> {
                            roundFailuresCounter.increment();
                            log.error("Evaluation of {} failed: {}", asset, error.getMessage(), error);
                            return Mono.empty();
                        }))
                // every asset is evaluated before the round state is decided
                .reduce(false, (triggered, round) -> triggered || round.isTriggered())
                .doOnNext(triggered -> {
                    roundsCompletedCounter.increment();
                    state.compareAndSet(MonitorState.POLLING, triggered ? MonitorState.TRIGGERED : MonitorState.IDLE);
                })
                .then();
    }

    private void publish(OpportunityRound round) {
        latestRounds.put(round.getAsset(), round);
        if (round.isTriggered()) {
            deviationsTriggeredCounter.increment();
            logOpportunity(round);
        }
        rounds.tryEmitNext(round);
    }

    private void logOpportunity(OpportunityRound round) {
        log.info("Price deviation on {}: {}% across {} (threshold {}%)",
                round.getAsset(),
                round.getDeviationReport().getDeviationPercent().setScale(4, RoundingMode.HALF_UP),
                round.getDeviationReport().getPriceSet().networks(),
                round.getDeviationReport().getThresholdPercent());
        round.bestRecommendation().ifPresent(best ->
                log.info("Best route for {}: buy on {} at {}, sell on {} at {}, potential profit {}",
                        round.getAsset(), best.getBuyNetwork(), best.getBuyPrice(),
                        best.getSellNetwork(), best.getSellPrice(), best.getPotentialProfit()));
    }

    /**
     * Every round result, as it completes. Late subscribers only see later rounds.
     */
    public Flux<OpportunityRound> rounds() {
        return rounds.asFlux();
    }

    public Map<String, OpportunityRound> latestRounds() {
        return new HashMap<>(latestRounds);
    }

    public int activeRecommendations() {
        return latestRounds.values().stream()
                .mapToInt(round -> (int) round.getRecommendations().stream().filter(TradeRecommendation::isProfitable).count())
                .sum();
    }

    public MonitorState getState() {
        return state.get();
    }
}
