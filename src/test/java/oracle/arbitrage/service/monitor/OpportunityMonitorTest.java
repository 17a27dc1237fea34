package oracle.arbitrage.service.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import oracle.arbitrage.model.CostEstimate;
import oracle.arbitrage.model.DeviationReport;
import oracle.arbitrage.model.OpportunityRound;
import oracle.arbitrage.model.PriceSet;
import oracle.arbitrage.service.OracleService;
import oracle.arbitrage.service.deviation.DeviationDetector;
import oracle.arbitrage.service.recommendation.MissingCostPolicy;
import oracle.arbitrage.service.recommendation.RecommendationEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static oracle.arbitrage.TestFixtures.CLOCK;
import static oracle.arbitrage.TestFixtures.ETH;
import static oracle.arbitrage.TestFixtures.NOW;
import static oracle.arbitrage.TestFixtures.priceSet;
import static oracle.arbitrage.TestFixtures.sample;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpportunityMonitorTest {

    private static final BigDecimal THRESHOLD = new BigDecimal("0.5");
    private static final String BTC = "BTC_USD";

    @Mock
    private OracleService oracleService;

    private SimpleMeterRegistry meterRegistry;
    private Counter roundsCompleted;
    private Counter deviationsTriggered;
    private Counter roundFailures;
    private OpportunityMonitor monitor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        roundsCompleted = meterRegistry.counter("oracle.rounds.completed");
        deviationsTriggered = meterRegistry.counter("oracle.deviations.triggered");
        roundFailures = meterRegistry.counter("oracle.rounds.failed");
    }

    @AfterEach
    void tearDown() {
        if (monitor != null) {
            monitor.stop();
        }
    }

    @Test
    void shouldPublishEachRoundAndKeepTheLatest() {
        when(oracleService.evaluate(ETH)).thenReturn(Mono.just(triggeredRound()));
        monitor = monitor(Duration.ofMillis(50));

        StepVerifier.create(monitor.rounds().take(2))
                .then(monitor::start)
                .expectNextMatches(OpportunityRound::isTriggered)
                .expectNextMatches(OpportunityRound::isTriggered)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(ETH, monitor.latestRounds().get(ETH).getAsset());
        assertEquals(3, monitor.activeRecommendations());
        assertTrue(deviationsTriggered.count() >= 2);
        awaitUntil(() -> monitor.getState() == MonitorState.TRIGGERED);
    }

    @Test
    void shouldEvaluateEveryAssetEvenAfterOneTriggers() {
        when(oracleService.evaluate(ETH)).thenReturn(Mono.just(triggeredRound()));
        when(oracleService.evaluate(BTC)).thenReturn(Mono.just(calmBtcRound()));
        monitor = new OpportunityMonitor(oracleService, List.of(ETH, BTC), Duration.ofSeconds(30), true,
                Schedulers.parallel(), roundsCompleted, deviationsTriggered, roundFailures);

        StepVerifier.create(monitor.rounds().take(2))
                .then(monitor::start)
                .expectNextMatches(round -> round.getAsset().equals(ETH) && round.isTriggered())
                .expectNextMatches(round -> round.getAsset().equals(BTC) && !round.isTriggered())
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        verify(oracleService).evaluate(BTC);
        assertEquals(Set.of(ETH, BTC), monitor.latestRounds().keySet());
        awaitUntil(() -> monitor.getState() == MonitorState.TRIGGERED);
        assertEquals(1.0, roundsCompleted.count());
        assertEquals(1.0, deviationsTriggered.count());
    }

    @Test
    void shouldReturnToIdleWhenNothingTriggers() {
        when(oracleService.evaluate(ETH)).thenReturn(Mono.just(calmRound()));
        monitor = monitor(Duration.ofMillis(50));

        monitor.start();

        awaitUntil(() -> roundsCompleted.count() >= 1 && monitor.getState() == MonitorState.IDLE);
        assertEquals(0.0, deviationsTriggered.count());
        assertEquals(0, monitor.activeRecommendations());
    }

    @Test
    void shouldNeverRunTwoRoundsAtOnce() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(oracleService.evaluate(anyString())).thenAnswer(invocation -> Mono.defer(() -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    return Mono.delay(Duration.ofMillis(120)).thenReturn(calmRound());
                })
                .doFinally(signal -> inFlight.decrementAndGet()));
        monitor = monitor(Duration.ofMillis(20));

        StepVerifier.create(monitor.rounds().take(3))
                .then(monitor::start)
                .expectNextCount(3)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(1, maxInFlight.get());
    }

    @Test
    void shouldKeepPollingAfterFailedEvaluation() {
        when(oracleService.evaluate(ETH)).thenReturn(
                Mono.error(new IllegalStateException("aggregation failed")),
                Mono.just(calmRound()));
        monitor = monitor(Duration.ofMillis(50));

        StepVerifier.create(monitor.rounds().take(1))
                .then(monitor::start)
                .expectNextCount(1)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(1.0, roundFailures.count());
        assertTrue(roundsCompleted.count() >= 1);
    }

    @Test
    void stopShouldCompleteTheRoundStream() {
        monitor = monitor(Duration.ofSeconds(30));

        monitor.stop();

        assertEquals(MonitorState.STOPPED, monitor.getState());
        StepVerifier.create(monitor.rounds()).expectComplete().verify(Duration.ofSeconds(1));
        assertThrows(IllegalStateException.class, monitor::start);
    }

    @Test
    void shouldNotStartWhenAutoStartDisabled() {
        monitor = new OpportunityMonitor(oracleService, List.of(ETH), Duration.ofMillis(10), false,
                Schedulers.parallel(), roundsCompleted, deviationsTriggered, roundFailures);

        monitor.initAfterStartup();

        assertEquals(MonitorState.IDLE, monitor.getState());
        verify(oracleService, never()).evaluate(anyString());
    }

    @Test
    void shouldRefuseEmptyAssetList() {
        assertThrows(IllegalStateException.class, () -> new OpportunityMonitor(oracleService, List.of(),
                Duration.ofSeconds(1), true, Schedulers.parallel(), roundsCompleted, deviationsTriggered, roundFailures));
    }

    private OpportunityMonitor monitor(Duration interval) {
        return new OpportunityMonitor(oracleService, List.of(ETH), interval, true,
                Schedulers.parallel(), roundsCompleted, deviationsTriggered, roundFailures);
    }

    private static OpportunityRound triggeredRound() {
        PriceSet prices = priceSet("A", "100", "B", "103", "C", "98");
        DeviationReport report = new DeviationDetector(CLOCK).detectDeviation(prices, THRESHOLD);
        return OpportunityRound.builder()
                .asset(ETH)
                .deviationReport(report)
                .recommendations(new RecommendationEngine(MissingCostPolicy.ASSUME_ZERO)
                        .recommend(report, CostEstimate.empty()))
                .costEstimate(CostEstimate.empty())
                .completedAt(NOW)
                .build();
    }

    private static OpportunityRound calmBtcRound() {
        PriceSet prices = PriceSet.of(BTC, List.of(
                sample("A", "60000").toBuilder().asset(BTC).build(),
                sample("B", "60010").toBuilder().asset(BTC).build()));
        return OpportunityRound.builder()
                .asset(BTC)
                .deviationReport(new DeviationDetector(CLOCK).detectDeviation(prices, THRESHOLD))
                .recommendations(List.of())
                .completedAt(NOW)
                .build();
    }

    private static OpportunityRound calmRound() {
        DeviationReport report = new DeviationDetector(CLOCK).detectDeviation(priceSet("A", "100", "B", "100"), THRESHOLD);
        return OpportunityRound.builder()
                .asset(ETH)
                .deviationReport(report)
                .recommendations(List.of())
                .completedAt(NOW)
                .build();
    }

    private static void awaitUntil(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting");
            }
        }
    }
}
