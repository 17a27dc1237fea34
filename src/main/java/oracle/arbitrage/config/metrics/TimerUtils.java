package oracle.arbitrage.config.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.experimental.UtilityClass;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

@UtilityClass
public class TimerUtils {

    /**
     * Times a Mono from subscription to its terminal signal, tagging the outcome.
     */
    public <T> Mono<T> timedMono(Supplier<Mono<T>> supplier, MeterRegistry registry, String name, String... tags) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(registry);
            return supplier.get()
                    .doOnSuccess(result -> stopTimer(sample, registry, name, "success", tags))
                    .doOnError(error -> stopTimer(sample, registry, name, error.getClass().getSimpleName(), tags));
        });
    }

    private void stopTimer(Timer.Sample sample, MeterRegistry registry, String name, String outcome, String... tags) {
        sample.stop(
                Timer.builder(name)
                        .tags(tags)
                        .tag("outcome", outcome)
                        .description("Timed operation: " + name)
                        .register(registry)
        );
    }
}
