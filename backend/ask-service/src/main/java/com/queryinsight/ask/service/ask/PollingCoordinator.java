package com.queryinsight.ask.service.ask;

import com.queryinsight.ask.config.AskProperties;
import com.queryinsight.ask.exception.ApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Polls an asynchronous job until it reports a terminal snapshot or the stage deadline passes.
 *
 * The first fetch happens on subscription; each later fetch happens one interval after the
 * previous one completed. {@code onChange} fires for the first snapshot and then only when the
 * classified status differs from the previous one. Snapshot content is not interpreted here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PollingCoordinator {

    private static final Object NO_STATUS = new Object();

    private final AskProperties properties;

    /**
     * @param stage       stage name, used in logs and in the timeout error
     * @param fetchStatus fetches one snapshot
     * @param statusOf    classifies a snapshot for change detection
     * @param isTerminal  stop condition
     * @param onChange    invoked per observed status change, in observation order
     * @param timeout     hard deadline measured from subscription
     * @return the first terminal snapshot, or {@code POLLING_TIMEOUT}
     */
    public <T> Mono<T> poll(String stage,
                            Supplier<Mono<T>> fetchStatus,
                            Function<T, ?> statusOf,
                            Predicate<T> isTerminal,
                            Consumer<T> onChange,
                            Duration timeout) {
        Duration interval = properties.getPolling().getInterval();

        return Mono.defer(() -> {
            AtomicReference<Object> lastStatus = new AtomicReference<>(NO_STATUS);

            return Mono.defer(fetchStatus)
                    .doOnNext(snapshot -> {
                        Object status = statusOf.apply(snapshot);
                        Object previous = lastStatus.getAndSet(status);
                        if (previous == NO_STATUS || !Objects.equals(previous, status)) {
                            log.debug("{} status changed: {} -> {}", stage,
                                    previous == NO_STATUS ? "-" : previous, status);
                            onChange.accept(snapshot);
                        }
                    })
                    .repeatWhen(completed -> completed.delayElements(interval))
                    .takeUntil(isTerminal)
                    .last()
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class, e -> {
                        log.warn("{} polling timed out after {} (last status: {})", stage, timeout, lastStatus.get());
                        return ApiException.pollingTimeout(stage, timeout);
                    });
        });
    }
}
