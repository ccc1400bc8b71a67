package com.example.chat.realtime.scheduler;

import com.example.chat.realtime.service.location.LocationTrackingService;
import com.example.chat.realtime.service.typing.TypingIndicatorService;
import com.example.chat.shared.config.AppProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Periodically expires stale typing indicators and location shares.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EphemeralStateSweeper {

    private final TypingIndicatorService typingIndicatorService;
    private final LocationTrackingService locationTrackingService;
    private final AppProperties appProperties;
    private final Scheduler sweepScheduler;

    private Disposable typingSweep;
    private Disposable locationShareSweep;

    @PostConstruct
    public void start() {
        Duration typingInterval = appProperties.getTyping().getSweepInterval();
        Duration shareInterval = appProperties.getLocation().getShareSweepInterval();
        typingSweep = every(typingInterval, "typing", typingIndicatorService::expireStale);
        locationShareSweep = every(shareInterval, "location share", locationTrackingService::expireShares);
        log.info("Ephemeral state sweeps started (typing every {}, location shares every {})", typingInterval, shareInterval);
    }

    @PreDestroy
    public void stop() {
        if (typingSweep != null && !typingSweep.isDisposed()) {
            typingSweep.dispose();
        }
        if (locationShareSweep != null && !locationShareSweep.isDisposed()) {
            locationShareSweep.dispose();
        }
    }

    private Disposable every(Duration interval, String name, Supplier<Mono<Integer>> sweep) {
        return Flux.interval(interval, interval, sweepScheduler)
                .onBackpressureDrop()
                .concatMap(tick -> Mono.defer(sweep)
                        .onErrorResume(e -> {
                            log.error("Error during {} sweep", name, e);
                            return Mono.just(0);
                        }))
                .subscribe(notified -> {
                    if (notified > 0) {
                        log.debug("{} sweep notified {} connections", name, notified);
                    }
                });
    }
}
