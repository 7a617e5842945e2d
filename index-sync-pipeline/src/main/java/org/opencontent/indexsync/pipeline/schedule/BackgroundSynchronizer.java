package org.opencontent.indexsync.pipeline.schedule;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.opencontent.indexsync.pipeline.IndexingService;
import org.opencontent.indexsync.pipeline.ir.SyncResult;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Runs a synchronization pass of every index on a fixed period. Passes never overlap: at most
 * one tick waits for a running pass, later ones are dropped. A failed pass is logged and the next tick
 * starts over from the committed watermarks.
 */
@Slf4j
public class BackgroundSynchronizer {

    private final IndexingService indexingService;
    private final Supplier<Scheduler> passScheduler;

    public BackgroundSynchronizer(IndexingService indexingService) {
        this(indexingService, Schedulers::boundedElastic);
    }

    /**
     * @param passScheduler supplies the scheduler blocking passes run on, resolved on each subscription
     */
    public BackgroundSynchronizer(IndexingService indexingService, Supplier<Scheduler> passScheduler) {
        this.indexingService = Objects.requireNonNull(indexingService, "indexingService");
        this.passScheduler = Objects.requireNonNull(passScheduler, "passScheduler");
    }

    /**
     * Cold Flux of pass results; subscribing starts the schedule and disposing stops it.
     * Failed passes emit nothing.
     */
    public Flux<SyncResult> run(Duration initialDelay, Duration period) {
        return Flux.defer(() -> {
            Scheduler scheduler = passScheduler.get();
            return Flux.interval(initialDelay, period)
                .onBackpressureDrop(tick -> log.debug("Skipping tick {}, previous pass still running", tick))
                .concatMap(tick -> runPass(tick, scheduler), 1);
        });
    }

    private Mono<SyncResult> runPass(long tick, Scheduler scheduler) {
        return Mono.fromCallable(() -> indexingService.synchronize(Optional.empty()))
            .subscribeOn(scheduler)
            .doOnNext(result -> log.debug("Background pass {} processed {} task(s)", tick, result.tasksProcessed()))
            .onErrorResume(e -> {
                log.atError().setMessage("Background pass {} failed").addArgument(tick).setCause(e).log();
                return Mono.empty();
            });
    }
}
