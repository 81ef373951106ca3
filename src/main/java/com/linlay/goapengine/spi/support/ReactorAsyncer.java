package com.linlay.goapengine.spi.support;

import com.linlay.goapengine.spi.Asyncer;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Runs blocking work on Reactor's bounded elastic scheduler.
 */
public class ReactorAsyncer implements Asyncer {

    private final Scheduler scheduler;

    public ReactorAsyncer() {
        this(Schedulers.boundedElastic());
    }

    public ReactorAsyncer(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public <T> CompletableFuture<T> async(Callable<T> task) {
        return Mono.fromCallable(task)
                .subscribeOn(scheduler)
                .toFuture();
    }
}
