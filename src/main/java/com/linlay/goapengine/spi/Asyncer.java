package com.linlay.goapengine.spi;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Runs work off the calling thread.
 */
public interface Asyncer {

    <T> CompletableFuture<T> async(Callable<T> task);
}
