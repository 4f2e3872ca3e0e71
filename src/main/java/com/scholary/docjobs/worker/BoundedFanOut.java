package com.scholary.docjobs.worker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntConsumer;

/**
 * Runs a round's items with at most {@code concurrencyCap} in flight.
 *
 * <p>{@code min(cap, n)} lanes are started on the executor; each lane pulls the next unclaimed
 * index until none is left. {@link #run} returns only after every lane has finished. If a task
 * throws, the remaining lanes stop pulling new items and the first error is rethrown.
 */
public class BoundedFanOut {

  private final Executor executor;

  public BoundedFanOut(Executor executor) {
    this.executor = executor;
  }

  public void run(int itemCount, int concurrencyCap, IntConsumer task)
      throws InterruptedException {
    if (itemCount <= 0) {
      return;
    }
    if (concurrencyCap < 1) {
      throw new IllegalArgumentException("concurrencyCap must be at least 1: " + concurrencyCap);
    }

    AtomicInteger next = new AtomicInteger();
    AtomicBoolean abort = new AtomicBoolean();
    AtomicReference<RuntimeException> firstError = new AtomicReference<>();

    Runnable lane =
        () -> {
          int index;
          while (!abort.get() && (index = next.getAndIncrement()) < itemCount) {
            try {
              task.accept(index);
            } catch (RuntimeException e) {
              firstError.compareAndSet(null, e);
              abort.set(true);
            }
          }
        };

    int lanes = Math.min(concurrencyCap, itemCount);
    List<CompletableFuture<Void>> futures = new ArrayList<>(lanes);
    for (int i = 0; i < lanes; i++) {
      futures.add(CompletableFuture.runAsync(lane, executor));
    }

    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
    } catch (InterruptedException e) {
      abort.set(true);
      Thread.currentThread().interrupt();
      throw e;
    } catch (ExecutionException e) {
      // lanes catch task errors themselves; this is a failure of the lane wrapper
      throw new IllegalStateException("Fan-out lane failed", e.getCause());
    }

    RuntimeException error = firstError.get();
    if (error != null) {
      throw error;
    }
  }
}
