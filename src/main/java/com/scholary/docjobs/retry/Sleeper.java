package com.scholary.docjobs.retry;

import java.time.Duration;

/** Pauses the current thread. Swapped for a no-op in tests. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
