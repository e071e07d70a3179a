package com.quantori.eqp.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller owned flag that stops a running search. Fetches already in flight are allowed to finish,
 * no new page or filing fetch is started after {@link #cancel()}.
 */
public class CancellationSignal {
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public static CancellationSignal none() {
    return new CancellationSignal();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
