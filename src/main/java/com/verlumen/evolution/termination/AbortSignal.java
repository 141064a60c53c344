package com.verlumen.evolution.termination;

import java.util.concurrent.atomic.AtomicBoolean;

/** A stop request that can be raised from any thread, e.g. a shutdown hook or a UI. */
public final class AbortSignal {
  private final AtomicBoolean requested = new AtomicBoolean(false);

  public void request() {
    requested.set(true);
  }

  public boolean isRequested() {
    return requested.get();
  }
}
