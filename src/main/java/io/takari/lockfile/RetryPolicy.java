package io.takari.lockfile;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.util.concurrent.ThreadLocalRandom;

/**
 * How often and how patiently an acquisition is retried when the lock is held or the filesystem misbehaves. The wait
 * before retry {@code n} (counting from zero) is {@code min(round(r * minTimeout * factor^n), maxTimeout)} where
 * {@code r} is {@code 1}, or a random value in {@code [1, 2)} if randomized.
 */
public final class RetryPolicy {

  private static final RetryPolicy NONE = new RetryPolicy(0, 2, 1000, Long.MAX_VALUE, false);

  private final int retries;
  private final double factor;
  private final long minTimeout;
  private final long maxTimeout;
  private final boolean randomize;

  private RetryPolicy(int retries, double factor, long minTimeout, long maxTimeout, boolean randomize) {
    if (retries < 0) {
      throw new IllegalArgumentException("retries must not be negative: " + retries);
    }
    if (factor < 1) {
      throw new IllegalArgumentException("factor must be at least 1: " + factor);
    }
    if (minTimeout < 0 || maxTimeout < minTimeout) {
      throw new IllegalArgumentException("invalid timeouts: min " + minTimeout + ", max " + maxTimeout);
    }
    this.retries = retries;
    this.factor = factor;
    this.minTimeout = minTimeout;
    this.maxTimeout = maxTimeout;
    this.randomize = randomize;
  }

  /**
   * A single attempt, no retries.
   */
  public static RetryPolicy none() {
    return NONE;
  }

  /**
   * Retries up to {@code retries} times with the default exponential backoff (factor 2, starting at one second).
   */
  public static RetryPolicy of(int retries) {
    return retries == 0 ? NONE : new RetryPolicy(retries, 2, 1000, Long.MAX_VALUE, false);
  }

  public static RetryPolicy of(int retries, double factor, long minTimeout, long maxTimeout, boolean randomize) {
    return new RetryPolicy(retries, factor, minTimeout, maxTimeout, randomize);
  }

  public int getRetries() {
    return retries;
  }

  /**
   * @param retry the zero based number of the retry about to happen.
   * @return the number of milliseconds to wait before that retry.
   */
  public long delay(int retry) {
    double random = randomize ? 1 + ThreadLocalRandom.current().nextDouble() : 1;
    double timeout = Math.round(random * minTimeout * Math.pow(factor, retry));
    return (long) Math.min(timeout, maxTimeout);
  }

  @Override
  public String toString() {
    return "RetryPolicy[retries=" + retries + ", factor=" + factor + ", minTimeout=" + minTimeout + ", maxTimeout="
        + maxTimeout + ", randomize=" + randomize + "]";
  }
}
