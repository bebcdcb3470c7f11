package io.takari.lockfile;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * Immutable settings for acquiring a lock. Values are clamped when built: the stale threshold is never below
 * {@value #MIN_STALE} ms and the update interval always lies between {@value #MIN_UPDATE} ms and half the stale
 * threshold.
 */
public final class LockOptions {

  public static final long DEFAULT_STALE = 10000;

  public static final long DEFAULT_UPDATE = 5000;

  public static final long MIN_STALE = 2000;

  public static final long MIN_UPDATE = 1000;

  private static final LockOptions DEFAULTS = builder().build();

  private final long stale;
  private final long update;
  private final boolean resolveSymlinks;
  private final RetryPolicy retries;

  private LockOptions(Builder builder) {
    this.stale = Math.max(builder.stale, MIN_STALE);
    this.update = Math.max(Math.min(builder.update, Math.round(stale / 2.0)), MIN_UPDATE);
    this.resolveSymlinks = builder.resolveSymlinks;
    this.retries = builder.retries;
  }

  public static LockOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return milliseconds after which a lock that has not been renewed is considered abandoned.
   */
  public long getStale() {
    return stale;
  }

  /**
   * @return milliseconds between two renewals of a held lock.
   */
  public long getUpdate() {
    return update;
  }

  public boolean isResolveSymlinks() {
    return resolveSymlinks;
  }

  public RetryPolicy getRetries() {
    return retries;
  }

  public Builder toBuilder() {
    return new Builder().stale(stale).update(update).resolveSymlinks(resolveSymlinks).retries(retries);
  }

  @Override
  public String toString() {
    return "LockOptions[stale=" + stale + ", update=" + update + ", resolveSymlinks=" + resolveSymlinks + ", retries="
        + retries + "]";
  }

  public static final class Builder {

    private long stale = DEFAULT_STALE;
    private long update = DEFAULT_UPDATE;
    private boolean resolveSymlinks = true;
    private RetryPolicy retries = RetryPolicy.none();

    private Builder() {
    }

    public Builder stale(long stale) {
      this.stale = stale;
      return this;
    }

    public Builder update(long update) {
      this.update = update;
      return this;
    }

    public Builder resolveSymlinks(boolean resolveSymlinks) {
      this.resolveSymlinks = resolveSymlinks;
      return this;
    }

    public Builder retries(int retries) {
      return retries(RetryPolicy.of(retries));
    }

    public Builder retries(RetryPolicy retries) {
      this.retries = retries != null ? retries : RetryPolicy.none();
      return this;
    }

    public LockOptions build() {
      return new LockOptions(this);
    }
  }
}
