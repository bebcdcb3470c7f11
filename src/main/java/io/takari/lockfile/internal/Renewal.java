package io.takari.lockfile.internal;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import io.takari.lockfile.LockException;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a held lock fresh by touching its directory every update interval, and checks on every tick that the lock still
 * carries our token. Ticks of one lease never overlap: the next one is scheduled only once the previous one is done.
 * <p>
 * A lease that could not be renewed for longer than the stale threshold is given up, as is one whose files are gone or
 * whose token changed.
 */
class Renewal implements Runnable {

  /**
   * Delay before the next attempt after a failed renewal.
   */
  static final long RETRY_DELAY = 1000;

  private static final Logger logger = LoggerFactory.getLogger(Renewal.class);

  private final FileLease lease;

  private long lastUpdate;

  private IOException updateError;

  Renewal(FileLease lease) {
    this.lease = lease;
  }

  /**
   * @throws RejectedExecutionException if the manager is shut down.
   */
  void start() {
    lastUpdate = System.currentTimeMillis();
    lease.schedule(this, lease.getOptions().getUpdate());
  }

  public void run() {
    LockArtifact artifact = lease.getArtifact();
    long stale = lease.getOptions().getStale();

    String uid = null;
    IOException error = null;
    try {
      uid = artifact.readUid();
    } catch (IOException e) {
      error = e;
    }
    try {
      artifact.touch(System.currentTimeMillis());
    } catch (IOException e) {
      error = pick(error, e);
    }

    if (lease.isReleased()) {
      return;
    }

    if (lastUpdate <= System.currentTimeMillis() - stale) {
      IOException cause = updateError;
      if (cause == null) {
        cause = new LockException(LockException.Kind.UPDATE_TIMEOUT, lease.getFile(),
            "Unable to update lock within the stale threshold");
      }
      logger.debug("Lock " + artifact + " was not renewed within " + stale + "ms");
      lease.compromise(cause, true);
      return;
    }

    if (error instanceof NoSuchFileException) {
      logger.debug("Lock " + artifact + " was removed externally");
      lease.compromise(error, true);
      return;
    }

    if (error != null) {
      logger.warn("Failed to renew lock " + artifact + ", retrying: " + error);
      updateError = error;
      reschedule(RETRY_DELAY);
      return;
    }

    if (!lease.getUid().equals(uid)) {
      logger.debug("Lock " + artifact + " was reclaimed by another owner");
      lease.compromise(new LockException(LockException.Kind.OWNERSHIP_MISMATCH, lease.getFile(), "Lock uid mismatch"),
          false);
      return;
    }

    lastUpdate = System.currentTimeMillis();
    updateError = null;
    reschedule(lease.getOptions().getUpdate());
  }

  private void reschedule(long delay) {
    try {
      lease.schedule(this, delay);
    } catch (RejectedExecutionException e) {
      logger.debug("Renewal of " + lease.getArtifact() + " was rejected, the manager is shut down");
      lease.compromise(new LockException(LockException.Kind.UPDATE_TIMEOUT, lease.getFile(),
          "Lock can no longer be renewed, the manager is shut down", e), true);
    }
  }

  /**
   * A missing file decides the outcome of a tick, so it wins over any other failure.
   */
  private static IOException pick(IOException first, IOException second) {
    if (first == null || (second instanceof NoSuchFileException && !(first instanceof NoSuchFileException))) {
      return second;
    }
    first.addSuppressed(second);
    return first;
  }
}
