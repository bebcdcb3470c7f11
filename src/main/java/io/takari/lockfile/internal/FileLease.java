package io.takari.lockfile.internal;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import io.takari.lockfile.CompromisedListener;
import io.takari.lockfile.Lease;
import io.takari.lockfile.LockException;
import io.takari.lockfile.LockOptions;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The handle of one acquired lock. Once released, a lease never becomes active again.
 */
class FileLease implements Lease {

  private static final Logger logger = LoggerFactory.getLogger(FileLease.class);

  private final LockArtifact artifact;
  private final String uid;
  private final LockOptions options;
  private final CompromisedListener listener;
  private final LockRegistry registry;
  private final ScheduledExecutorService scheduler;

  private boolean released;
  private boolean compromised;
  private ScheduledFuture<?> pendingRenewal;

  FileLease(LockArtifact artifact, String uid, LockOptions options, CompromisedListener listener,
      LockRegistry registry, ScheduledExecutorService scheduler) {
    this.artifact = artifact;
    this.uid = uid;
    this.options = options;
    this.listener = listener;
    this.registry = registry;
    this.scheduler = scheduler;
  }

  public File getFile() {
    return artifact.getDataFile();
  }

  LockArtifact getArtifact() {
    return artifact;
  }

  String getUid() {
    return uid;
  }

  LockOptions getOptions() {
    return options;
  }

  public void release() throws IOException {
    if (!markReleased()) {
      throw new LockException(LockException.Kind.ALREADY_RELEASED, getFile(), "Lock is already released");
    }
    artifact.remove();
    logger.debug("Released lock " + artifact);
  }

  public void close() throws IOException {
    if (markReleased()) {
      artifact.remove();
      logger.debug("Released lock " + artifact);
    }
  }

  public synchronized boolean isReleased() {
    return released;
  }

  public synchronized boolean isCompromised() {
    return compromised;
  }

  /**
   * Cancels the pending renewal and drops the lease from the registry.
   *
   * @return {@code false} if the lease was released before.
   */
  boolean markReleased() {
    return markReleased(false);
  }

  private boolean markReleased(boolean lost) {
    synchronized (this) {
      if (released) {
        return false;
      }
      released = true;
      compromised = lost;
      if (pendingRenewal != null) {
        pendingRenewal.cancel(false);
        pendingRenewal = null;
      }
    }
    registry.remove(this);
    return true;
  }

  /**
   * Schedules the next renewal, unless the lease got released meanwhile.
   *
   * @throws RejectedExecutionException if the manager is shut down and the lease would never be renewed again.
   */
  synchronized void schedule(Runnable renewal, long delay) {
    if (released) {
      return;
    }
    pendingRenewal = scheduler.schedule(renewal, delay, TimeUnit.MILLISECONDS);
  }

  /**
   * Gives up the lease because it was lost and notifies the listener.
   *
   * @param removeArtifact whether the lock files still belong to us and must be removed.
   */
  void compromise(IOException cause, boolean removeArtifact) {
    if (!markReleased(true)) {
      return;
    }
    if (removeArtifact) {
      try {
        artifact.remove();
      } catch (IOException e) {
        logger.warn("Failed to remove compromised lock " + artifact + ": " + e);
      }
    }
    try {
      listener.compromised(this, cause);
    } catch (RuntimeException e) {
      uncaught(e);
    } catch (Error e) {
      uncaught(e);
    }
  }

  private static void uncaught(Throwable e) {
    Thread thread = Thread.currentThread();
    thread.getUncaughtExceptionHandler().uncaughtException(thread, e);
  }

  @Override
  public String toString() {
    return "Lease[" + artifact + "]";
  }
}
