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
import io.takari.lockfile.LockfileManager;
import io.takari.lockfile.RetryPolicy;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.NoSuchFileException;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offers advisory locking between processes, and between hosts sharing a filesystem, without any daemon. Locking
 * {@code foo} atomically creates the directory {@code foo.lock}, which either works or tells us somebody else holds
 * the lock. The holder keeps touching the directory, so a lock whose modification time is older than the stale
 * threshold belongs to a holder that died and may be reclaimed. Since reclaiming is not atomic, every holder also
 * checks on each renewal that the {@code .uid} file in the lock directory still carries its own token.
 * <p>
 * Leases are tracked per manager instance; as a singleton the manager tracks all locks of the process. Two instances
 * do not know about each other's leases and compete for locks only through the filesystem. A manager that was
 * {@link #shutdown() shut down} refuses to lock anything.
 */
@Named
@Singleton
public class DefaultLockfileManager implements LockfileManager {

  static final int RENEWAL_THREADS = 4;

  /**
   * Seconds an idle renewal thread is kept around.
   */
  private static final long THREAD_KEEP_ALIVE = 60;

  private static final AtomicInteger threadCount = new AtomicInteger();

  private final Logger logger = LoggerFactory.getLogger(DefaultLockfileManager.class);

  private final FileOperations fileOperations;

  private final PathResolver resolver;

  private final LockRegistry registry = new LockRegistry();

  private final ScheduledExecutorService scheduler;

  private volatile boolean shutdown;

  // guarded by this
  private Thread exitCleanup;

  public DefaultLockfileManager() {
    this(new DefaultFileOperations());
  }

  @Inject
  public DefaultLockfileManager(FileOperations fileOperations) {
    this.fileOperations = fileOperations;
    this.resolver = new PathResolver(fileOperations);
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(RENEWAL_THREADS, new ThreadFactory() {
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, "lockfile-renewal-" + threadCount.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    });
    executor.setRemoveOnCancelPolicy(true);
    executor.setKeepAliveTime(THREAD_KEEP_ALIVE, TimeUnit.SECONDS);
    executor.allowCoreThreadTimeOut(true);
    this.scheduler = executor;
  }

  public Lease lock(File target) throws IOException {
    return lock(target, LockOptions.defaults(), null);
  }

  public Lease lock(File target, LockOptions options) throws IOException {
    return lock(target, options, null);
  }

  public Lease lock(File target, LockOptions options, CompromisedListener listener) throws IOException {
    checkNotShutdown();
    File file = resolver.resolve(target, options.isResolveSymlinks());
    LockArtifact artifact = new LockArtifact(fileOperations, file);
    RetryPolicy retries = options.getRetries();

    boolean interrupted = false;
    try {
      for (int attempt = 0;; attempt++) {
        String uid;
        try {
          uid = acquire(artifact, options.getStale());
        } catch (LockArtifact.TokenWriteException e) {
          throw (IOException) e.getCause();
        } catch (IOException e) {
          if (attempt >= retries.getRetries()) {
            throw e;
          }
          long delay = retries.delay(attempt);
          logger.debug("Failed to lock " + file + ", retrying in " + delay + "ms: " + e);
          try {
            Thread.sleep(delay);
          } catch (InterruptedException e1) {
            interrupted = true;
            InterruptedIOException iioe = new InterruptedIOException("Interrupted while waiting to lock " + file);
            iioe.initCause(e);
            throw iioe;
          }
          continue;
        }
        return register(artifact, uid, options, listener);
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * One attempt to take the lock: create it, or reclaim it if it is stale. Reclaiming is followed by exactly one more
   * creation attempt without another staleness check, so two parties fighting over a stale lock cannot loop.
   *
   * @return the ownership token written into the new lock.
   */
  private String acquire(LockArtifact artifact, long stale) throws IOException {
    File file = artifact.getDataFile();

    // this process holds it already, no need to ask the filesystem
    if (registry.contains(file)) {
      throw lockHeld(file);
    }

    String uid = create(artifact);
    if (uid != null) {
      return uid;
    }

    long mtime;
    try {
      mtime = artifact.lastModified();
    } catch (NoSuchFileException e) {
      // released meanwhile
      return createOrFail(artifact);
    }

    if (mtime >= System.currentTimeMillis() - stale) {
      throw lockHeld(file);
    }

    logger.debug("Reclaiming stale lock " + artifact + ", last updated " + (System.currentTimeMillis() - mtime)
        + "ms ago");
    artifact.remove();

    return createOrFail(artifact);
  }

  private String createOrFail(LockArtifact artifact) throws IOException {
    String uid = create(artifact);
    if (uid == null) {
      throw lockHeld(artifact.getDataFile());
    }
    return uid;
  }

  /**
   * @return the new token or {@code null} if the lock exists already.
   */
  private String create(LockArtifact artifact) throws IOException {
    String uid = UUID.randomUUID().toString();
    return artifact.create(uid) ? uid : null;
  }

  private Lease register(LockArtifact artifact, String uid, LockOptions options, CompromisedListener listener)
      throws IOException {
    FileLease lease = new FileLease(artifact, uid, options, listener != null ? listener : FATAL, registry, scheduler);
    if (!registry.register(lease)) {
      // another thread of ours got here first, which the filesystem should have prevented
      artifact.remove();
      throw lockHeld(artifact.getDataFile());
    }
    // the manager may have been shut down meanwhile, then the lease would never be renewed
    try {
      checkNotShutdown();
      new Renewal(lease).start();
    } catch (IllegalStateException e) {
      discard(lease);
      throw e;
    } catch (RejectedExecutionException e) {
      discard(lease);
      throw new IllegalStateException("Lock manager is shut down", e);
    }
    registerExitCleanup();
    logger.debug("Acquired lock " + artifact);
    return lease;
  }

  private void discard(FileLease lease) throws IOException {
    if (lease.markReleased()) {
      lease.getArtifact().remove();
    }
  }

  private void checkNotShutdown() {
    if (shutdown) {
      throw new IllegalStateException("Lock manager is shut down");
    }
  }

  public void unlock(File target) throws IOException {
    unlock(target, LockOptions.defaults());
  }

  public void unlock(File target, LockOptions options) throws IOException {
    File file = resolver.resolve(target, options.isResolveSymlinks());
    FileLease lease = registry.get(file);
    if (lease == null || !lease.markReleased()) {
      throw new LockException(LockException.Kind.NOT_ACQUIRED, file, "Lock is not acquired");
    }
    lease.getArtifact().remove();
    logger.debug("Unlocked " + lease.getArtifact());
  }

  public boolean isLocked(File target) throws IOException {
    return isLocked(target, LockOptions.defaults());
  }

  public boolean isLocked(File target, LockOptions options) throws IOException {
    File file = resolver.resolve(target, options.isResolveSymlinks());
    LockArtifact artifact = new LockArtifact(fileOperations, file);
    long mtime;
    try {
      mtime = artifact.lastModified();
    } catch (NoSuchFileException e) {
      return false;
    }
    return mtime >= System.currentTimeMillis() - options.getStale();
  }

  /**
   * Stops renewing, releases all leases held through this manager and unregisters the exit cleanup. Failures to remove
   * lock files are logged. Afterwards {@code lock} throws {@link IllegalStateException}.
   */
  public void shutdown() {
    shutdown = true;
    scheduler.shutdownNow();
    for (FileLease lease : registry.leases()) {
      try {
        lease.close();
      } catch (IOException e) {
        logger.warn("Failed to release lock on " + lease.getFile() + ": " + e);
      }
    }
    unregisterExitCleanup();
  }

  LockRegistry getRegistry() {
    return registry;
  }

  synchronized Thread getExitCleanup() {
    return exitCleanup;
  }

  private static LockException lockHeld(File file) {
    return new LockException(LockException.Kind.LOCK_HELD, file, "Lock file is already being held");
  }

  /**
   * Tries to remove the locks still held when the JVM exits. This is a courtesy to other processes that would
   * otherwise wait for the stale threshold, nothing correctness may rely on: shutdown hooks do not run on a crash or
   * kill.
   */
  private synchronized void registerExitCleanup() {
    if (exitCleanup != null || shutdown) {
      return;
    }
    exitCleanup = new Thread("lockfile-exit-cleanup") {
      @Override
      public void run() {
        for (FileLease lease : registry.leases()) {
          if (lease.markReleased()) {
            try {
              lease.getArtifact().remove();
            } catch (IOException e) {
              logger.debug("Failed to remove lock " + lease.getArtifact() + " on exit: " + e);
            }
          }
        }
      }
    };
    Runtime.getRuntime().addShutdownHook(exitCleanup);
  }

  private synchronized void unregisterExitCleanup() {
    if (exitCleanup == null) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(exitCleanup);
    } catch (IllegalStateException e) {
      // the JVM is exiting, the hook runs anyway
      logger.debug("Exit cleanup could not be unregistered: " + e);
    }
    exitCleanup = null;
  }

  private static final CompromisedListener FATAL = new CompromisedListener() {
    public void compromised(Lease lease, IOException cause) {
      LoggerFactory.getLogger(DefaultLockfileManager.class).error("Lock on " + lease.getFile() + " was compromised",
          cause);
      throw new IllegalStateException("Lock on " + lease.getFile() + " was compromised", cause);
    }
  };
}
