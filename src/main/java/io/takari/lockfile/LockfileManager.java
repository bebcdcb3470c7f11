package io.takari.lockfile;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;

/**
 * Advisory locks between OS processes, or hosts sharing a filesystem, using nothing but the filesystem. Locking
 * {@code foo} creates the directory {@code foo.lock} holding a {@code .uid} file with a random ownership token. A held
 * lock is renewed by touching the directory; one that was not touched within the stale threshold may be reclaimed by
 * anybody.
 */
public interface LockfileManager {

  /**
   * Lock the target file with {@link LockOptions#defaults()}. A compromise of this lock is fatal.
   *
   * @param target the file to lock, never {@code null}. It does not need to exist unless symlinks are resolved.
   * @return the lease, never {@code null}.
   * @throws LockException with {@link LockException.Kind#LOCK_HELD} if the lock is held.
   * @throws java.nio.file.NoSuchFileException if the target has to be resolved but does not exist.
   * @throws IOException if the lock files cannot be created.
   */
  Lease lock(File target) throws IOException;

  Lease lock(File target, LockOptions options) throws IOException;

  /**
   * Lock the target file.
   *
   * @param target the file to lock, never {@code null}.
   * @param options the options, never {@code null}.
   * @param listener notified if the lock gets lost after it was acquired, may be {@code null} to treat that as fatal.
   * @return the lease, never {@code null}.
   */
  Lease lock(File target, LockOptions options, CompromisedListener listener) throws IOException;

  void unlock(File target) throws IOException;

  /**
   * Releases the lock this manager holds for the target file.
   *
   * @throws LockException with {@link LockException.Kind#NOT_ACQUIRED} if this manager does not hold it.
   */
  void unlock(File target, LockOptions options) throws IOException;

  boolean isLocked(File target) throws IOException;

  /**
   * Tells whether anybody holds a fresh lock on the target file. Stale locks are reported as not locked but are left
   * in place.
   */
  boolean isLocked(File target, LockOptions options) throws IOException;
}
