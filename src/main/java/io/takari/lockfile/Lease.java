package io.takari.lockfile;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.Closeable;
import java.io.File;
import java.io.IOException;

/**
 * A successful acquisition of a lock. The lock stays fresh on disk until {@link #release()} is called or it gets
 * compromised.
 */
public interface Lease extends Closeable {

  /**
   * Get the resolved file this lease was obtained for.
   *
   * @return The file, never {@code null}.
   */
  File getFile();

  /**
   * Releases the lock and removes its files.
   *
   * @throws LockException with {@link LockException.Kind#ALREADY_RELEASED} if released before, including by a
   *           compromise.
   * @throws IOException if the lock files could not be removed.
   */
  void release() throws IOException;

  /**
   * Same as {@link #release()} but does nothing if the lease is already released.
   */
  void close() throws IOException;

  boolean isReleased();

  /**
   * @return {@code true} if the lock was lost involuntarily.
   */
  boolean isCompromised();
}
