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
 * Signals that a locking operation has gone wrong. The {@link Kind} tells callers what happened without having to
 * parse the message.
 */
public class LockException extends IOException {

  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** The lock is held by someone else and is not stale, or this manager already holds it. */
    LOCK_HELD,
    /** Unlock was requested for a file this manager does not hold. */
    NOT_ACQUIRED,
    /** The lease was released before. */
    ALREADY_RELEASED,
    /** The lock could not be renewed within the stale threshold. */
    UPDATE_TIMEOUT,
    /** The ownership token on disk is not ours anymore, somebody reclaimed the lock. */
    OWNERSHIP_MISMATCH
  }

  private final Kind kind;

  private final File file;

  public LockException(Kind kind, File file, String msg) {
    super(msg + ": " + file);
    this.kind = kind;
    this.file = file;
  }

  public LockException(Kind kind, File file, String msg, Throwable cause) {
    this(kind, file, msg);
    initCause(cause);
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * @return the (resolved) file the lock was requested for.
   */
  public File getFile() {
    return file;
  }
}
