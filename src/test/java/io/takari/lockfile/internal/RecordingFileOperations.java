package io.takari.lockfile.internal;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts calls into the filesystem and injects failures.
 */
class RecordingFileOperations extends DefaultFileOperations {

  final AtomicInteger mkdirs = new AtomicInteger();

  final AtomicInteger touches = new AtomicInteger();

  final AtomicInteger stats = new AtomicInteger();

  volatile IOException writeFailure;

  volatile IOException touchFailure;

  volatile long touchDelay;

  /** Next mkdir reports contention and the following stat reports the lock as gone. */
  volatile boolean vanishOnce;

  @Override
  public void mkdir(Path directory) throws IOException {
    mkdirs.incrementAndGet();
    if (vanishOnce) {
      throw new FileAlreadyExistsException(directory.toString());
    }
    super.mkdir(directory);
  }

  @Override
  public void writeString(Path file, String data) throws IOException {
    IOException failure = writeFailure;
    if (failure != null) {
      throw failure;
    }
    super.writeString(file, data);
  }

  @Override
  public long lastModified(Path path) throws IOException {
    stats.incrementAndGet();
    if (vanishOnce) {
      vanishOnce = false;
      throw new NoSuchFileException(path.toString());
    }
    return super.lastModified(path);
  }

  @Override
  public void touch(Path path, long millis) throws IOException {
    touches.incrementAndGet();
    long delay = touchDelay;
    if (delay > 0) {
      touchDelay = 0;
      try {
        Thread.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    IOException failure = touchFailure;
    if (failure != null) {
      throw failure;
    }
    super.touch(path, millis);
  }
}
