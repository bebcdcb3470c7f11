package io.takari.lockfile.internal;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.IOException;
import java.nio.file.Path;

/**
 * The filesystem primitives the lock protocol is built on. Every operation reports a missing entry with
 * {@link java.nio.file.NoSuchFileException}.
 */
public interface FileOperations {

  /**
   * Atomically creates a directory.
   *
   * @throws java.nio.file.FileAlreadyExistsException if something exists at that path.
   */
  void mkdir(Path directory) throws IOException;

  void rmdir(Path directory) throws IOException;

  void writeString(Path file, String data) throws IOException;

  String readString(Path file) throws IOException;

  void unlink(Path file) throws IOException;

  /**
   * @return the modification time in milliseconds since the epoch.
   */
  long lastModified(Path path) throws IOException;

  void touch(Path path, long millis) throws IOException;

  /**
   * @return the absolute path with all symbolic links resolved.
   */
  Path realPath(Path path) throws IOException;
}
