package io.takari.lockfile.internal;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * The files representing a lock on {@code foo}: the directory {@code foo.lock}, whose existence means "held" and whose
 * modification time is the heartbeat, and {@code foo.lock/.uid} holding the ownership token. <strong>Note:</strong>
 * Nothing here is atomic except {@link #create(String)} winning or losing against a concurrent creator.
 */
class LockArtifact {

  static final String LOCK_SUFFIX = ".lock";

  static final String UID_FILE = ".uid";

  private final FileOperations fileOperations;
  private final File dataFile;
  private final Path lockDirectory;
  private final Path uidFile;

  LockArtifact(FileOperations fileOperations, File dataFile) {
    this.fileOperations = fileOperations;
    this.dataFile = dataFile;
    this.lockDirectory = new File(dataFile.getPath() + LOCK_SUFFIX).toPath();
    this.uidFile = lockDirectory.resolve(UID_FILE);
  }

  File getDataFile() {
    return dataFile;
  }

  /**
   * Creates the lock directory and stores the token in it.
   *
   * @return {@code false} if the lock directory exists already.
   * @throws TokenWriteException if the directory was created but the token could not be written. The directory is
   *           removed again before this is thrown.
   */
  boolean create(String uid) throws IOException {
    try {
      fileOperations.mkdir(lockDirectory);
    } catch (FileAlreadyExistsException e) {
      return false;
    }

    try {
      fileOperations.writeString(uidFile, uid);
    } catch (IOException e) {
      try {
        remove();
      } catch (IOException e1) {
        e.addSuppressed(e1);
      }
      throw new TokenWriteException(e);
    }
    return true;
  }

  long lastModified() throws IOException {
    return fileOperations.lastModified(lockDirectory);
  }

  void touch(long millis) throws IOException {
    fileOperations.touch(lockDirectory, millis);
  }

  String readUid() throws IOException {
    return fileOperations.readString(uidFile).trim();
  }

  /**
   * Deletes the token file, then the directory. Either being gone already is fine.
   */
  void remove() throws IOException {
    try {
      fileOperations.unlink(uidFile);
    } catch (NoSuchFileException e) {
      // already gone
    }
    try {
      fileOperations.rmdir(lockDirectory);
    } catch (NoSuchFileException e) {
      // already gone
    }
  }

  @Override
  public String toString() {
    return lockDirectory.toString();
  }

  /**
   * Wraps the failure to write the ownership token, which is never worth a retry.
   */
  static class TokenWriteException extends IOException {

    private static final long serialVersionUID = 1L;

    TokenWriteException(IOException cause) {
      super(cause.getMessage(), cause);
    }
  }
}
