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

/**
 * Maps the files callers hand in to the identity of their lock, so different spellings of one file share one lock.
 */
class PathResolver {

  private final FileOperations fileOperations;

  PathResolver(FileOperations fileOperations) {
    this.fileOperations = fileOperations;
  }

  /**
   * @param resolveSymlinks if {@code true} symbolic links are followed and the file must exist, otherwise the path is
   *          only made absolute and normalized.
   * @throws java.nio.file.NoSuchFileException if links are to be resolved and the file does not exist.
   */
  File resolve(File file, boolean resolveSymlinks) throws IOException {
    if (!resolveSymlinks) {
      return file.toPath().toAbsolutePath().normalize().toFile();
    }
    return fileOperations.realPath(file.toPath()).toFile();
  }
}
