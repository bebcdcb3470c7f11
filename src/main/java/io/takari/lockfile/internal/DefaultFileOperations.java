package io.takari.lockfile.internal;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import javax.inject.Named;
import javax.inject.Singleton;

/**
 * {@link FileOperations} on the default filesystem.
 */
@Named
@Singleton
public class DefaultFileOperations implements FileOperations {

  public void mkdir(Path directory) throws IOException {
    Files.createDirectory(directory);
  }

  public void rmdir(Path directory) throws IOException {
    Files.delete(directory);
  }

  public void writeString(Path file, String data) throws IOException {
    Files.write(file, data.getBytes(StandardCharsets.UTF_8));
  }

  public String readString(Path file) throws IOException {
    return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
  }

  public void unlink(Path file) throws IOException {
    Files.delete(file);
  }

  public long lastModified(Path path) throws IOException {
    return Files.getLastModifiedTime(path, LinkOption.NOFOLLOW_LINKS).toMillis();
  }

  public void touch(Path path, long millis) throws IOException {
    Files.setLastModifiedTime(path, FileTime.fromMillis(millis));
  }

  public Path realPath(Path path) throws IOException {
    return path.toRealPath();
  }
}
