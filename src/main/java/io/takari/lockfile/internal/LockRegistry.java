package io.takari.lockfile.internal;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The leases held through one manager, keyed by resolved file. At most one lease per file. All access is serialized on
 * the registry itself and never spans filesystem calls.
 */
class LockRegistry {

  private final Map<File, FileLease> leases = new HashMap<File, FileLease>(64);

  synchronized boolean contains(File file) {
    return leases.containsKey(file);
  }

  synchronized FileLease get(File file) {
    return leases.get(file);
  }

  /**
   * @return {@code false} if another lease is registered for the same file.
   */
  synchronized boolean register(FileLease lease) {
    if (leases.containsKey(lease.getFile())) {
      return false;
    }
    leases.put(lease.getFile(), lease);
    return true;
  }

  /**
   * Removes the lease only if it is the one registered for its file.
   */
  synchronized boolean remove(FileLease lease) {
    if (leases.get(lease.getFile()) == lease) {
      leases.remove(lease.getFile());
      return true;
    }
    return false;
  }

  synchronized List<FileLease> leases() {
    return new ArrayList<FileLease>(leases.values());
  }

  synchronized boolean isEmpty() {
    return leases.isEmpty();
  }
}
