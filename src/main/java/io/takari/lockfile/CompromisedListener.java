package io.takari.lockfile;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.IOException;

/**
 * Notified when a held lock is lost involuntarily, i.e. it could not be renewed in time, its files were removed or
 * another party reclaimed it. Invoked at most once per lease, from a renewal thread. By the time this is called the
 * lease is already released.
 * <p>
 * Exceptions thrown from {@link #compromised(Lease, IOException)} are handed to the renewal thread's uncaught exception
 * handler.
 */
public interface CompromisedListener {

  void compromised(Lease lease, IOException cause);
}
