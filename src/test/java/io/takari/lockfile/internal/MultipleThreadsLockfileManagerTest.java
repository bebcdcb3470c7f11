package io.takari.lockfile.internal;

/*******************************************************************************
 * Copyright (c) 2010-2013 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import static io.takari.lockfile.TestFileUtils.lockDirectory;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import io.takari.lockfile.Lease;
import io.takari.lockfile.LockException;
import io.takari.lockfile.TestFileUtils;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import edu.umd.cs.mtc.MultithreadedTestCase;
import edu.umd.cs.mtc.TestFramework;

public class MultipleThreadsLockfileManagerTest {

  private DefaultLockfileManager manager;

  private DefaultLockfileManager other;

  private File dir;

  @Before
  public void setup() throws IOException {
    manager = new DefaultLockfileManager();
    other = new DefaultLockfileManager();
    dir = TestFileUtils.createTempDir(getClass().getSimpleName());
  }

  @After
  public void tearDown() throws Exception {
    manager.shutdown();
    other.shutdown();
    if (dir != null) {
      TestFileUtils.delete(dir);
    }
  }

  @Test
  public void testLockBlocksOtherManagerUntilReleased() throws Throwable {
    final File file = TestFileUtils.createTempFile(dir, "file");

    TestFramework.runOnce(new MultithreadedTestCase() {
      public void thread1() throws IOException {
        Lease lease = manager.lock(file);
        waitForTick(2);
        lease.release();
      }

      public void thread2() throws IOException {
        waitForTick(1);
        try {
          other.lock(file);
          fail("lock acquired while held by thread1");
        } catch (LockException e) {
          assertEquals(LockException.Kind.LOCK_HELD, e.getKind());
        }
        waitForTick(3);
        other.lock(file).release();
      }
    });
  }

  @Test
  public void testLockBlocksOtherThreadOfSameManager() throws Throwable {
    final File file = TestFileUtils.createTempFile(dir, "file");

    TestFramework.runOnce(new MultithreadedTestCase() {
      private Lease lease;

      public void thread1() throws IOException {
        lease = manager.lock(file);
        waitForTick(2);
      }

      public void thread2() throws IOException {
        waitForTick(1);
        try {
          manager.lock(file);
          fail("lock acquired twice in one manager");
        } catch (LockException e) {
          assertEquals(LockException.Kind.LOCK_HELD, e.getKind());
        }
      }

      @Override
      public void finish() {
        try {
          manager.unlock(file);
        } catch (IOException e) {
          throw new IllegalStateException(e);
        }
        assertEquals(true, lease.isReleased());
      }
    });
  }

  @Test
  public void testConcurrentLockingHasOneWinner() throws Exception {
    final File file = TestFileUtils.createTempFile(dir, "file");
    final int contenders = 8;
    final CountDownLatch start = new CountDownLatch(1);
    final AtomicInteger held = new AtomicInteger();
    final List<Lease> leases = new ArrayList<Lease>();
    List<DefaultLockfileManager> managers = new ArrayList<DefaultLockfileManager>();
    List<Thread> threads = new ArrayList<Thread>();

    for (int i = 0; i < contenders; i++) {
      final DefaultLockfileManager m = new DefaultLockfileManager();
      managers.add(m);
      Thread thread = new Thread() {
        @Override
        public void run() {
          try {
            start.await();
            Lease lease = m.lock(file);
            held.incrementAndGet();
            synchronized (leases) {
              leases.add(lease);
            }
          } catch (LockException e) {
            assertEquals(LockException.Kind.LOCK_HELD, e.getKind());
          } catch (Exception e) {
            e.printStackTrace();
          }
        }
      };
      threads.add(thread);
      thread.start();
    }

    start.countDown();
    for (Thread thread : threads) {
      thread.join();
    }

    try {
      assertEquals(1, held.get());
    } finally {
      for (Lease lease : leases) {
        lease.release();
      }
      for (DefaultLockfileManager m : managers) {
        m.shutdown();
      }
    }
    assertFalse(lockDirectory(file).exists());
  }
}
