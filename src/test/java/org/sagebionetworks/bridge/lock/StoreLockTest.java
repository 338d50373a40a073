package org.sagebionetworks.bridge.lock;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.time.Duration;

import org.mockito.InOrder;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import org.sagebionetworks.bridge.lock.exceptions.InvalidArgumentException;
import org.sagebionetworks.bridge.lock.exceptions.LockAcquiringException;
import org.sagebionetworks.bridge.lock.exceptions.LockConflictedException;
import org.sagebionetworks.bridge.lock.exceptions.LockReleasingException;
import org.sagebionetworks.bridge.lock.exceptions.LockStorageException;
import org.sagebionetworks.bridge.lock.store.AdvisoryLockStore;
import org.sagebionetworks.bridge.lock.store.PersistingStore;

public class StoreLockTest {
    private static final Duration TTL = Duration.ofSeconds(30);
    private static final int RETRY_DELAY_MILLIS = 11;

    private Key key;

    @BeforeMethod
    public void before() {
        key = new Key("key");
    }

    @Test
    public void testAcquire() {
        PersistingStore store = mock(PersistingStore.class);
        StoreLock lock = new StoreLock(key, store, TTL, true, RETRY_DELAY_MILLIS);

        assertTrue(lock.acquire(false));
        InOrder inOrder = inOrder(store);
        inOrder.verify(store, times(1)).save(key);
        inOrder.verify(store, times(1)).putOffExpiration(key, TTL);
    }

    @Test
    public void testAcquireWithoutTtl() {
        PersistingStore store = mock(PersistingStore.class);
        StoreLock lock = new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS);

        assertTrue(lock.acquire(false));
        verify(store, never()).putOffExpiration(any(), any());
    }

    @Test
    public void testAcquireConflicted() {
        PersistingStore store = mock(PersistingStore.class);
        doThrow(new LockConflictedException("key")).when(store).save(key);
        StoreLock lock = new StoreLock(key, store, TTL, true, RETRY_DELAY_MILLIS);

        assertFalse(lock.acquire(false));
        verify(store, never()).putOffExpiration(any(), any());
    }

    @Test
    public void testAcquireBlockingWaitsOnBlockingStore() {
        AdvisoryLockStore store = mock(AdvisoryLockStore.class);
        StoreLock lock = new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS);

        assertTrue(lock.acquire(true));
        verify(store).waitAndSave(key);
        verify(store, never()).save(key);
    }

    @Test
    public void testAcquireBlockingRetriesOnOtherStores() {
        PersistingStore store = mock(PersistingStore.class);
        doThrow(new LockConflictedException("key")).doThrow(new LockConflictedException("key")).doNothing()
                .when(store).save(key);
        StoreLock lock = new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS);

        assertTrue(lock.acquire(true));
        verify(store, times(3)).save(key);
    }

    @Test(expectedExceptions = LockConflictedException.class)
    public void testAcquireBlockingRethrowsConflict() {
        AdvisoryLockStore store = mock(AdvisoryLockStore.class);
        doThrow(new LockConflictedException("key")).when(store).waitAndSave(key);
        new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS).acquire(true);
    }

    @Test
    public void testAcquireWrapsStorageFailure() {
        PersistingStore store = mock(PersistingStore.class);
        LockStorageException cause = new LockStorageException("connection lost");
        doThrow(cause).when(store).save(key);
        StoreLock lock = new StoreLock(key, store, TTL, true, RETRY_DELAY_MILLIS);

        try {
            lock.acquire(false);
            fail("LockAcquiringException expected.");
        } catch (LockAcquiringException e) {
            assertSame(e.getCause(), cause);
        }
    }

    @Test(expectedExceptions = InvalidArgumentException.class)
    public void testAcquireDoesNotWrapConfigurationError() {
        PersistingStore store = mock(PersistingStore.class);
        doThrow(new InvalidArgumentException("unsupported driver")).when(store).save(key);
        new StoreLock(key, store, TTL, true, RETRY_DELAY_MILLIS).acquire(false);
    }

    @Test
    public void testAcquireRead() {
        AdvisoryLockStore store = mock(AdvisoryLockStore.class);
        StoreLock lock = new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS);

        assertTrue(lock.acquireRead(false));
        verify(store).saveRead(key);

        assertTrue(lock.acquireRead(true));
        verify(store).waitAndSaveRead(key);
    }

    @Test
    public void testAcquireReadConflicted() {
        AdvisoryLockStore store = mock(AdvisoryLockStore.class);
        doThrow(new LockConflictedException("key")).when(store).saveRead(key);

        assertFalse(new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS).acquireRead(false));
    }

    @Test
    public void testAcquireReadFallsBackToExclusiveLock() {
        PersistingStore store = mock(PersistingStore.class);
        StoreLock lock = new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS);

        assertTrue(lock.acquireRead(false));
        verify(store).save(key);
    }

    @Test(expectedExceptions = InvalidArgumentException.class)
    public void testRefreshWithoutTtl() {
        PersistingStore store = mock(PersistingStore.class);
        new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS).refresh();
    }

    @Test(expectedExceptions = LockConflictedException.class)
    public void testRefreshOfLostLock() {
        PersistingStore store = mock(PersistingStore.class);
        doThrow(new LockConflictedException("key")).when(store).putOffExpiration(key, TTL);
        new StoreLock(key, store, TTL, true, RETRY_DELAY_MILLIS).refresh();
    }

    @Test
    public void testIsAcquired() {
        PersistingStore store = mock(PersistingStore.class);
        when(store.exists(key)).thenReturn(true, false);
        StoreLock lock = new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS);

        assertTrue(lock.isAcquired());
        assertFalse(lock.isAcquired());
    }

    @Test
    public void testRelease() {
        PersistingStore store = mock(PersistingStore.class);
        when(store.exists(key)).thenReturn(false);
        StoreLock lock = new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS);

        lock.release();
        InOrder inOrder = inOrder(store);
        inOrder.verify(store).delete(key);
        inOrder.verify(store).exists(key);
    }

    @Test(expectedExceptions = LockReleasingException.class)
    public void testReleaseWhenStillLocked() {
        PersistingStore store = mock(PersistingStore.class);
        when(store.exists(key)).thenReturn(true);
        new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS).release();
    }

    @Test
    public void testReleaseWrapsStorageFailure() {
        PersistingStore store = mock(PersistingStore.class);
        LockStorageException cause = new LockStorageException("connection lost");
        doThrow(cause).when(store).delete(key);

        try {
            new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS).release();
            fail("LockReleasingException expected.");
        } catch (LockReleasingException e) {
            assertSame(e.getCause(), cause);
        }
    }

    @Test
    public void testCloseReleasesAcquiredLock() {
        PersistingStore store = mock(PersistingStore.class);
        when(store.exists(key)).thenReturn(true, false);
        StoreLock lock = new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS);

        lock.acquire(false);
        lock.close();
        verify(store).delete(key);
    }

    @Test
    public void testCloseWithoutAutoRelease() {
        PersistingStore store = mock(PersistingStore.class);
        StoreLock lock = new StoreLock(key, store, null, false, RETRY_DELAY_MILLIS);

        lock.acquire(false);
        lock.close();
        verify(store, never()).delete(key);
    }

    @Test
    public void testCloseOfLockNeverAcquired() {
        PersistingStore store = mock(PersistingStore.class);
        new StoreLock(key, store, null, true, RETRY_DELAY_MILLIS).close();
        verify(store, never()).exists(key);
        verify(store, never()).delete(key);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRetryDelayMustExceedJitter() {
        new StoreLock(key, mock(PersistingStore.class), null, true, StoreLock.RETRY_JITTER_MILLIS);
    }
}
