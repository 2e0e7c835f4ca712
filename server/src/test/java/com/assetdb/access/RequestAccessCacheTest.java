package com.assetdb.access;

import static org.junit.jupiter.api.Assertions.*;

import com.assetdb.common.status.Status;
import com.assetdb.common.status.StatusOr;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

public class RequestAccessCacheTest {

  private final RequestAccessCache cache = new RequestAccessCache();

  private static Supplier<StatusOr<FolderAccess>> counting(
      AtomicInteger calls, StatusOr<FolderAccess> outcome) {
    return () -> {
      calls.incrementAndGet();
      return outcome;
    };
  }

  @Test
  void testGrantIsResolvedOnce() {
    AtomicInteger calls = new AtomicInteger();
    StatusOr<FolderAccess> granted = StatusOr.ofValue(FolderAccess.unrestricted());

    cache.getOrResolve("demo", AccessType.READ, counting(calls, granted));
    StatusOr<FolderAccess> second =
        cache.getOrResolve("Demo", AccessType.READ, counting(calls, granted));

    assertEquals(1, calls.get());
    assertEquals(granted, second);
  }

  @Test
  void testDenialIsCached() {
    AtomicInteger calls = new AtomicInteger();
    StatusOr<FolderAccess> denied = StatusOr.ofStatus(Status.permissionDenied("no"));

    cache.getOrResolve("demo", AccessType.UPDATE, counting(calls, denied));
    StatusOr<FolderAccess> second =
        cache.getOrResolve("demo", AccessType.UPDATE, counting(calls, denied));

    assertEquals(1, calls.get());
    assertTrue(second.getStatus().isPermissionDenied());
  }

  @Test
  void testTransientFailureIsNotCached() {
    AtomicInteger calls = new AtomicInteger();
    StatusOr<FolderAccess> unavailable = StatusOr.ofStatus(Status.unavailable("down", null));

    cache.getOrResolve("demo", AccessType.READ, counting(calls, unavailable));
    cache.getOrResolve("demo", AccessType.READ, counting(calls, unavailable));

    assertEquals(2, calls.get());
    assertEquals(0, cache.size());
  }

  @Test
  void testKeysAreProjectAndAccessType() {
    AtomicInteger calls = new AtomicInteger();
    StatusOr<FolderAccess> granted = StatusOr.ofValue(FolderAccess.unrestricted());

    cache.getOrResolve("demo", AccessType.READ, counting(calls, granted));
    cache.getOrResolve("demo", AccessType.UPDATE, counting(calls, granted));
    cache.getOrResolve("other", AccessType.READ, counting(calls, granted));

    assertEquals(3, calls.get());
    cache.clear();
    assertEquals(0, cache.size());
  }
}
