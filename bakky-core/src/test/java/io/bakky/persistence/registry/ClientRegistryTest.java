package io.bakky.persistence.registry;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ClientRegistryTest {

  private static final class FakeClient implements AutoCloseable {
    final String uri;
    boolean closed;
    final boolean failOnClose;

    FakeClient(String uri, boolean failOnClose) {
      this.uri = uri;
      this.failOnClose = failOnClose;
    }

    @Override
    public void close() throws Exception {
      closed = true;
      if (failOnClose) throw new Exception("socket already gone");
    }
  }

  @Test
  void sameKey_sharesOneClient_underConcurrency() throws Exception {
    ClientRegistry<FakeClient> r = new ClientRegistry<>("test");
    AtomicInteger created = new AtomicInteger();
    int threads = 16;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<FakeClient>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return r.getOrCreate("mongodb://h:27017", k -> {
            created.incrementAndGet();
            return new FakeClient(k, false);
          });
        }));
      }
      start.countDown();
      FakeClient first = futures.get(0).get(5, TimeUnit.SECONDS);
      for (var f : futures) assertSame(first, f.get(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, created.get());
    assertEquals(1, r.size());
  }

  @Test
  void failingFactory_storesNothing() {
    ClientRegistry<FakeClient> r = new ClientRegistry<>("test");
    assertThrows(IllegalStateException.class, () -> r.getOrCreate("k", k -> {
      throw new IllegalStateException("handshake failed");
    }));
    assertFalse(r.contains("k"));

    FakeClient c = r.getOrCreate("k", k -> new FakeClient(k, false));
    assertSame(c, r.get("k").orElseThrow());
  }

  @Test
  void closeAll_drainsAndClosesEvenWhenOneFails() {
    ClientRegistry<FakeClient> r = new ClientRegistry<>("test");
    FakeClient a = r.getOrCreate("a", k -> new FakeClient(k, false));
    FakeClient b = r.getOrCreate("b", k -> new FakeClient(k, true));

    int closed = r.closeAll();

    assertEquals(1, closed);
    assertTrue(a.closed);
    assertTrue(b.closed);
    assertEquals(0, r.size());
  }

  @Test
  void remove_closesOnlyThatClient() {
    ClientRegistry<FakeClient> r = new ClientRegistry<>("test");
    FakeClient a = r.getOrCreate("a", k -> new FakeClient(k, false));
    FakeClient b = r.getOrCreate("b", k -> new FakeClient(k, false));

    assertTrue(r.remove("a"));
    assertFalse(r.remove("a"));
    assertTrue(a.closed);
    assertFalse(b.closed);
  }

  @Test
  void redact_hidesCredentials() {
    assertEquals("mongodb://***@db:27017", ClientRegistry.redact("mongodb://u:p@db:27017"));
    assertEquals("redis://cache:6379", ClientRegistry.redact("redis://cache:6379"));
  }

  @Test
  void credentialKey_splitsClientsThatDifferOnlyInSecrets() {
    ClientRegistry<FakeClient> r = new ClientRegistry<>("test");
    String first = ClientRegistry.credentialKey("redis://cache:6379/0", "pw-one");
    String second = ClientRegistry.credentialKey("redis://cache:6379/0", "pw-two");

    FakeClient a = r.getOrCreate(first, k -> new FakeClient(k, false));
    FakeClient b = r.getOrCreate(second, k -> new FakeClient(k, false));

    assertNotSame(a, b);
    assertEquals(2, r.size());
    assertEquals("redis://cache:6379/0", ClientRegistry.credentialKey("redis://cache:6379/0", (String) null));
    assertEquals("redis://cache:6379/0", ClientRegistry.redact(first));
    assertFalse(first.contains("pw-one"));
  }
}
