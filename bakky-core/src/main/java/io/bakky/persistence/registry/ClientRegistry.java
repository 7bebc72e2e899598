package io.bakky.persistence.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-wide cache of live clients keyed by connection URI.\n
 *
 * - insert-if-absent is atomic: concurrent callers for one key share a single client\n
 * - a factory that throws stores nothing, the next call retries\n
 * - {@link #closeAll()} drains the registry; owners call it on shutdown\n
 *
 * Owned by the composition root and injected, never a static singleton.
 */
public final class ClientRegistry<C extends AutoCloseable> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ClientRegistry.class);
  private static final String FINGERPRINT = "#cred=";

  private final String name;
  private final ConcurrentHashMap<String, C> clients = new ConcurrentHashMap<>();

  public ClientRegistry(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String name() { return name; }

  public C getOrCreate(String key, Function<String, ? extends C> factory) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(factory, "factory");
    return clients.computeIfAbsent(key, k -> {
      C created = factory.apply(k);
      if (created == null) throw new IllegalStateException("Client factory returned null for registry " + name);
      log.debug("bakky.registry op=CREATE registry={} size={}", name, clients.size() + 1);
      return created;
    });
  }

  public Optional<C> get(String key) {
    return Optional.ofNullable(clients.get(key));
  }

  public boolean contains(String key) {
    return clients.containsKey(key);
  }

  public int size() { return clients.size(); }

  public Set<String> keys() { return Set.copyOf(clients.keySet()); }

  /** Removes and closes one client. Returns false if nothing was registered under the key. */
  public boolean remove(String key) {
    C c = clients.remove(key);
    if (c == null) return false;
    closeQuietly(key, c);
    return true;
  }

  /**
   * Drains and closes every registered client.
   *
   * @return number of clients closed without error
   */
  public int closeAll() {
    List<Map.Entry<String, C>> drained = new ArrayList<>();
    for (String key : clients.keySet()) {
      C c = clients.remove(key);
      if (c != null) drained.add(Map.entry(key, c));
    }
    int closed = 0;
    for (var e : drained) {
      if (closeQuietly(e.getKey(), e.getValue())) closed++;
    }
    log.info("bakky.registry op=CLOSE_ALL registry={} closed={} failed={}", name, closed, drained.size() - closed);
    return closed;
  }

  @Override
  public void close() {
    closeAll();
  }

  private boolean closeQuietly(String key, C client) {
    try {
      client.close();
      return true;
    } catch (Exception e) {
      log.warn("bakky.registry op=CLOSE registry={} key={} failed", name, redact(key), e);
      return false;
    }
  }

  /**
   * Registry key for a client whose credentials are not all carried by its URI. Appends a SHA-256
   * fingerprint of the secrets so clients that differ only in credentials never share an entry;
   * returns {@code base} unchanged when no secret is set.
   */
  public static String credentialKey(String base, String... secrets) {
    Objects.requireNonNull(base, "base");
    boolean any = false;
    for (String s : secrets) any |= s != null && !s.isEmpty();
    if (!any) return base;
    MessageDigest md;
    try {
      md = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
    for (String s : secrets) {
      if (s != null) md.update(s.getBytes(StandardCharsets.UTF_8));
      md.update((byte) 0);
    }
    return base + FINGERPRINT + HexFormat.of().formatHex(md.digest(), 0, 12);
  }

  /** Strips user info and credential fingerprints from URI-like keys before they reach a log line. */
  public static String redact(String key) {
    if (key == null) return "null";
    int fp = key.indexOf(FINGERPRINT);
    if (fp >= 0) key = key.substring(0, fp);
    int scheme = key.indexOf("://");
    int at = key.lastIndexOf('@');
    if (scheme < 0 || at < scheme) return key;
    return key.substring(0, scheme + 3) + "***@" + key.substring(at + 1);
  }
}
