package com.codeheadsystems.lockbox.server.store;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired sessions are lazily evicted on {@link #load}. All sessions are lost on
 * server restart. Suitable for development and integration testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, SessionData> store = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  public InMemorySessionStore(final Clock clock) {
    this.clock = clock;
  }

  @Override
  public void store(final String jti, final SessionData sessionData) {
    store.put(jti, sessionData);
    log.debug("Stored session jti={}", jti);
  }

  @Override
  public Optional<SessionData> load(final String jti) {
    SessionData data = store.get(jti);
    if (data == null) {
      return Optional.empty();
    }
    if (data.expiresAt().isBefore(clock.instant())) {
      store.remove(jti);
      return Optional.empty();
    }
    return Optional.of(data);
  }

  @Override
  public void revoke(final String jti) {
    store.remove(jti);
    log.debug("Revoked session jti={}", jti);
  }
}
