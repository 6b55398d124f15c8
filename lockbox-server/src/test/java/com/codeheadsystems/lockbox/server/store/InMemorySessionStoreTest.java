package com.codeheadsystems.lockbox.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.codeheadsystems.lockbox.server.auth.TokenStage;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemorySessionStoreTest {

  private InMemorySessionStore store;

  @BeforeEach
  void setUp() {
    store = new InMemorySessionStore();
  }

  @Test
  void storeAndLoad_roundTrip() {
    SessionData data = new SessionData("alice", TokenStage.FULL, Instant.now(), Instant.now().plusSeconds(3600));
    store.store("jti-1", data);

    assertThat(store.load("jti-1")).contains(data);
  }

  @Test
  void load_notFound_returnsEmpty() {
    assertThat(store.load("nonexistent")).isEmpty();
  }

  @Test
  void load_expired_returnsEmpty() {
    SessionData data = new SessionData("alice", TokenStage.FULL,
        Instant.now().minusSeconds(7200), Instant.now().minusSeconds(3600));
    store.store("jti-expired", data);

    assertThat(store.load("jti-expired")).isEmpty();
  }

  @Test
  void revoke_removesSession() {
    store.store("jti-2", new SessionData("alice", TokenStage.PASSWORD, Instant.now(), Instant.now().plusSeconds(60)));
    store.revoke("jti-2");

    assertThat(store.load("jti-2")).isEmpty();
  }

  @Test
  void revoke_unknownJti_isIgnored() {
    assertThatCode(() -> store.revoke("never-issued")).doesNotThrowAnyException();
  }
}
