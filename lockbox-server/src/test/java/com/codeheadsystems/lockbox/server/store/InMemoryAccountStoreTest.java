package com.codeheadsystems.lockbox.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.Test;

class InMemoryAccountStoreTest {

  private final InMemoryAccountStore store = new InMemoryAccountStore();

  @Test
  void create_refusesDuplicateUsername() {
    assertThat(store.create(Account.registered("alice", new byte[16], new byte[32]))).isTrue();
    assertThat(store.create(Account.registered("alice", new byte[16], new byte[32]))).isFalse();
  }

  @Test
  void update_appliesMutation() {
    store.create(Account.registered("alice", new byte[16], new byte[32]));

    Account updated = store.update("alice", a -> a.withPendingMfa("SECRET", Set.of("h1"))).orElseThrow();

    assertThat(updated.pendingTotpSecret()).isEqualTo("SECRET");
    assertThat(updated.mfaEnabled()).isFalse();
    assertThat(store.load("alice")).contains(updated);
  }

  @Test
  void update_unknownAccount_isEmpty() {
    assertThat(store.update("ghost", Account::withoutMfa)).isEmpty();
  }

  @Test
  void account_copiesArraysAndHidesThemFromToString() {
    byte[] verifier = new byte[32];
    Account account = Account.registered("alice", new byte[16], verifier);
    verifier[0] = 1;

    assertThat(account.verifier()[0]).isZero();
    assertThat(account.toString()).isEqualTo("Account[username=alice, mfaEnabled=false]");
  }

  @Test
  void account_mfaLifecycle() {
    Account account = Account.registered("alice", new byte[16], new byte[32])
        .withPendingMfa("SECRET", Set.of("h1", "h2"))
        .withPendingMfaActivated();

    assertThat(account.mfaEnabled()).isTrue();
    assertThat(account.totpSecret()).isEqualTo("SECRET");
    assertThat(account.backupCodeHashes()).containsExactlyInAnyOrder("h1", "h2");
    assertThat(account.withoutBackupCode("h1").backupCodeHashes()).containsExactly("h2");
    assertThat(account.withoutMfa().mfaEnabled()).isFalse();
  }
}
