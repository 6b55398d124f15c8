package com.codeheadsystems.lockbox.crypto.secret;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SecretTest {

  @Test
  void utf8_encodesFreshCopy() {
    Secret secret = Secret.of("héllo");
    byte[] first = secret.utf8();
    first[0] = 0;
    assertThat(secret.utf8()).isEqualTo("héllo".getBytes(UTF_8));
  }

  @Test
  void of_copiesCallerArray() {
    char[] chars = {'a', 'b'};
    Secret secret = Secret.of(chars);
    chars[0] = 'z';
    assertThat(secret.utf8()).isEqualTo("ab".getBytes(UTF_8));
  }

  @Test
  void destroy_blocksFurtherUse() {
    Secret secret = Secret.of("password");
    Secret copy = secret.copy();
    secret.destroy();
    assertThat(secret.isDestroyed()).isTrue();
    assertThatThrownBy(secret::utf8).isInstanceOf(IllegalStateException.class);
    assertThat(copy.length()).isEqualTo(8);
  }

  @Test
  void toString_isRedacted() {
    assertThat(Secret.of("password").toString()).doesNotContain("password");
  }

  @Test
  void of_rejectsNull() {
    assertThatThrownBy(() -> Secret.of((String) null)).isInstanceOf(IllegalArgumentException.class);
  }
}
