package com.codeheadsystems.lockbox.crypto.secret;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PasswordGeneratorTest {

  private final PasswordGenerator generator = new PasswordGenerator();

  private static String text(Secret secret) {
    return new String(secret.utf8(), UTF_8);
  }

  @Test
  void generate_defaultsAreAlwaysStrong() {
    for (int i = 0; i < 100; i++) {
      Secret secret = generator.generate();
      assertThat(secret.length()).isEqualTo(16);
      assertThat(PasswordPolicy.isStrong(secret)).isTrue();
    }
  }

  @Test
  void generate_respectsDisabledClasses() {
    String upperOnly = text(generator.generate(new PasswordGenerator.Options(20, false, true, false, false)));
    assertThat(upperOnly).hasSize(20).matches("[A-Z]+");

    String digitsOnly = text(generator.generate(new PasswordGenerator.Options(12, false, false, true, false)));
    assertThat(digitsOnly).matches("[0-9]{12}");

    String symbolsOnly = text(generator.generate(new PasswordGenerator.Options(12, false, false, false, true)));
    assertThat(symbolsOnly.chars()).allMatch(c -> PasswordPolicy.SYMBOLS.indexOf(c) >= 0);
  }

  @Test
  void generate_noClassesGivesEmpty() {
    assertThat(generator.generate(new PasswordGenerator.Options(16, false, false, false, false)).isEmpty())
        .isTrue();
  }

  @Test
  void generate_clampsLengthToOne() {
    assertThat(generator.generate(new PasswordGenerator.Options(0, true, true, true, true)).length())
        .isEqualTo(1);
  }

  @Test
  void generate_shorterThanClassCountKeepsLength() {
    String two = text(generator.generate(new PasswordGenerator.Options(2, true, true, true, true)));
    assertThat(two).hasSize(2);
  }

  @Test
  void generate_exactlyClassCountHasOneOfEach() {
    for (int i = 0; i < 20; i++) {
      String four = text(generator.generate(new PasswordGenerator.Options(4, true, true, true, false)));
      assertThat(four).hasSize(4).containsPattern("[a-z]").containsPattern("[A-Z]").containsPattern("[0-9]");
    }
  }
}
