package com.codeheadsystems.lockbox.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codahale.metrics.health.HealthCheck;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(DropwizardExtensionsSupport.class)
class LockboxBundleIntegrationTest {

  static final DropwizardAppExtension<LockboxConfiguration> APP =
      new DropwizardAppExtension<>(
          LockboxApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  @Test
  void tokenSigningHealthCheck_isRegisteredAndHealthy() {
    HealthCheck.Result result = APP.getEnvironment().healthChecks().runHealthCheck("token-signing");

    assertThat(result.isHealthy()).isTrue();
  }

  @Test
  void configuration_isBoundFromYaml() {
    assertThat(APP.getConfiguration().getTokenIssuer()).isEqualTo("lockbox-test");
    assertThat(APP.getConfiguration().getTokenTtlSeconds()).isEqualTo(600);
    assertThat(APP.getConfiguration().getTotpIssuer()).isEqualTo("Lockbox Test");
  }

  @Test
  void malformedRegistration_is400WithDetail() throws Exception {
    HttpResponse<String> response = HttpClient.newHttpClient().send(HttpRequest.newBuilder()
            .uri(URI.create(String.format("http://localhost:%d/register", APP.getLocalPort())))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString("{\"username\":\"bob\",\"salt\":\"zz\",\"verifier\":\"00\"}"))
            .build(),
        HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(response.body()).contains("\"detail\"");
  }
}
