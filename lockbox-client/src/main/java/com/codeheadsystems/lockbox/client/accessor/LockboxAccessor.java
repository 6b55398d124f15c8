package com.codeheadsystems.lockbox.client.accessor;

import com.codeheadsystems.lockbox.client.config.LockboxClientConfig;
import com.codeheadsystems.lockbox.client.exceptions.LockboxAccessorException;
import com.codeheadsystems.lockbox.client.exceptions.RateLimitedException;
import com.codeheadsystems.lockbox.client.model.RateLimited;
import com.codeheadsystems.lockbox.client.model.SessionToken;
import com.codeheadsystems.lockbox.model.AuthSaltResponse;
import com.codeheadsystems.lockbox.model.ErrorDetail;
import com.codeheadsystems.lockbox.model.LoginRequest;
import com.codeheadsystems.lockbox.model.MfaLoginRequest;
import com.codeheadsystems.lockbox.model.MfaSetupResponse;
import com.codeheadsystems.lockbox.model.MfaStatusResponse;
import com.codeheadsystems.lockbox.model.MfaVerifyRequest;
import com.codeheadsystems.lockbox.model.RegisterRequest;
import com.codeheadsystems.lockbox.model.TokenResponse;
import com.codeheadsystems.lockbox.model.VaultEnvelope;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the remote authority's REST endpoints.
 * <p>
 * Handles request serialization, HTTP dispatch, status-code checking and response
 * deserialization. The configured base URI is treated as the server root; path segments are
 * appended per endpoint. The bearer token travels as the plain {@code Authorization} header
 * value.
 * <p>
 * A 401 from any endpoint is surfaced as a {@link SecurityException}, a 429 as a
 * {@link RateLimitedException}. I/O errors, interruptions and other error statuses are wrapped
 * in {@link LockboxAccessorException}.
 */
@Singleton
public class LockboxAccessor {

  /**
   * Wait used when a 429 carries neither a {@code Retry-After} header nor a number in its detail.
   */
  public static final long DEFAULT_RETRY_AFTER_SECONDS = 60;

  private static final Logger log = LoggerFactory.getLogger(LockboxAccessor.class);
  private static final Pattern DIGITS = Pattern.compile("(\\d+)");

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI baseUri;

  /**
   * Instantiates a new Lockbox accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param config       the config
   */
  @Inject
  public LockboxAccessor(final HttpClient httpClient,
                         final ObjectMapper objectMapper,
                         final LockboxClientConfig config) {
    log.info("LockboxAccessor({})", config.baseUri());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.baseUri = config.baseUri();
  }

  // ── Accounts ──────────────────────────────────────────────────────────────

  /**
   * Fetches the public auth salt of an account.
   *
   * @param username the username
   * @return the salt response, empty when the account does not exist (404)
   */
  public Optional<AuthSaltResponse> authSalt(final String username) {
    log.debug("authSalt(username={})", username);
    HttpResponse<String> response = send(get(uri("/auth_salt/" + encode(username)), null));
    if (response.statusCode() == 404) {
      return Optional.empty();
    }
    checkStatus(response);
    return Optional.of(read(response, AuthSaltResponse.class));
  }

  /**
   * Creates an account.
   *
   * @param request the request
   */
  public void register(final RegisterRequest request) {
    log.debug("register(username={})", request.username());
    checkStatus(send(post(uri("/register"), request, null)));
  }

  /**
   * Password login.
   *
   * @param request the request
   * @return the token response
   * @throws SecurityException if the verifier is rejected (401)
   */
  public TokenResponse login(final LoginRequest request) {
    log.debug("login(username={})", request.username());
    HttpResponse<String> response = send(post(uri("/login"), request, null));
    checkStatus(response);
    return read(response, TokenResponse.class);
  }

  /**
   * Login with a second-factor code.
   *
   * @param request the request
   * @return the token response
   * @throws SecurityException if the verifier or the code is rejected (401)
   */
  public TokenResponse loginMfa(final MfaLoginRequest request) {
    log.debug("loginMfa(username={})", request.username());
    HttpResponse<String> response = send(post(uri("/login/mfa"), request, null));
    checkStatus(response);
    return read(response, TokenResponse.class);
  }

  /**
   * Revokes the token on the server.
   *
   * @param token the token
   */
  public void logout(final SessionToken token) {
    log.debug("logout()");
    checkStatus(send(post(uri("/logout"), null, token)));
  }

  // ── Second factor ─────────────────────────────────────────────────────────

  /**
   * Mfa status.
   *
   * @param username the username
   * @return the mfa status response
   */
  public MfaStatusResponse mfaStatus(final String username) {
    log.debug("mfaStatus(username={})", username);
    HttpResponse<String> response = send(get(uri("/mfa/status/" + encode(username)), null));
    checkStatus(response);
    return read(response, MfaStatusResponse.class);
  }

  /**
   * Starts second-factor enrollment.
   *
   * @param token the token
   * @return the mfa setup response
   */
  public MfaSetupResponse mfaSetup(final SessionToken token) {
    log.debug("mfaSetup()");
    HttpResponse<String> response = send(post(uri("/mfa/setup"), null, token));
    checkStatus(response);
    return read(response, MfaSetupResponse.class);
  }

  /**
   * Checks a code. A pending enrollment becomes active when its first code is accepted.
   *
   * @param request the request
   * @throws LockboxAccessorException with status 400 if the code is wrong
   */
  public void mfaVerify(final MfaVerifyRequest request) {
    log.debug("mfaVerify(username={})", request.username());
    checkStatus(send(post(uri("/mfa/verify"), request, null)));
  }

  /**
   * Removes the second factor.
   *
   * @param token the token
   */
  public void mfaDisable(final SessionToken token) {
    log.debug("mfaDisable()");
    checkStatus(send(post(uri("/mfa/disable"), null, token)));
  }

  // ── Vault ─────────────────────────────────────────────────────────────────

  /**
   * Fetches the stored vault.
   *
   * @param token the token
   * @return the envelope, whose blob is null when nothing was stored
   */
  public VaultEnvelope getVault(final SessionToken token) {
    log.debug("getVault()");
    HttpResponse<String> response = send(get(uri("/vault"), token));
    checkStatus(response);
    return read(response, VaultEnvelope.class);
  }

  /**
   * Replaces the stored vault.
   *
   * @param token    the token
   * @param envelope the envelope
   */
  public void putVault(final SessionToken token, final VaultEnvelope envelope) {
    log.debug("putVault()");
    checkStatus(send(post(uri("/vault"), envelope, token)));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private URI uri(String path) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + path);
  }

  private static String encode(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private HttpRequest get(URI uri, SessionToken token) {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri)
        .header("Accept", "application/json")
        .GET();
    if (token != null) {
      builder.header("Authorization", token.value());
    }
    return builder.build();
  }

  private HttpRequest post(URI uri, Object body, SessionToken token) {
    try {
      HttpRequest.BodyPublisher publisher = body == null
          ? HttpRequest.BodyPublishers.noBody()
          : HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(uri)
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .POST(publisher);
      if (token != null) {
        builder.header("Authorization", token.value());
      }
      return builder.build();
    } catch (IOException e) {
      throw new LockboxAccessorException("Unable to serialize request for " + uri.getPath(), e);
    }
  }

  private HttpResponse<String> send(HttpRequest request) {
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new LockboxAccessorException("HTTP request failed: " + request.uri().getPath(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LockboxAccessorException("HTTP request interrupted: " + request.uri().getPath(), e);
    }
  }

  private <T> T read(HttpResponse<String> response, Class<T> type) {
    try {
      return objectMapper.readValue(response.body(), type);
    } catch (IOException e) {
      throw new LockboxAccessorException("Unreadable response body", response.statusCode(), e);
    }
  }

  private void checkStatus(HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode == 401) {
      throw new SecurityException("Server rejected request (401)");
    }
    if (statusCode == 429) {
      throw new RateLimitedException(rateLimited(response));
    }
    if (statusCode >= 400) {
      throw new LockboxAccessorException("Server returned HTTP " + statusCode, statusCode, null);
    }
  }

  private RateLimited rateLimited(HttpResponse<String> response) {
    final String detail = detail(response.body());
    Optional<String> header = response.headers() == null
        ? Optional.empty()
        : response.headers().firstValue("Retry-After");
    long retryAfter = header.map(LockboxAccessor::parseSeconds)
        .filter(seconds -> seconds > 0)
        .orElseGet(() -> detail == null ? -1L : fromDetail(detail));
    return new RateLimited(retryAfter > 0 ? retryAfter : DEFAULT_RETRY_AFTER_SECONDS, detail);
  }

  private String detail(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(body, ErrorDetail.class).detail();
    } catch (IOException e) {
      log.debug("detail(): body is not an error detail, using it verbatim");
      return body;
    }
  }

  private static long fromDetail(String detail) {
    Matcher matcher = DIGITS.matcher(detail);
    return matcher.find() ? parseSeconds(matcher.group(1)) : -1L;
  }

  private static long parseSeconds(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return -1L;
    }
  }
}
