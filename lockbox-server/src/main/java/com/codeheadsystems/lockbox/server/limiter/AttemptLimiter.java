package com.codeheadsystems.lockbox.server.limiter;

import com.codeheadsystems.lockbox.server.exceptions.RateLimitExceededException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts failed attempts per identity and locks the identity out once too many fail within a
 * window.
 * <p>
 * With the defaults, five failures within 60 seconds lock the identity for 60 seconds: the sixth
 * attempt is refused with {@link RateLimitExceededException} whether or not it would have
 * succeeded. A success clears the count. Stale entries are dropped on {@link #evictExpired()}.
 */
public class AttemptLimiter {

  /**
   * Default failures allowed per window.
   */
  public static final int DEFAULT_MAX_FAILURES = 5;
  /**
   * Default counting window.
   */
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
  /**
   * Default lockout once the limit is reached.
   */
  public static final Duration DEFAULT_LOCKOUT = Duration.ofSeconds(60);

  private static final Logger log = LoggerFactory.getLogger(AttemptLimiter.class);

  private final ConcurrentHashMap<String, Attempts> attempts = new ConcurrentHashMap<>();
  private final int maxFailures;
  private final Duration window;
  private final Duration lockout;
  private final Clock clock;

  public AttemptLimiter() {
    this(DEFAULT_MAX_FAILURES, DEFAULT_WINDOW, DEFAULT_LOCKOUT, Clock.systemUTC());
  }

  /**
   * Instantiates a new Attempt limiter.
   *
   * @param maxFailures failures allowed within the window
   * @param window      the counting window
   * @param lockout     how long the identity stays locked
   * @param clock       the clock
   */
  public AttemptLimiter(final int maxFailures, final Duration window, final Duration lockout, final Clock clock) {
    log.info("AttemptLimiter(maxFailures={}, window={}, lockout={})", maxFailures, window, lockout);
    if (maxFailures < 1) {
      throw new IllegalArgumentException("maxFailures must be at least 1");
    }
    this.maxFailures = maxFailures;
    this.window = window;
    this.lockout = lockout;
    this.clock = clock;
  }

  /**
   * Refuses the attempt while the identity is locked out.
   *
   * @param key the identity
   * @throws RateLimitExceededException while locked out
   */
  public void check(final String key) {
    Attempts current = attempts.get(key);
    if (current == null || current.lockedUntil() == null) {
      return;
    }
    Instant now = clock.instant();
    if (now.isBefore(current.lockedUntil())) {
      long seconds = Duration.between(now, current.lockedUntil()).toMillis();
      log.debug("check(key={}) refused", key);
      throw new RateLimitExceededException((seconds + 999) / 1000);
    }
    attempts.remove(key, current);
  }

  /**
   * Records a failed attempt.
   *
   * @param key the identity
   */
  public void recordFailure(final String key) {
    Instant now = clock.instant();
    Attempts updated = attempts.compute(key, (k, current) -> {
      if (current == null || expired(current, now)) {
        current = new Attempts(0, now, null);
      }
      int failures = current.failures() + 1;
      Instant lockedUntil = failures >= maxFailures ? now.plus(lockout) : null;
      return new Attempts(failures, current.windowStart(), lockedUntil);
    });
    if (updated.lockedUntil() != null) {
      log.warn("Locking out {} until {}", key, updated.lockedUntil());
    }
  }

  /**
   * Clears the failure count after a success.
   *
   * @param key the identity
   */
  public void recordSuccess(final String key) {
    attempts.remove(key);
  }

  /**
   * Drops entries whose window and lockout have both passed.
   */
  public void evictExpired() {
    Instant now = clock.instant();
    attempts.entrySet().removeIf(e -> expired(e.getValue(), now));
  }

  private boolean expired(final Attempts current, final Instant now) {
    if (current.lockedUntil() != null) {
      return !now.isBefore(current.lockedUntil());
    }
    return !now.isBefore(current.windowStart().plus(window));
  }

  private record Attempts(int failures, Instant windowStart, Instant lockedUntil) {
  }
}
