package com.codeheadsystems.lockbox.dropwizard;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.codeheadsystems.lockbox.crypto.common.RandomProvider;
import com.codeheadsystems.lockbox.dropwizard.auth.LockboxAuthenticator;
import com.codeheadsystems.lockbox.dropwizard.auth.TokenAuthFilter;
import com.codeheadsystems.lockbox.dropwizard.health.TokenSigningHealthCheck;
import com.codeheadsystems.lockbox.server.auth.LockboxPrincipal;
import com.codeheadsystems.lockbox.server.auth.TokenManager;
import com.codeheadsystems.lockbox.server.limiter.AttemptLimiter;
import com.codeheadsystems.lockbox.server.manager.AccountManager;
import com.codeheadsystems.lockbox.server.manager.MfaManager;
import com.codeheadsystems.lockbox.server.manager.VaultStorageManager;
import com.codeheadsystems.lockbox.server.mapper.IllegalArgumentExceptionMapper;
import com.codeheadsystems.lockbox.server.mapper.RateLimitExceededExceptionMapper;
import com.codeheadsystems.lockbox.server.mapper.SecurityExceptionMapper;
import com.codeheadsystems.lockbox.server.mapper.UsernameTakenExceptionMapper;
import com.codeheadsystems.lockbox.server.mfa.TotpManager;
import com.codeheadsystems.lockbox.server.resource.AuthResource;
import com.codeheadsystems.lockbox.server.resource.MfaResource;
import com.codeheadsystems.lockbox.server.resource.VaultResource;
import com.codeheadsystems.lockbox.server.store.AccountStore;
import com.codeheadsystems.lockbox.server.store.InMemoryAccountStore;
import com.codeheadsystems.lockbox.server.store.InMemorySessionStore;
import com.codeheadsystems.lockbox.server.store.InMemoryVaultStore;
import com.codeheadsystems.lockbox.server.store.SessionStore;
import com.codeheadsystems.lockbox.server.store.VaultStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the lockbox remote authority into an existing Dropwizard
 * application.
 * <p>
 * Registers the auth, second-factor and vault resources, their exception mappers, the bearer
 * token auth filter and a health check. Requires a {@link LockboxConfiguration} block in the
 * application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new LockboxBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new LockboxBundle<>(myAccountStore, myVaultStore, mySessionStore));
 * }</pre>
 */
@Singleton
public class LockboxBundle<C extends LockboxConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(LockboxBundle.class);

  private final AccountStore accountStore;
  private final VaultStore vaultStore;
  private final SessionStore sessionStore;

  /**
   * Creates a bundle backed by in-memory stores.
   * <p>
   * For dev/test only. All accounts, vaults and sessions are lost on restart.
   */
  public LockboxBundle() {
    this(new InMemoryAccountStore(), new InMemoryVaultStore(), new InMemorySessionStore());
    log.warn("""
        #################################################################
        # WARNING: Using ephemeral in-memory stores. All accounts and   #
        # vaults will be lost on restart. Do not use in production.     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param accountStore the account store
   * @param vaultStore   the vault store
   * @param sessionStore the session store
   */
  @Inject
  public LockboxBundle(AccountStore accountStore, VaultStore vaultStore, SessionStore sessionStore) {
    this.accountStore = accountStore;
    this.vaultStore = vaultStore;
    this.sessionStore = sessionStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    RandomProvider randomProvider = new RandomProvider();
    Clock clock = Clock.systemUTC();
    TokenManager tokenManager = buildTokenManager(configuration, randomProvider);
    AttemptLimiter loginLimiter = buildLimiter(configuration, clock);
    AttemptLimiter registrationLimiter = buildLimiter(configuration, clock);

    TotpManager totpManager = new TotpManager(randomProvider, clock, configuration.getTotpIssuer());
    MfaManager mfaManager = new MfaManager(accountStore, totpManager, loginLimiter, randomProvider);
    AccountManager accountManager = new AccountManager(accountStore, tokenManager, mfaManager,
        loginLimiter, registrationLimiter);
    VaultStorageManager vaultStorageManager = new VaultStorageManager(vaultStore);

    environment.jersey().register(new AuthResource(accountManager));
    environment.jersey().register(new MfaResource(mfaManager));
    environment.jersey().register(new VaultResource(vaultStorageManager));
    environment.jersey().register(new SecurityExceptionMapper());
    environment.jersey().register(new IllegalArgumentExceptionMapper());
    environment.jersey().register(new UsernameTakenExceptionMapper());
    environment.jersey().register(new RateLimitExceededExceptionMapper());
    environment.healthChecks().register("token-signing", new TokenSigningHealthCheck(tokenManager));

    // Bearer token auth filter
    environment.jersey().register(new AuthDynamicFeature(
        new TokenAuthFilter.Builder()
            .setAuthenticator(new LockboxAuthenticator(tokenManager))
            .setPrefix("Bearer")
            .setRealm("lockbox")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(LockboxPrincipal.class));

    ScheduledExecutorService reaper = environment.lifecycle()
        .scheduledExecutorService("lockbox-limiter-reaper-%d", true)
        .build();
    long period = Math.max(1, configuration.getAttemptWindowSeconds());
    reaper.scheduleAtFixedRate(() -> {
      loginLimiter.evictExpired();
      registrationLimiter.evictExpired();
    }, period, period, TimeUnit.SECONDS);
  }

  private TokenManager buildTokenManager(C configuration, RandomProvider randomProvider) {
    String secretHex = configuration.getTokenSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No token secret configured. Generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = randomProvider.randomBytes(32);
    } else {
      secret = ByteUtils.requireHex(secretHex, "tokenSecretHex");
    }
    return new TokenManager(secret, configuration.getTokenIssuer(), configuration.getTokenTtlSeconds(),
        sessionStore);
  }

  private static AttemptLimiter buildLimiter(LockboxConfiguration configuration, Clock clock) {
    return new AttemptLimiter(configuration.getMaxFailedAttempts(),
        Duration.ofSeconds(configuration.getAttemptWindowSeconds()),
        Duration.ofSeconds(configuration.getLockoutSeconds()),
        clock);
  }
}
