package com.mk.fx.qa.login.load.credentials;

import com.mk.fx.qa.login.load.session.Credential;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Chooses credentials uniformly at random, with replacement, from a fixed pool. The pool is copied
 * on construction and never modified. A pool of one always yields that single credential without
 * consulting the random source.
 *
 * <p>Only the dispatching thread calls {@link #next()}, but {@link Random} is thread-safe anyway.
 */
public final class RandomCredentialSelector implements CredentialSelector {

  private final List<Credential> pool;
  private final Random random;

  public RandomCredentialSelector(List<Credential> pool, Random random) {
    Objects.requireNonNull(pool, "pool");
    this.random = Objects.requireNonNull(random, "random");
    if (pool.isEmpty()) {
      throw new IllegalArgumentException("Credential pool must contain at least 1 user");
    }
    this.pool = List.copyOf(pool);
  }

  /**
   * Creates a selector over the pool.
   *
   * @param seed fixed seed for reproducible selection, or {@code null} for an unpredictable one
   */
  public static RandomCredentialSelector of(List<Credential> pool, Long seed) {
    return new RandomCredentialSelector(pool, seed != null ? new Random(seed) : new Random());
  }

  @Override
  public Credential next() {
    if (pool.size() == 1) {
      return pool.get(0);
    }
    return pool.get(random.nextInt(pool.size()));
  }

  @Override
  public int poolSize() {
    return pool.size();
  }
}
