package ca.gc.cra.warden.application.moderation;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of accounts exempt from every enforcement action.
 *
 * <p>Consulted before each enforcement decision. Safe for concurrent reads without locking.</p>
 *
 * @since 0.1.0
 */
public final class TrustRegistry {
  private final Set<Long> trusted;

  /**
   * Creates a registry over the given account identifiers.
   *
   * @param trustedAccounts exempt account identifiers; copied defensively
   */
  public TrustRegistry(Set<Long> trustedAccounts) {
    this.trusted = Set.copyOf(Objects.requireNonNull(trustedAccounts, "trustedAccounts"));
  }

  /**
   * Returns a registry containing no accounts.
   *
   * @return empty registry
   */
  public static TrustRegistry empty() {
    return new TrustRegistry(Set.of());
  }

  /**
   * Checks whether an account is exempt.
   *
   * @param accountId account identifier
   * @return {@code true} when the account must never be penalized
   */
  public boolean isTrusted(long accountId) {
    return trusted.contains(accountId);
  }

  /**
   * Returns a registry that additionally trusts {@code accountId}.
   *
   * @param accountId account to add
   * @return new registry; {@code this} when the account is already trusted
   */
  public TrustRegistry withAccount(long accountId) {
    if (trusted.contains(accountId)) {
      return this;
    }
    Set<Long> extended = new HashSet<>(trusted);
    extended.add(accountId);
    return new TrustRegistry(extended);
  }

  /**
   * Returns the number of trusted accounts.
   *
   * @return registry size
   */
  public int size() {
    return trusted.size();
  }

  /**
   * Returns the trusted accounts.
   *
   * @return immutable view of the trusted identifiers
   */
  public Set<Long> accounts() {
    return trusted;
  }
}
