package ca.gc.cra.calsync.infrastructure.account;

import ca.gc.cra.calsync.application.port.CurrentAccountPort;
import ca.gc.cra.calsync.domain.calendar.Attendee;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * {@link CurrentAccountPort} that recognises the current account by the store's {@code self} marker or by one of the
 * configured e-mail addresses.
 *
 * <p>Addresses compare case-insensitively. With no addresses configured only the {@code self} marker counts.</p>
 *
 * @since 0.1.0
 */
public final class ConfiguredAccount implements CurrentAccountPort {
  private final Set<String> addresses;

  /**
   * Creates an account lookup.
   *
   * @param addresses e-mail addresses of the current account; blank entries are ignored
   */
  public ConfiguredAccount(Collection<String> addresses) {
    Objects.requireNonNull(addresses, "addresses");
    Set<String> normalized = new LinkedHashSet<>();
    for (String address : addresses) {
      if (address != null && !address.isBlank()) {
        normalized.add(address.trim().toLowerCase(Locale.ROOT));
      }
    }
    this.addresses = Set.copyOf(normalized);
  }

  /**
   * Parses a comma-separated address list.
   *
   * @param csv addresses such as {@code me@example.com,alias@example.com}; may be {@code null}
   * @return account lookup
   */
  public static ConfiguredAccount fromCsv(String csv) {
    if (csv == null || csv.isBlank()) {
      return new ConfiguredAccount(Set.of());
    }
    return new ConfiguredAccount(Arrays.asList(csv.split(",")));
  }

  /**
   * Configured addresses, lower-cased.
   *
   * @return addresses
   */
  public Set<String> addresses() {
    return addresses;
  }

  @Override
  public boolean isCurrentAccount(Attendee attendee) {
    if (attendee == null) {
      return false;
    }
    if (attendee.self()) {
      return true;
    }
    return attendee.emailAddress()
        .map(email -> addresses.contains(email.toLowerCase(Locale.ROOT)))
        .orElse(false);
  }
}
