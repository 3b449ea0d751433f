package agentbroker.jdbc.store;

import agentbroker.jdbc.ConnectionProvider;
import agentbroker.jdbc.DataSourceConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry for JDBC message stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/agentbroker.jdbc.store.AbstractJdbcMessageStore}. Registered
 * instances are unbound templates; the {@link DataSource} and {@link ConnectionProvider}
 * overloads of {@code detect} return bound copies ready for a
 * {@link agentbroker.MessageBroker}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect and bind to a DataSource
 * AbstractJdbcMessageStore store = JdbcMessageStores.detect(dataSource);
 *
 * // Look up a template by name, then bind it
 * AbstractJdbcMessageStore pg = JdbcMessageStores.get("postgresql")
 *     .withConnectionProvider(connectionProvider);
 * }</pre>
 */
public final class JdbcMessageStores {

  private static final List<AbstractJdbcMessageStore> STORES;
  private static final Map<String, AbstractJdbcMessageStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcMessageStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .collect(Collectors.toUnmodifiableList());

    for (AbstractJdbcMessageStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcMessageStores() {
  }

  /**
   * Returns all registered store templates.
   */
  public static List<AbstractJdbcMessageStore> all() {
    return STORES;
  }

  /**
   * Gets a store template by name.
   *
   * @param name store name (case-insensitive)
   * @return the unbound store template
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcMessageStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcMessageStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown message store: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Detects the store template matching a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return the unbound store template
   * @throws IllegalArgumentException if no registered store handles the URL
   */
  public static AbstractJdbcMessageStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase();
    for (AbstractJdbcMessageStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No message store found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Detects the store for a JDBC URL and binds it to {@code connectionProvider}.
   *
   * @param jdbcUrl            the JDBC URL
   * @param connectionProvider connections to the same database
   * @return a bound store
   */
  public static AbstractJdbcMessageStore detect(String jdbcUrl, ConnectionProvider connectionProvider) {
    Objects.requireNonNull(connectionProvider, "connectionProvider");
    return detect(jdbcUrl).withConnectionProvider(connectionProvider);
  }

  /**
   * Detects the store from a DataSource's connection metadata and binds it to that DataSource.
   *
   * @param dataSource the data source
   * @return a bound store
   * @throws IllegalStateException if the metadata cannot be read
   */
  public static AbstractJdbcMessageStore detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect message store from DataSource", e);
    }
    return detect(url, new DataSourceConnectionProvider(dataSource));
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .collect(Collectors.toList());
  }
}
