package agentbroker.jdbc.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcMessageStoresTest {

  @Test
  void allReturnsBuiltInStores() {
    List<AbstractJdbcMessageStore> stores = JdbcMessageStores.all();

    assertTrue(stores.size() >= 3);
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
    assertTrue(stores.stream().noneMatch(AbstractJdbcMessageStore::isBound));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", JdbcMessageStores.get("MySQL").name());
    assertEquals("postgresql", JdbcMessageStores.get("POSTGRESQL").name());
    assertEquals("h2", JdbcMessageStores.get("h2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcMessageStores.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown message store"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("mysql", JdbcMessageStores.detect("jdbc:mysql://localhost:3306/db").name());
    assertEquals("mysql", JdbcMessageStores.detect("jdbc:tidb://localhost:4000/db").name());
    assertEquals("postgresql", JdbcMessageStores.detect("jdbc:postgresql://localhost:5432/db").name());
    assertEquals("h2", JdbcMessageStores.detect("jdbc:h2:mem:test").name());
  }

  @Test
  void detectFromJdbcUrlThrowsForUnknownOrEmpty() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcMessageStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(ex.getMessage().contains("No message store found"));
    assertThrows(IllegalArgumentException.class, () -> JdbcMessageStores.detect(""));
  }

  @Test
  void detectFromDataSourceReturnsBoundStore() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

    AbstractJdbcMessageStore store = JdbcMessageStores.detect(dataSource);

    assertInstanceOf(H2MessageStore.class, store);
    assertTrue(store.isBound());
    assertFalse(JdbcMessageStores.get("h2").isBound());
  }

  @Test
  void schemaResourcesFollowStoreNames() {
    assertEquals("agentbroker/jdbc/schema-postgresql.sql", JdbcMessageStores.get("postgresql").schemaResource());
    for (AbstractJdbcMessageStore store : JdbcMessageStores.all()) {
      assertTrue(getClass().getClassLoader().getResource(store.schemaResource()) != null,
          "missing " + store.schemaResource());
    }
  }
}
