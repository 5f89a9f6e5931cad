package tracking.jdbc;

import org.junit.jupiter.api.BeforeEach;
import tracking.jdbc.store.JdbcTrackingStores;

class H2TrackingStoresTest extends AbstractTrackingStoresIntegrationTest {

  private JdbcTrackingStores stores;

  @BeforeEach
  void setUp() {
    stores = JdbcTrackingStores.create(H2.newDataSource()).createSchema();
  }

  @Override
  JdbcTrackingStores stores() {
    return stores;
  }
}
