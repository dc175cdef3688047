package org.assetwatch.anomaly.datamodel.store.jdbc;

import com.typesafe.config.ConfigFactory;
import java.util.Map;
import java.util.UUID;

final class H2Stores {
  private H2Stores() {}

  static JdbcStore newInMemoryStore() {
    return JdbcStore.create(
        ConfigFactory.parseMap(
            Map.of(
                "url",
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
                "user",
                "sa",
                "password",
                "",
                "maximumPoolSize",
                4,
                "queryTimeoutSeconds",
                5)));
  }
}
