package org.assetwatch.anomaly.datamodel.store;

import com.typesafe.config.Config;
import org.assetwatch.anomaly.datamodel.store.jdbc.JdbcStore;

public class StoreProvider {
  public static final String STORE_CONFIG = "store";
  public static final String STORE_TYPE = "type";
  public static final String STORE_TYPE_JDBC = "jdbc";

  public static Store getStore(Config storeConfig) {
    String storeType = storeConfig.getString(STORE_TYPE);
    switch (storeType) {
      case STORE_TYPE_JDBC:
        return JdbcStore.create(storeConfig.getConfig(STORE_TYPE_JDBC));
      default:
        throw new RuntimeException(String.format("Invalid store type:%s", storeType));
    }
  }
}
