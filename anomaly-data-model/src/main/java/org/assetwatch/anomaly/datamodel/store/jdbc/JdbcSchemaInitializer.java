package org.assetwatch.anomaly.datamodel.store.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JdbcSchemaInitializer {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcSchemaInitializer.class);
  static final String SCHEMA_RESOURCE = "schema.sql";

  static void initialize(DataSource dataSource) throws SQLException {
    List<String> statements = readStatements();
    try (Connection connection = dataSource.getConnection();
        Statement statement = connection.createStatement()) {
      for (String sql : statements) {
        statement.execute(sql);
      }
    }
    LOGGER.info("Applied {} schema statements", statements.size());
  }

  static List<String> readStatements() {
    try (InputStream inputStream =
        JdbcSchemaInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
      if (inputStream == null) {
        throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
      }
      String script = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
      return Arrays.stream(script.split(";"))
          .map(JdbcSchemaInitializer::stripComments)
          .map(String::trim)
          .filter(sql -> !sql.isEmpty())
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new IllegalStateException("Unable to read " + SCHEMA_RESOURCE, e);
    }
  }

  private static String stripComments(String sql) {
    return Arrays.stream(sql.split("\n"))
        .filter(line -> !line.trim().startsWith("--"))
        .collect(Collectors.joining("\n"));
  }
}
