package org.assetwatch.anomaly.datamodel.store.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import org.assetwatch.anomaly.datamodel.json.ObjectMapperProvider;

final class JdbcSupport {
  static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

  private static final TypeReference<Map<String, String>> TAGS_TYPE = new TypeReference<>() {};
  private static final TypeReference<Map<String, Object>> DETAILS_TYPE =
      new TypeReference<>() {};

  private JdbcSupport() {}

  static OffsetDateTime toTimestamp(Instant instant) {
    return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
  }

  static Instant readInstant(ResultSet resultSet, String column) throws SQLException {
    OffsetDateTime value = resultSet.getObject(column, OffsetDateTime.class);
    return value == null ? null : value.toInstant();
  }

  static boolean isUniqueViolation(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (UNIQUE_VIOLATION_SQL_STATE.equals(current.getSQLState())) {
        return true;
      }
    }
    return false;
  }

  static String writeJson(Map<String, ?> value) throws SQLException {
    if (value == null || value.isEmpty()) {
      return null;
    }
    try {
      return ObjectMapperProvider.get().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SQLException("Unable to serialize json column", e);
    }
  }

  static Map<String, String> readTags(String json) throws SQLException {
    return json == null ? Map.of() : readJson(json, TAGS_TYPE);
  }

  static Map<String, Object> readDetails(String json) throws SQLException {
    return json == null ? Map.of() : readJson(json, DETAILS_TYPE);
  }

  private static <T> T readJson(String json, TypeReference<T> type) throws SQLException {
    try {
      return ObjectMapperProvider.get().readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new SQLException("Unable to parse json column", e);
    }
  }
}
