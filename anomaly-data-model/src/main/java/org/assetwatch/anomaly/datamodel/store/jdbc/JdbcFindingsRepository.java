package org.assetwatch.anomaly.datamodel.store.jdbc;

import static org.assetwatch.anomaly.datamodel.store.jdbc.JdbcSupport.isUniqueViolation;
import static org.assetwatch.anomaly.datamodel.store.jdbc.JdbcSupport.readDetails;
import static org.assetwatch.anomaly.datamodel.store.jdbc.JdbcSupport.readInstant;
import static org.assetwatch.anomaly.datamodel.store.jdbc.JdbcSupport.toTimestamp;
import static org.assetwatch.anomaly.datamodel.store.jdbc.JdbcSupport.writeJson;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.assetwatch.anomaly.datamodel.AnomalyFinding;
import org.assetwatch.anomaly.datamodel.store.DuplicateFindingException;
import org.assetwatch.anomaly.datamodel.store.FindingsRepository;
import org.assetwatch.anomaly.datamodel.store.StoreUnavailableException;

public class JdbcFindingsRepository implements FindingsRepository {
  private static final String COLUMNS =
      "id, source_sample_id, asset_id, metric, observed_at, score, explanation, details";
  private static final String INSERT_FINDING =
      "INSERT INTO anomaly_findings (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
  private static final String SELECT_BY_SOURCE_SAMPLE =
      "SELECT " + COLUMNS + " FROM anomaly_findings WHERE source_sample_id = ?";
  private static final String SELECT_BY_ASSET =
      "SELECT "
          + COLUMNS
          + " FROM anomaly_findings WHERE asset_id = ? AND observed_at >= ? AND observed_at <= ?"
          + " ORDER BY observed_at DESC";

  private final DataSource dataSource;
  private final int queryTimeoutSeconds;

  public JdbcFindingsRepository(DataSource dataSource, int queryTimeoutSeconds) {
    this.dataSource = dataSource;
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  @Override
  public Optional<AnomalyFinding> findBySourceSample(UUID sourceSampleId)
      throws StoreUnavailableException {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(SELECT_BY_SOURCE_SAMPLE)) {
      statement.setQueryTimeout(queryTimeoutSeconds);
      statement.setObject(1, sourceSampleId);
      try (ResultSet resultSet = statement.executeQuery()) {
        return resultSet.next() ? Optional.of(toFinding(resultSet)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new StoreUnavailableException(
          "Unable to look up finding for source sample " + sourceSampleId, e);
    }
  }

  @Override
  public void insert(AnomalyFinding finding)
      throws DuplicateFindingException, StoreUnavailableException {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(INSERT_FINDING)) {
      statement.setQueryTimeout(queryTimeoutSeconds);
      statement.setObject(1, finding.getId());
      statement.setObject(2, finding.getSourceSampleId());
      statement.setString(3, finding.getAssetId());
      statement.setString(4, finding.getMetric());
      statement.setObject(5, toTimestamp(finding.getTimestamp()));
      statement.setDouble(6, finding.getScore());
      statement.setString(7, finding.getExplanation());
      statement.setString(8, writeJson(finding.getDetails()));
      statement.executeUpdate();
    } catch (SQLException e) {
      if (finding.getSourceSampleId() != null && isUniqueViolation(e)) {
        throw new DuplicateFindingException(finding.getSourceSampleId(), e);
      }
      throw new StoreUnavailableException(
          String.format(
              "Unable to insert finding for %s/%s at %s",
              finding.getAssetId(), finding.getMetric(), finding.getTimestamp()),
          e);
    }
  }

  @Override
  public List<AnomalyFinding> findByAsset(String assetId, Instant start, Instant end)
      throws StoreUnavailableException {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(SELECT_BY_ASSET)) {
      statement.setQueryTimeout(queryTimeoutSeconds);
      statement.setString(1, assetId);
      statement.setObject(2, toTimestamp(start));
      statement.setObject(3, toTimestamp(end));
      List<AnomalyFinding> findings = new ArrayList<>();
      try (ResultSet resultSet = statement.executeQuery()) {
        while (resultSet.next()) {
          findings.add(toFinding(resultSet));
        }
      }
      return findings;
    } catch (SQLException e) {
      throw new StoreUnavailableException(
          String.format("Unable to query findings for %s in [%s, %s]", assetId, start, end), e);
    }
  }

  private static AnomalyFinding toFinding(ResultSet resultSet) throws SQLException {
    return AnomalyFinding.builder()
        .id(resultSet.getObject("id", UUID.class))
        .sourceSampleId(resultSet.getObject("source_sample_id", UUID.class))
        .assetId(resultSet.getString("asset_id"))
        .metric(resultSet.getString("metric"))
        .timestamp(readInstant(resultSet, "observed_at"))
        .score(resultSet.getDouble("score"))
        .explanation(resultSet.getString("explanation"))
        .details(readDetails(resultSet.getString("details")))
        .build();
  }
}
