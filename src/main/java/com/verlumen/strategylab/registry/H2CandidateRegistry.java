package com.verlumen.strategylab.registry;

import static com.google.common.collect.ImmutableSortedSet.toImmutableSortedSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.google.inject.Inject;
import com.verlumen.strategylab.evaluation.MetricsAggregator;
import com.verlumen.strategylab.evaluation.MetricsRecord;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.genome.CommitHashes;
import com.verlumen.strategylab.genome.Genome;
import com.verlumen.strategylab.genome.Version;
import com.verlumen.strategylab.scoring.CompositeScorer;
import com.verlumen.strategylab.scoring.FitnessProfile;
import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import javax.sql.DataSource;

/**
 * JDBC registry over an embedded H2 database.
 *
 * <p>Writes that touch a genome's aggregates lock its row with {@code SELECT ... FOR UPDATE}, so
 * writes for one genome serialize while writes for different genomes proceed concurrently.
 */
final class H2CandidateRegistry implements CandidateRegistry {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Type PARAMETERS_TYPE = new TypeToken<Map<String, Double>>() {}.getType();
  private static final Type STRING_LIST_TYPE = new TypeToken<List<String>>() {}.getType();

  private static final ImmutableList<String> SCHEMA =
      ImmutableList.of(
          "CREATE TABLE IF NOT EXISTS genomes ("
              + "id VARCHAR(64) PRIMARY KEY,"
              + "name VARCHAR(255) NOT NULL,"
              + "description CLOB NOT NULL,"
              + "source CLOB NOT NULL,"
              + "parameters CLOB NOT NULL,"
              + "parent_ids CLOB NOT NULL,"
              + "current_version_id VARCHAR(64),"
              + "generation INT NOT NULL,"
              + "fitness DOUBLE PRECISION NOT NULL DEFAULT 0,"
              + "deployment_score DOUBLE PRECISION NOT NULL DEFAULT 0,"
              + "total_tests INT NOT NULL DEFAULT 0,"
              + "markets_tested CLOB NOT NULL,"
              + "created_at TIMESTAMP NOT NULL)",
          "CREATE TABLE IF NOT EXISTS versions ("
              + "id VARCHAR(64) PRIMARY KEY,"
              + "genome_id VARCHAR(64) NOT NULL REFERENCES genomes(id),"
              + "version_number INT NOT NULL,"
              + "parent_version_id VARCHAR(64),"
              + "commit_hash VARCHAR(16) NOT NULL,"
              + "source CLOB NOT NULL,"
              + "parameters CLOB NOT NULL,"
              + "note CLOB NOT NULL,"
              + "deployment_ready BOOLEAN NOT NULL DEFAULT FALSE,"
              + "validation_passed BOOLEAN NOT NULL DEFAULT FALSE,"
              + "created_at TIMESTAMP NOT NULL,"
              + "UNIQUE (genome_id, version_number))",
          "CREATE TABLE IF NOT EXISTS metric_records ("
              + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
              + "genome_id VARCHAR(64) NOT NULL REFERENCES genomes(id),"
              + "version_id VARCHAR(64) NOT NULL REFERENCES versions(id),"
              + "market VARCHAR(64) NOT NULL,"
              + "timeframe VARCHAR(8) NOT NULL,"
              + "window_start TIMESTAMP NOT NULL,"
              + "window_end TIMESTAMP NOT NULL,"
              + "fitness DOUBLE PRECISION NOT NULL,"
              + "metrics_blob CLOB NOT NULL,"
              + "recorded_at TIMESTAMP NOT NULL)",
          "CREATE INDEX IF NOT EXISTS idx_metric_records_version"
              + " ON metric_records(genome_id, version_id)",
          "CREATE INDEX IF NOT EXISTS idx_versions_genome ON versions(genome_id)");

  private static final String GENOME_COLUMNS =
      "g.id, g.name, g.description, g.source, g.parameters, g.parent_ids, g.current_version_id,"
          + " g.generation, g.fitness, g.deployment_score, g.total_tests, g.markets_tested";
  private static final String VERSION_COLUMNS =
      "id, genome_id, version_number, parent_version_id, commit_hash, source, parameters, note,"
          + " deployment_ready, validation_passed, created_at";

  private final DataSource dataSource;
  private final Gson gson;
  private final Clock clock;
  private final CompositeScorer scorer;
  private final FitnessProfile profile;

  @Inject
  H2CandidateRegistry(
      DataSource dataSource,
      Gson gson,
      Clock clock,
      CompositeScorer scorer,
      FitnessProfile profile) {
    this.dataSource = dataSource;
    this.gson = gson;
    this.clock = clock;
    this.scorer = scorer;
    this.profile = profile;
    createSchema();
  }

  private void createSchema() {
    try (Connection connection = dataSource.getConnection();
        Statement statement = connection.createStatement()) {
      for (String ddl : SCHEMA) {
        statement.execute(ddl);
      }
    } catch (SQLException e) {
      throw new RegistryException("Failed to create registry schema", e);
    }
  }

  @Override
  public String save(Genome genome, String note) {
    String genomeId = UUID.randomUUID().toString();
    String versionId = UUID.randomUUID().toString();
    Timestamp now = Timestamp.from(clock.instant());
    inTransaction(
        "save genome " + genome.name(),
        connection -> {
          try (PreparedStatement insert =
              connection.prepareStatement(
                  "INSERT INTO genomes (id, name, description, source, parameters, parent_ids,"
                      + " current_version_id, generation, fitness, markets_tested, created_at)"
                      + " VALUES (?, ?, ?, ?, ?, ?, NULL, ?, ?, '[]', ?)")) {
            insert.setString(1, genomeId);
            insert.setString(2, genome.name());
            insert.setString(3, genome.description());
            insert.setString(4, genome.source());
            insert.setString(5, gson.toJson(genome.parameters()));
            insert.setString(6, gson.toJson(genome.parentIds()));
            insert.setInt(7, genome.generation());
            insert.setDouble(8, genome.fitness());
            insert.setTimestamp(9, now);
            insert.executeUpdate();
          }
          insertVersion(
              connection,
              versionId,
              genomeId,
              1,
              Optional.empty(),
              genome.source(),
              genome.parameters(),
              note,
              now);
          setCurrentVersion(connection, genomeId, versionId, genome.source(), genome.parameters());
          return null;
        });
    logger.atFine().log("Saved genome %s as %s", genome.name(), genomeId);
    return genomeId;
  }

  @Override
  public String createVersion(
      String genomeId, String source, Map<String, Double> parameters, String note) {
    return inTransaction(
        "create version of " + genomeId,
        connection -> {
          String currentVersionId = lockGenome(connection, genomeId);
          String commitHash = CommitHashes.of(source, parameters);
          int latest = 0;
          String currentHash = null;
          try (PreparedStatement query =
              connection.prepareStatement(
                  "SELECT version_number, commit_hash, id FROM versions WHERE genome_id = ?")) {
            query.setString(1, genomeId);
            try (ResultSet rows = query.executeQuery()) {
              while (rows.next()) {
                latest = Math.max(latest, rows.getInt(1));
                if (rows.getString(3).equals(currentVersionId)) {
                  currentHash = rows.getString(2);
                }
              }
            }
          }
          if (commitHash.equals(currentHash)) {
            logger.atFine().log("No-op version for %s (hash %s)", genomeId, commitHash);
            return currentVersionId;
          }

          String versionId = UUID.randomUUID().toString();
          insertVersion(
              connection,
              versionId,
              genomeId,
              latest + 1,
              Optional.ofNullable(currentVersionId),
              source,
              parameters,
              note,
              Timestamp.from(clock.instant()));
          setCurrentVersion(connection, genomeId, versionId, source, parameters);
          return versionId;
        });
  }

  @Override
  public void recordMetrics(CandidateKey key, MetricsRecord metrics) {
    double recordFitness =
        scorer.score(MetricsAggregator.aggregate(ImmutableList.of(metrics)), profile);
    inTransaction(
        "record metrics for " + key,
        connection -> {
          String currentVersionId = lockGenome(connection, key.genomeId());
          checkVersionBelongs(connection, key);
          try (PreparedStatement insert =
              connection.prepareStatement(
                  "INSERT INTO metric_records (genome_id, version_id, market, timeframe,"
                      + " window_start, window_end, fitness, metrics_blob, recorded_at)"
                      + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            insert.setString(1, key.genomeId());
            insert.setString(2, key.versionId());
            insert.setString(3, metrics.market());
            insert.setString(4, metrics.timeframe().label());
            insert.setTimestamp(5, Timestamp.from(metrics.windowStart()));
            insert.setTimestamp(6, Timestamp.from(metrics.windowEnd()));
            insert.setDouble(7, recordFitness);
            insert.setString(8, gson.toJson(MetricsBlob.of(metrics)));
            insert.setTimestamp(9, Timestamp.from(clock.instant()));
            insert.executeUpdate();
          }
          updateAggregates(connection, key.genomeId(), currentVersionId);
          return null;
        });
  }

  private void updateAggregates(Connection connection, String genomeId, String currentVersionId)
      throws SQLException {
    double fitness = 0;
    try (PreparedStatement query =
        connection.prepareStatement(
            "SELECT AVG(fitness) FROM metric_records WHERE genome_id = ? AND version_id = ?")) {
      query.setString(1, genomeId);
      query.setString(2, currentVersionId);
      try (ResultSet rows = query.executeQuery()) {
        if (rows.next()) {
          fitness = rows.getDouble(1);
        }
      }
    }

    int totalTests = 0;
    List<String> markets = new ArrayList<>();
    try (PreparedStatement query =
        connection.prepareStatement(
            "SELECT market, COUNT(*) FROM metric_records WHERE genome_id = ? GROUP BY market"
                + " ORDER BY market")) {
      query.setString(1, genomeId);
      try (ResultSet rows = query.executeQuery()) {
        while (rows.next()) {
          markets.add(rows.getString(1));
          totalTests += rows.getInt(2);
        }
      }
    }

    try (PreparedStatement update =
        connection.prepareStatement(
            "UPDATE genomes SET fitness = ?, total_tests = ?, markets_tested = ? WHERE id = ?")) {
      update.setDouble(1, fitness);
      update.setInt(2, totalTests);
      update.setString(3, gson.toJson(markets));
      update.setString(4, genomeId);
      update.executeUpdate();
    }
  }

  @Override
  public void markReady(CandidateKey key, boolean ready) {
    inTransaction(
        "mark readiness of " + key,
        connection -> {
          lockGenome(connection, key.genomeId());
          checkVersionBelongs(connection, key);
          try (PreparedStatement update =
              connection.prepareStatement(
                  "UPDATE versions SET deployment_ready = ?, validation_passed = TRUE"
                      + " WHERE id = ?")) {
            update.setBoolean(1, ready);
            update.setString(2, key.versionId());
            update.executeUpdate();
          }
          if (ready) {
            try (PreparedStatement update =
                connection.prepareStatement(
                    "UPDATE genomes SET deployment_score = fitness WHERE id = ?")) {
              update.setString(1, key.genomeId());
              update.executeUpdate();
            }
          }
          return null;
        });
    logger.atInfo().log("Marked %s deployment ready: %s", key, ready);
  }

  @Override
  public ImmutableList<StoredGenome> top(int n, int minTests, Set<String> marketFilter) {
    ImmutableList<StoredGenome> candidates =
        queryGenomes(
            "WHERE g.fitness > 0 AND g.total_tests >= ?",
            statement -> statement.setInt(1, minTests));
    return candidates.stream()
        .filter(
            stored ->
                marketFilter.isEmpty()
                    || stored.marketsTested().stream().anyMatch(marketFilter::contains))
        .sorted(
            Comparator.comparingDouble(StoredGenome::fitness)
                .reversed()
                .thenComparing(
                    Comparator.comparingInt((StoredGenome stored) -> stored.marketsTested().size())
                        .reversed())
                .thenComparing(StoredGenome::id))
        .limit(n)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public Optional<StoredGenome> genome(String genomeId) {
    return queryGenomes("WHERE g.id = ?", statement -> statement.setString(1, genomeId))
        .stream()
        .findFirst();
  }

  @Override
  public Optional<Version> version(String versionId) {
    return queryVersions(
            "SELECT " + VERSION_COLUMNS + " FROM versions WHERE id = ?",
            statement -> statement.setString(1, versionId))
        .stream()
        .findFirst();
  }

  @Override
  public Optional<Version> currentVersion(String genomeId) {
    return queryVersions(
            "SELECT "
                + VERSION_COLUMNS
                + " FROM versions WHERE id ="
                + " (SELECT current_version_id FROM genomes WHERE id = ?)",
            statement -> statement.setString(1, genomeId))
        .stream()
        .findFirst();
  }

  @Override
  public ImmutableList<Version> versions(String genomeId) {
    return queryVersions(
        "SELECT " + VERSION_COLUMNS + " FROM versions WHERE genome_id = ? ORDER BY version_number",
        statement -> statement.setString(1, genomeId));
  }

  @Override
  public ImmutableList<MetricsRecord> metrics(CandidateKey key) {
    return query(
        "read metrics for " + key,
        "SELECT metrics_blob FROM metric_records WHERE genome_id = ? AND version_id = ?"
            + " ORDER BY id",
        statement -> {
          statement.setString(1, key.genomeId());
          statement.setString(2, key.versionId());
        },
        rows -> gson.fromJson(rows.getString(1), MetricsBlob.class).toRecord());
  }

  @Override
  public ImmutableList<StoredGenome> deploymentReady(int minMarkets) {
    return queryGenomes(
            "JOIN versions v ON v.id = g.current_version_id WHERE v.deployment_ready = TRUE",
            statement -> {})
        .stream()
        .filter(stored -> stored.marketsTested().size() >= minMarkets)
        .sorted(
            Comparator.comparingDouble(StoredGenome::deploymentScore)
                .reversed()
                .thenComparing(StoredGenome::id))
        .collect(ImmutableList.toImmutableList());
  }

  private String lockGenome(Connection connection, String genomeId) throws SQLException {
    try (PreparedStatement lock =
        connection.prepareStatement(
            "SELECT current_version_id FROM genomes WHERE id = ? FOR UPDATE")) {
      lock.setString(1, genomeId);
      try (ResultSet rows = lock.executeQuery()) {
        if (!rows.next()) {
          throw new RegistryException("Unknown genome: " + genomeId);
        }
        return rows.getString(1);
      }
    }
  }

  private static void checkVersionBelongs(Connection connection, CandidateKey key)
      throws SQLException {
    try (PreparedStatement query =
        connection.prepareStatement("SELECT 1 FROM versions WHERE id = ? AND genome_id = ?")) {
      query.setString(1, key.versionId());
      query.setString(2, key.genomeId());
      try (ResultSet rows = query.executeQuery()) {
        if (!rows.next()) {
          throw new RegistryException("Unknown version: " + key);
        }
      }
    }
  }

  private void insertVersion(
      Connection connection,
      String versionId,
      String genomeId,
      int versionNumber,
      Optional<String> parentVersionId,
      String source,
      Map<String, Double> parameters,
      String note,
      Timestamp createdAt)
      throws SQLException {
    try (PreparedStatement insert =
        connection.prepareStatement(
            "INSERT INTO versions (id, genome_id, version_number, parent_version_id, commit_hash,"
                + " source, parameters, note, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
      insert.setString(1, versionId);
      insert.setString(2, genomeId);
      insert.setInt(3, versionNumber);
      insert.setString(4, parentVersionId.orElse(null));
      insert.setString(5, CommitHashes.of(source, parameters));
      insert.setString(6, source);
      insert.setString(7, gson.toJson(parameters));
      insert.setString(8, note);
      insert.setTimestamp(9, createdAt);
      insert.executeUpdate();
    }
  }

  private void setCurrentVersion(
      Connection connection,
      String genomeId,
      String versionId,
      String source,
      Map<String, Double> parameters)
      throws SQLException {
    try (PreparedStatement update =
        connection.prepareStatement(
            "UPDATE genomes SET current_version_id = ?, source = ?, parameters = ? WHERE id = ?")) {
      update.setString(1, versionId);
      update.setString(2, source);
      update.setString(3, gson.toJson(parameters));
      update.setString(4, genomeId);
      update.executeUpdate();
    }
  }

  private ImmutableList<StoredGenome> queryGenomes(String clause, Binder binder) {
    return query(
        "read genomes",
        "SELECT " + GENOME_COLUMNS + " FROM genomes g " + clause,
        binder,
        rows -> {
          Genome genome =
              Genome.builder()
                  .setId(rows.getString(1))
                  .setName(rows.getString(2))
                  .setDescription(rows.getString(3))
                  .setSource(rows.getString(4))
                  .setParameters(parameters(rows.getString(5)))
                  .setParentIds(strings(rows.getString(6)))
                  .setGeneration(rows.getInt(8))
                  .setFitness(rows.getDouble(9))
                  .build();
          return StoredGenome.create(
              genome,
              rows.getString(7),
              rows.getDouble(10),
              rows.getInt(11),
              strings(rows.getString(12)).stream()
                  .collect(toImmutableSortedSet(Ordering.natural())));
        });
  }

  private ImmutableList<Version> queryVersions(String sql, Binder binder) {
    return query(
        "read versions",
        sql,
        binder,
        rows ->
            Version.builder()
                .setId(rows.getString(1))
                .setGenomeId(rows.getString(2))
                .setVersionNumber(rows.getInt(3))
                .setParentVersionId(Optional.ofNullable(rows.getString(4)))
                .setCommitHash(rows.getString(5))
                .setSource(rows.getString(6))
                .setParameters(parameters(rows.getString(7)))
                .setNote(rows.getString(8))
                .setDeploymentReady(rows.getBoolean(9))
                .setValidationPassed(rows.getBoolean(10))
                .setCreatedAt(rows.getTimestamp(11).toInstant())
                .build());
  }

  private Map<String, Double> parameters(String json) {
    return gson.fromJson(json, PARAMETERS_TYPE);
  }

  private List<String> strings(String json) {
    return gson.fromJson(json, STRING_LIST_TYPE);
  }

  private <T> ImmutableList<T> query(
      String description, String sql, Binder binder, RowMapper<T> mapper) {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(sql)) {
      binder.bind(statement);
      ImmutableList.Builder<T> results = ImmutableList.builder();
      try (ResultSet rows = statement.executeQuery()) {
        while (rows.next()) {
          results.add(mapper.map(rows));
        }
      }
      return results.build();
    } catch (SQLException e) {
      logger.atSevere().withCause(e).log("Failed to %s", description);
      throw new RegistryException("Failed to " + description, e);
    }
  }

  private <T> T inTransaction(String description, Work<T> work) {
    try (Connection connection = dataSource.getConnection()) {
      connection.setAutoCommit(false);
      try {
        T result = work.run(connection);
        connection.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        connection.rollback();
        throw e;
      }
    } catch (SQLException e) {
      logger.atSevere().withCause(e).log("Failed to %s", description);
      throw new RegistryException("Failed to " + description, e);
    }
  }

  @FunctionalInterface
  private interface Work<T> {
    T run(Connection connection) throws SQLException;
  }

  @FunctionalInterface
  private interface Binder {
    void bind(PreparedStatement statement) throws SQLException;
  }

  @FunctionalInterface
  private interface RowMapper<T> {
    T map(ResultSet rows) throws SQLException;
  }
}
