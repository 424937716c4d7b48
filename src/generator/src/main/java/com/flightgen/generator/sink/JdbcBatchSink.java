package com.flightgen.generator.sink;

import com.flightgen.generator.config.GeneratorProperties;
import com.flightgen.generator.pipeline.Batch;
import com.flightgen.generator.plane.TelemetryRow;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes batches to QuestDB over its PostgreSQL wire endpoint.
 *
 * <p>Each batch is one JDBC batch insert inside one transaction, so a batch is either stored
 * whole or rolled back. Connections come from a HikariCP pool shared by all plane workers; the
 * pool is built on the first batch, after the run configuration has been validated.
 */
public class JdbcBatchSink implements BatchSink, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JdbcBatchSink.class);

  static final String COLUMNS =
      "plane_id, seq, latitude, longitude, altitude, ground_speed, heading, pitch, roll, yaw, aoa, oat, ts";

  private final Supplier<DataSource> dataSourceFactory;
  private final boolean createTable;
  private final Set<String> preparedTables = ConcurrentHashMap.newKeySet();
  private volatile DataSource dataSource;

  public JdbcBatchSink(DataSource dataSource, boolean createTable) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.dataSourceFactory = () -> dataSource;
    this.createTable = createTable;
  }

  private JdbcBatchSink(Supplier<DataSource> dataSourceFactory, boolean createTable) {
    this.dataSourceFactory = dataSourceFactory;
    this.createTable = createTable;
  }

  /**
   * Builds a pooled sink for a JDBC URL such as {@code jdbc:postgresql://localhost:8812/qdb}.
   *
   * <p>Neither the URL nor the database is touched until the first batch is sent.
   */
  public static JdbcBatchSink create(String jdbcUrl, GeneratorProperties.Jdbc settings) {
    return new JdbcBatchSink(() -> newPool(jdbcUrl, settings), settings == null || settings.createTable());
  }

  @Override
  public void send(String tableName, Batch batch) throws SinkException {
    if (batch.size() == 0) {
      return;
    }
    try (Connection connection = dataSource().getConnection()) {
      ensureTable(connection, tableName);
      connection.setAutoCommit(false);
      try (PreparedStatement stmt = connection.prepareStatement(insertSql(tableName))) {
        for (TelemetryRow row : batch.rows()) {
          bind(stmt, row);
          stmt.addBatch();
        }
        stmt.executeBatch();
        connection.commit();
      } catch (SQLException ex) {
        rollback(connection, ex);
        throw ex;
      }
    } catch (SQLException ex) {
      throw new SinkException(
          "JDBC insert of " + batch.size() + " rows for plane " + batch.planeId() + " failed: " + ex.getMessage(), ex);
    }
    log.debug("Inserted {} rows for plane {} into {}", batch.size(), batch.planeId(), tableName);
  }

  @Override
  public void close() {
    if (dataSource instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Error closing JDBC sink", ex);
      }
    }
  }

  /** Whether the connection pool has been built yet. */
  boolean isConnected() {
    return dataSource != null;
  }

  private DataSource dataSource() {
    DataSource current = dataSource;
    if (current == null) {
      synchronized (this) {
        current = dataSource;
        if (current == null) {
          current = dataSourceFactory.get();
          dataSource = current;
        }
      }
    }
    return current;
  }

  private static HikariDataSource newPool(String jdbcUrl, GeneratorProperties.Jdbc settings) {
    HikariConfig hikari = new HikariConfig();
    hikari.setPoolName("flightgen-sink");
    hikari.setJdbcUrl(jdbcUrl);
    if (settings != null) {
      hikari.setUsername(settings.username());
      hikari.setPassword(settings.password());
      hikari.setMaximumPoolSize(Math.max(1, settings.poolSize()));
    }
    hikari.setMinimumIdle(1);
    hikari.setConnectionTimeout(5000);
    hikari.setInitializationFailTimeout(-1);
    hikari.setAutoCommit(false);

    log.info("Opening JDBC sink pool: url={}, poolSize={}", jdbcUrl, hikari.getMaximumPoolSize());
    return new HikariDataSource(hikari);
  }

  static String insertSql(String tableName) {
    return "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
  }

  static String createTableSql(String tableName) {
    return "CREATE TABLE IF NOT EXISTS " + tableName + " ("
        + "plane_id SYMBOL, seq LONG, latitude DOUBLE, longitude DOUBLE, altitude DOUBLE, "
        + "ground_speed DOUBLE, heading DOUBLE, pitch DOUBLE, roll DOUBLE, yaw DOUBLE, aoa DOUBLE, oat DOUBLE, "
        + "ts TIMESTAMP) TIMESTAMP(ts) PARTITION BY DAY";
  }

  private void ensureTable(Connection connection, String tableName) throws SQLException {
    if (!createTable || preparedTables.contains(tableName)) {
      return;
    }
    connection.setAutoCommit(true);
    try (Statement stmt = connection.createStatement()) {
      stmt.execute(createTableSql(tableName));
    }
    if (preparedTables.add(tableName)) {
      log.info("Ensured table {} exists", tableName);
    }
  }

  private static void bind(PreparedStatement stmt, TelemetryRow row) throws SQLException {
    stmt.setString(1, row.planeId().toString());
    stmt.setLong(2, row.sequence());
    stmt.setDouble(3, row.latitude());
    stmt.setDouble(4, row.longitude());
    stmt.setDouble(5, row.altitude());
    stmt.setDouble(6, row.groundSpeed());
    stmt.setDouble(7, row.heading());
    stmt.setDouble(8, row.pitch());
    stmt.setDouble(9, row.roll());
    stmt.setDouble(10, row.yaw());
    stmt.setDouble(11, row.angleOfAttack());
    stmt.setDouble(12, row.outsideAirTemp());
    stmt.setTimestamp(13, Timestamp.from(row.timestamp()));
  }

  private static void rollback(Connection connection, SQLException cause) {
    try {
      connection.rollback();
    } catch (SQLException rollbackEx) {
      cause.addSuppressed(rollbackEx);
    }
  }
}
