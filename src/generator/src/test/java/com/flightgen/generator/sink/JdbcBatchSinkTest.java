package com.flightgen.generator.sink;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flightgen.generator.pipeline.Batch;
import com.flightgen.generator.plane.PlaneId;
import com.flightgen.generator.plane.TelemetryRow;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcBatchSinkTest {
  private static final PlaneId PLANE = PlaneId.parse("AC03");

  private DataSource dataSource;
  private Connection connection;
  private PreparedStatement insert;
  private Statement ddl;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = mock(DataSource.class);
    connection = mock(Connection.class);
    insert = mock(PreparedStatement.class);
    ddl = mock(Statement.class);
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(insert);
    when(connection.createStatement()).thenReturn(ddl);
  }

  @Test
  void sendWritesWholeBatchInOneTransaction() throws Exception {
    JdbcBatchSink sink = new JdbcBatchSink(dataSource, false);
    Batch batch = new Batch(PLANE, List.of(row(0), row(1), row(2)));

    sink.send("flight_data", batch);

    verify(connection).prepareStatement(JdbcBatchSink.insertSql("flight_data"));
    verify(connection).setAutoCommit(false);
    verify(insert, times(3)).addBatch();
    verify(insert).executeBatch();
    verify(connection).commit();
    verify(connection, never()).rollback();
    verify(insert, times(3)).setString(1, "AC03");
    verify(insert).setLong(2, 2L);
    verify(insert, times(3)).setDouble(5, 35_000.0);
    verify(insert, times(3)).setDouble(10, 2.5);
    verify(insert).setTimestamp(13, Timestamp.from(Instant.parse("2024-05-01T00:00:01Z")));
    verify(connection).close();
  }

  @Test
  void failedInsertIsRolledBackAndReportedAsSinkException() throws Exception {
    when(insert.executeBatch()).thenThrow(new SQLException("table busy"));
    JdbcBatchSink sink = new JdbcBatchSink(dataSource, false);

    assertThatThrownBy(() -> sink.send("flight_data", new Batch(PLANE, List.of(row(0)))))
        .isInstanceOf(SinkException.class)
        .hasMessageContaining("AC03")
        .hasMessageContaining("table busy")
        .hasCauseInstanceOf(SQLException.class);
    verify(connection).rollback();
    verify(connection, never()).commit();
  }

  @Test
  void unreachableDatabaseIsReportedAsSinkException() throws Exception {
    when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));
    JdbcBatchSink sink = new JdbcBatchSink(dataSource, true);

    assertThatThrownBy(() -> sink.send("flight_data", new Batch(PLANE, List.of(row(0)))))
        .isInstanceOf(SinkException.class)
        .hasMessageContaining("Connection refused");
  }

  @Test
  void tableIsCreatedOncePerTable() throws Exception {
    JdbcBatchSink sink = new JdbcBatchSink(dataSource, true);

    sink.send("flight_data", new Batch(PLANE, List.of(row(0))));
    sink.send("flight_data", new Batch(PLANE, List.of(row(1))));

    verify(ddl, times(1)).execute(JdbcBatchSink.createTableSql("flight_data"));
    assertThat(JdbcBatchSink.createTableSql("flight_data"))
        .startsWith("CREATE TABLE IF NOT EXISTS flight_data (")
        .contains("plane_id SYMBOL")
        .endsWith("TIMESTAMP(ts) PARTITION BY DAY");
  }

  @Test
  void emptyBatchDoesNotTouchTheDatabase() throws Exception {
    new JdbcBatchSink(dataSource, true).send("flight_data", new Batch(PLANE, List.of()));

    verify(dataSource, never()).getConnection();
  }

  @Test
  void createDefersPoolUntilFirstBatch() {
    JdbcBatchSink sink = JdbcBatchSink.create("", null);

    assertThat(sink.isConnected()).isFalse();
    sink.close();
    assertThat(sink.isConnected()).isFalse();
  }

  @Test
  void insertListsEveryColumnOnce() {
    assertThat(JdbcBatchSink.insertSql("t"))
        .isEqualTo("INSERT INTO t (" + JdbcBatchSink.COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)");
    assertThat(JdbcBatchSink.COLUMNS.split(",")).hasSize(13);
  }

  private static TelemetryRow row(long sequence) {
    return new TelemetryRow(
        PLANE,
        sequence,
        Instant.parse("2024-05-01T00:00:00Z").plusSeconds(sequence),
        48.85,
        2.35,
        35_000.0,
        250.0,
        90.0,
        1.0,
        -1.0,
        2.5,
        4.0,
        -45.0);
  }
}
