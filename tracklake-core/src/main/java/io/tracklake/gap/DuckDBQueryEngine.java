/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.tracklake.gap;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import lombok.extern.log4j.Log4j2;

import io.tracklake.exception.QueryException;
import io.tracklake.model.Record;

/**
 * Runs read-only SQL against parquet files in an in-memory DuckDB database. Every query uses its
 * own connection, nothing is cached between queries.
 */
@Log4j2
public class DuckDBQueryEngine {
  private static final String JDBC_URL = "jdbc:duckdb:";

  public List<Record> query(SqlStatement statement) {
    log.debug("Running query {} with parameters {}", statement.getSql(), statement.getParameters());
    try (Connection connection = getConnection();
        PreparedStatement ps = prepare(connection, statement);
        ResultSet rs = ps.executeQuery()) {
      ResultSetMetaData meta = rs.getMetaData();
      List<Record> rows = new ArrayList<>();
      while (rs.next()) {
        Record.Builder row = Record.builder();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
          row.set(meta.getColumnLabel(i), toRecordValue(rs.getObject(i)));
        }
        rows.add(row.build());
      }
      return rows;
    } catch (SQLException e) {
      throw new QueryException("Failed to run query " + statement.getSql(), e);
    }
  }

  public long queryForLong(SqlStatement statement) {
    log.debug("Running query {} with parameters {}", statement.getSql(), statement.getParameters());
    try (Connection connection = getConnection();
        PreparedStatement ps = prepare(connection, statement);
        ResultSet rs = ps.executeQuery()) {
      if (!rs.next()) {
        throw new QueryException("Query returned no rows: " + statement.getSql(), null);
      }
      return rs.getLong(1);
    } catch (SQLException e) {
      throw new QueryException("Failed to run query " + statement.getSql(), e);
    }
  }

  Connection getConnection() throws SQLException {
    return DriverManager.getConnection(JDBC_URL);
  }

  private static PreparedStatement prepare(Connection connection, SqlStatement statement)
      throws SQLException {
    PreparedStatement ps = connection.prepareStatement(statement.getSql());
    List<Object> parameters = statement.getParameters();
    for (int i = 0; i < parameters.size(); i++) {
      ps.setObject(i + 1, parameters.get(i));
    }
    return ps;
  }

  // DuckDB timestamps without time zone are UTC wall clock values
  private static Object toRecordValue(Object value) {
    if (value instanceof Timestamp) {
      return ((Timestamp) value).toLocalDateTime().toInstant(ZoneOffset.UTC);
    } else if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate().atStartOfDay().toInstant(ZoneOffset.UTC);
    } else if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
    if (value instanceof UUID) {
      return value.toString();
    }
    return Record.normalize(value);
  }
}
