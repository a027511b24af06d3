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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import io.tracklake.model.gap.GapQuery;

/**
 * Renders gap queries as DuckDB SQL over the data files of the source and target tables.
 *
 * <p>The source is anti-joined with the distinct target keys, compared as strings so that keys
 * stored with different column types still match. Result rows are grouped by key, the context
 * columns of a key are resolved with {@code min()} and the key breaks every tie of the ordering
 * so that consecutive pages never overlap.
 */
class GapQuerySqlBuilder {
  private static final String SOURCE = "s";
  private static final String TARGET = "t";
  private static final String TARGET_KEY = "target_key";

  SqlStatement selectMissing(
      GapQuery query,
      List<String> sourceFiles,
      List<String> targetFiles,
      Instant recencyCutoff,
      long offset,
      int limit) {
    List<Object> parameters = new ArrayList<>();
    String key = column(SOURCE, query.getSourceKeyColumn());
    StringBuilder sql = new StringBuilder("SELECT ");
    sql.append(key).append(" AS ").append(quoteIdentifier(query.getSourceKeyColumn()));
    for (String contextColumn : contextColumns(query)) {
      sql.append(", min(")
          .append(column(SOURCE, contextColumn))
          .append(") AS ")
          .append(quoteIdentifier(contextColumn));
    }
    appendFromAndWhere(sql, parameters, query, sourceFiles, targetFiles, recencyCutoff);
    sql.append(" GROUP BY ").append(key);
    sql.append(" ORDER BY ");
    for (String orderColumn : query.getOrderBy()) {
      if (!orderColumn.equals(query.getSourceKeyColumn())) {
        sql.append("min(").append(column(SOURCE, orderColumn)).append(") ASC NULLS LAST, ");
      }
    }
    sql.append(key).append(" ASC");
    sql.append(" LIMIT ").append(limit).append(" OFFSET ").append(offset);
    return new SqlStatement(sql.toString(), parameters);
  }

  SqlStatement countMissing(
      GapQuery query, List<String> sourceFiles, List<String> targetFiles, Instant recencyCutoff) {
    List<Object> parameters = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT COUNT(DISTINCT ");
    sql.append(column(SOURCE, query.getSourceKeyColumn())).append(")");
    appendFromAndWhere(sql, parameters, query, sourceFiles, targetFiles, recencyCutoff);
    return new SqlStatement(sql.toString(), parameters);
  }

  SqlStatement selectExisting(List<String> files, String keyColumn, Collection<String> ids) {
    String key = "CAST(" + quoteIdentifier(keyColumn) + " AS VARCHAR)";
    String sql =
        "SELECT DISTINCT "
            + key
            + " AS "
            + quoteIdentifier(keyColumn)
            + " FROM "
            + readParquet(files)
            + " WHERE "
            + key
            + " IN ("
            + placeholders(ids.size())
            + ")";
    return new SqlStatement(sql, new ArrayList<>(ids));
  }

  private void appendFromAndWhere(
      StringBuilder sql,
      List<Object> parameters,
      GapQuery query,
      List<String> sourceFiles,
      List<String> targetFiles,
      Instant recencyCutoff) {
    String key = column(SOURCE, query.getSourceKeyColumn());
    sql.append(" FROM ").append(readParquet(sourceFiles)).append(" AS ").append(SOURCE);
    boolean hasTarget = !targetFiles.isEmpty();
    if (hasTarget) {
      sql.append(" LEFT JOIN (SELECT DISTINCT CAST(")
          .append(quoteIdentifier(query.getTargetKeyColumn()))
          .append(" AS VARCHAR) AS ")
          .append(TARGET_KEY)
          .append(" FROM ")
          .append(readParquet(targetFiles));
      if (query.getIncompleteTargetColumn() != null) {
        sql.append(" WHERE ")
            .append(quoteIdentifier(query.getIncompleteTargetColumn()))
            .append(" IS NOT NULL");
      }
      sql.append(") AS ")
          .append(TARGET)
          .append(" ON CAST(")
          .append(key)
          .append(" AS VARCHAR) = ")
          .append(TARGET)
          .append(".")
          .append(TARGET_KEY);
    }
    sql.append(" WHERE ").append(key).append(" IS NOT NULL");
    sql.append(" AND CAST(").append(key).append(" AS VARCHAR) <> ''");
    if (hasTarget) {
      sql.append(" AND ").append(TARGET).append(".").append(TARGET_KEY).append(" IS NULL");
    }
    for (String required : query.getRequiredSourceColumns()) {
      sql.append(" AND ").append(column(SOURCE, required)).append(" IS NOT NULL");
    }
    if (recencyCutoff != null) {
      sql.append(" AND ")
          .append(column(SOURCE, query.getRecencyColumn()))
          .append(" >= epoch_ms(CAST(? AS BIGINT))");
      parameters.add(recencyCutoff.toEpochMilli());
    }
    if (query.hasExclusions()) {
      String exclusion = column(SOURCE, query.getExclusionColumn());
      List<String> excluded = new ArrayList<>(query.getExcludedValues());
      Collections.sort(excluded);
      sql.append(" AND (")
          .append(exclusion)
          .append(" IS NULL OR CAST(")
          .append(exclusion)
          .append(" AS VARCHAR) NOT IN (")
          .append(placeholders(excluded.size()))
          .append("))");
      parameters.addAll(excluded);
    }
  }

  private static Set<String> contextColumns(GapQuery query) {
    Set<String> columns = new LinkedHashSet<>(query.getContextColumns());
    columns.remove(query.getSourceKeyColumn());
    return columns;
  }

  private static String readParquet(List<String> files) {
    return "read_parquet(["
        + files.stream().map(GapQuerySqlBuilder::quoteLiteral).collect(Collectors.joining(", "))
        + "], union_by_name=true)";
  }

  private static String placeholders(int count) {
    return String.join(", ", Collections.nCopies(count, "?"));
  }

  private static String column(String alias, String name) {
    return alias + "." + quoteIdentifier(name);
  }

  static String quoteIdentifier(String identifier) {
    // DuckDB uses double quotes for identifiers
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  static String quoteLiteral(String literal) {
    return "'" + literal.replace("'", "''") + "'";
  }
}
