package com.ospicorp.dashboardapi.data.repository;

import com.ospicorp.dashboardapi.data.model.DataPoint;
import com.ospicorp.dashboardapi.data.model.GroupedValue;
import com.ospicorp.dashboardapi.data.model.RepartitionAggregate;
import com.ospicorp.dashboardapi.data.model.XyPoint;
import com.ospicorp.dashboardapi.data.model.enums.Aggregation;
import com.ospicorp.dashboardapi.data.model.enums.AxisField;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;
import com.ospicorp.dashboardapi.data.model.enums.GroupByField;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Reads pre-aggregated values of a feed. All timestamps are UTC bucket starts. Column names are
 * only ever taken from {@link AxisField}, {@link GroupByField} and {@link Aggregation}.
 */
@Repository
public class DataValueDao {
  private static final String RANGE_FILTER =
      "feed_data_id = ? AND frequency = ? AND ts BETWEEN ? AND ?";

  private final JdbcTemplate jdbc;

  public DataValueDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  public List<RepartitionAggregate> fetchRepartition(long feedId, LocalDateTime start,
      LocalDateTime end, AxisField xField, AxisField yField, Frequency frequency,
      boolean withYear) {
    String x = xField.column();
    String y = yField.column();
    String groupBy = withYear ? "year, " + x + ", " + y : x + ", " + y;
    String sql = "SELECT " + x + " AS axe_x, " + y + " AS axe_y, "
        + (withYear ? "year" : "NULL::INTEGER") + " AS axe_year, AVG(value) AS value"
        + " FROM data_value WHERE " + RANGE_FILTER
        + " GROUP BY " + groupBy
        + " ORDER BY " + groupBy;
    return jdbc.query(sql, (rs, i) -> new RepartitionAggregate(
            rs.getInt("axe_x"),
            rs.getInt("axe_y"),
            nullableInt(rs, "axe_year"),
            nullableDouble(rs, "value")),
        feedId, frequency.name(), start, end);
  }

  public List<DataPoint> fetchRange(long feedId, LocalDateTime start, LocalDateTime end,
      Frequency frequency) {
    String sql = """
      SELECT ts, value
      FROM data_value
      WHERE feed_data_id = ? AND frequency = ? AND ts BETWEEN ? AND ?
      ORDER BY ts
    """;
    return jdbc.query(sql, (rs, i) -> new DataPoint(rs.getObject(1, LocalDateTime.class),
                                                    nullableDouble(rs, "value")),
                      feedId, frequency.name(), start, end);
  }

  public List<GroupedValue> sumGroupBy(long feedId, LocalDateTime start, LocalDateTime end,
      Frequency frequency, GroupByField groupBy) {
    String column = groupBy.column();
    String sql = "SELECT " + column + " AS group_key, SUM(value) AS value"
        + " FROM data_value WHERE " + RANGE_FILTER
        + " GROUP BY " + column
        + " ORDER BY " + column;
    return jdbc.query(sql, (rs, i) -> new GroupedValue(rs.getInt("group_key"),
                                                       nullableDouble(rs, "value")),
                      feedId, frequency.name(), start, end);
  }

  public Double aggregate(long feedId, LocalDateTime start, LocalDateTime end,
      Frequency frequency, Aggregation aggregation) {
    String sql = "SELECT " + aggregation.name() + "(value) FROM data_value WHERE " + RANGE_FILTER;
    return jdbc.queryForObject(sql, Double.class, feedId, frequency.name(), start, end);
  }

  public long countBelow(long feedId, LocalDateTime start, LocalDateTime end,
      Frequency frequency, double threshold) {
    String sql = "SELECT COUNT(*) FROM data_value WHERE " + RANGE_FILTER + " AND value < ?";
    Long count = jdbc.queryForObject(sql, Long.class, feedId, frequency.name(), start, end,
        threshold);
    return count == null ? 0L : count;
  }

  public List<XyPoint> fetchPairs(long feedIdX, long feedIdY, LocalDateTime start,
      LocalDateTime end, Frequency frequency) {
    String sql = """
      SELECT x.ts, x.value AS x_value, y.value AS y_value
      FROM data_value x
      JOIN data_value y
        ON y.feed_data_id = ? AND y.frequency = x.frequency AND y.ts = x.ts
      WHERE x.feed_data_id = ? AND x.frequency = ? AND x.ts BETWEEN ? AND ?
      ORDER BY x.ts
    """;
    return jdbc.query(sql, (rs, i) -> new XyPoint(rs.getObject(1, LocalDateTime.class),
                                                  nullableDouble(rs, "x_value"),
                                                  nullableDouble(rs, "y_value")),
                      feedIdY, feedIdX, frequency.name(), start, end);
  }

  /** Stores bucket values together with the calendar coordinates the repartition views use. */
  public int[] insertBatch(long feedId, Frequency frequency, List<DataPoint> points) {
    final String sql = """
      INSERT INTO data_value(feed_data_id, frequency, ts, value, hour, week_day, week, month, year)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
    """;
    List<Object[]> batchArgs = new ArrayList<>(points.size());
    for (DataPoint point : points) {
      LocalDateTime ts = point.date();
      batchArgs.add(new Object[]{
          feedId,
          frequency.name(),
          ts,
          point.value(),
          ts.getHour(),
          ts.getDayOfWeek().getValue() - 1,
          ts.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
          ts.getMonthValue(),
          ts.get(IsoFields.WEEK_BASED_YEAR)
      });
    }
    return jdbc.batchUpdate(sql, batchArgs);
  }

  private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }

  private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }
}
