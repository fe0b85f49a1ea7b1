package com.ospicorp.dashboardapi.data.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.dashboardapi.data.model.DataPoint;
import com.ospicorp.dashboardapi.data.model.GroupedValue;
import com.ospicorp.dashboardapi.data.model.RepartitionAggregate;
import com.ospicorp.dashboardapi.data.model.XyPoint;
import com.ospicorp.dashboardapi.data.model.enums.Aggregation;
import com.ospicorp.dashboardapi.data.model.enums.AxisField;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;
import com.ospicorp.dashboardapi.data.model.enums.GroupByField;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers
class DataValueDaoIT {
  private static final LocalDateTime START = LocalDateTime.of(2018, 1, 1, 0, 0);
  private static final LocalDateTime END = LocalDateTime.of(2018, 1, 14, 23, 59, 59);

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void configureDataSource(DynamicPropertyRegistry registry) {
    POSTGRES.start();
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("dashboard.seed.enabled", () -> "false");
  }

  @Autowired
  private DataValueDao dao;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  private long elecFeed;
  private long tempFeed;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM place");
    jdbcTemplate.update("INSERT INTO place(id, name) VALUES ('it', 'IT place')");
    elecFeed = jdbcTemplate.queryForObject(
        "INSERT INTO feed_data(place_id, data_type, unit) VALUES ('it', 'CONSO_ELEC', 'kWh') RETURNING id",
        Long.class);
    tempFeed = jdbcTemplate.queryForObject(
        "INSERT INTO feed_data(place_id, data_type, unit) VALUES ('it', 'TEMPERATURE', 'C') RETURNING id",
        Long.class);
  }

  @Test
  void insertDerivesCalendarColumns() {
    dao.insertBatch(elecFeed, Frequency.HOUR,
        List.of(new DataPoint(LocalDateTime.of(2018, 12, 31, 14, 0), 2.0)));

    var row = jdbcTemplate.queryForMap(
        "SELECT hour, week_day, week, month, year FROM data_value WHERE feed_data_id = ?", elecFeed);

    assertThat(((Number) row.get("hour")).intValue()).isEqualTo(14);
    assertThat(((Number) row.get("week_day")).intValue()).isZero();
    assertThat(((Number) row.get("week")).intValue()).isEqualTo(1);
    assertThat(((Number) row.get("month")).intValue()).isEqualTo(12);
    assertThat(((Number) row.get("year")).intValue()).isEqualTo(2019);
  }

  @Test
  void weekRepartitionAveragesPerWeekdayAndHour() {
    dao.insertBatch(elecFeed, Frequency.HOUR, List.of(
        new DataPoint(LocalDateTime.of(2018, 1, 1, 10, 0), 2.0),
        new DataPoint(LocalDateTime.of(2018, 1, 8, 10, 0), 4.0),
        new DataPoint(LocalDateTime.of(2018, 1, 9, 3, 0), 1.0)));

    List<RepartitionAggregate> aggregates = dao.fetchRepartition(elecFeed, START, END,
        AxisField.WEEK_DAY, AxisField.HOUR, Frequency.HOUR, false);

    assertThat(aggregates).containsExactly(
        new RepartitionAggregate(0, 10, null, 3.0),
        new RepartitionAggregate(1, 3, null, 1.0));
  }

  @Test
  void yearRepartitionCarriesIsoYear() {
    dao.insertBatch(elecFeed, Frequency.DAY, List.of(
        new DataPoint(LocalDateTime.of(2018, 1, 2, 0, 0), 5.0)));

    List<RepartitionAggregate> aggregates = dao.fetchRepartition(elecFeed, START, END,
        AxisField.WEEK, AxisField.WEEK_DAY, Frequency.DAY, true);

    assertThat(aggregates).containsExactly(new RepartitionAggregate(1, 1, 2018, 5.0));
  }

  @Test
  void rangeQueriesOnlySeeTheRequestedFrequency() {
    dao.insertBatch(elecFeed, Frequency.DAY, List.of(
        new DataPoint(LocalDateTime.of(2018, 1, 1, 0, 0), 10.0),
        new DataPoint(LocalDateTime.of(2018, 1, 2, 0, 0), -3.0),
        new DataPoint(LocalDateTime.of(2018, 1, 20, 0, 0), 99.0)));
    dao.insertBatch(elecFeed, Frequency.HOUR, List.of(
        new DataPoint(LocalDateTime.of(2018, 1, 1, 5, 0), 100.0)));

    assertThat(dao.fetchRange(elecFeed, START, END, Frequency.DAY))
        .extracting(DataPoint::value).containsExactly(10.0, -3.0);
    assertThat(dao.aggregate(elecFeed, START, END, Frequency.DAY, Aggregation.SUM)).isEqualTo(7.0);
    assertThat(dao.aggregate(elecFeed, START, END, Frequency.DAY, Aggregation.MIN)).isEqualTo(-3.0);
    assertThat(dao.aggregate(elecFeed, START, END, Frequency.DAY, Aggregation.AVG)).isEqualTo(3.5);
    assertThat(dao.countBelow(elecFeed, START, END, Frequency.DAY, 0.0)).isEqualTo(1L);
    assertThat(dao.sumGroupBy(elecFeed, START, END, Frequency.DAY, GroupByField.WEEK_DAY))
        .containsExactly(new GroupedValue(0, 10.0), new GroupedValue(1, -3.0));
  }

  @Test
  void aggregateOfEmptyRangeIsNull() {
    assertThat(dao.aggregate(elecFeed, START, END, Frequency.DAY, Aggregation.MAX)).isNull();
  }

  @Test
  void pairsJoinTwoFeedsOnTimestamp() {
    dao.insertBatch(tempFeed, Frequency.DAY, List.of(
        new DataPoint(LocalDateTime.of(2018, 1, 1, 0, 0), -2.0),
        new DataPoint(LocalDateTime.of(2018, 1, 2, 0, 0), 1.0)));
    dao.insertBatch(elecFeed, Frequency.DAY, List.of(
        new DataPoint(LocalDateTime.of(2018, 1, 2, 0, 0), 30.0)));

    assertThat(dao.fetchPairs(tempFeed, elecFeed, START, END, Frequency.DAY))
        .containsExactly(new XyPoint(LocalDateTime.of(2018, 1, 2, 0, 0), 1.0, 30.0));
  }
}
