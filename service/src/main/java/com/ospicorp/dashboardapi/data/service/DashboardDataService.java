package com.ospicorp.dashboardapi.data.service;

import com.ospicorp.dashboardapi.data.model.Axis;
import com.ospicorp.dashboardapi.data.model.CalendarLabels;
import com.ospicorp.dashboardapi.data.model.DataPoint;
import com.ospicorp.dashboardapi.data.model.GroupedValue;
import com.ospicorp.dashboardapi.data.model.RepartitionAggregate;
import com.ospicorp.dashboardapi.data.model.RepartitionAxes;
import com.ospicorp.dashboardapi.data.model.RepartitionGrid;
import com.ospicorp.dashboardapi.data.model.RepartitionResponse;
import com.ospicorp.dashboardapi.data.model.ScalarResult;
import com.ospicorp.dashboardapi.data.model.SeriesChart;
import com.ospicorp.dashboardapi.data.model.XyChart;
import com.ospicorp.dashboardapi.data.model.XyPoint;
import com.ospicorp.dashboardapi.data.model.enums.Aggregation;
import com.ospicorp.dashboardapi.data.model.enums.DataType;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;
import com.ospicorp.dashboardapi.data.model.enums.GroupByField;
import com.ospicorp.dashboardapi.data.model.enums.RepartitionType;
import com.ospicorp.dashboardapi.data.repository.DataValueDao;
import com.ospicorp.dashboardapi.place.model.FeedData;
import com.ospicorp.dashboardapi.place.repository.FeedDataRepository;
import com.ospicorp.dashboardapi.place.repository.PlaceRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class DashboardDataService {
  private static final Logger log = LoggerFactory.getLogger(DashboardDataService.class);
  private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

  private final PlaceRepository placeRepository;
  private final FeedDataRepository feedDataRepository;
  private final DataValueDao dataDao;
  private final WeekdayLabels weekdayLabels;
  private final Clock clock;
  private final LocalDate defaultStart;

  public DashboardDataService(PlaceRepository placeRepository,
      FeedDataRepository feedDataRepository,
      DataValueDao dataDao,
      WeekdayLabels weekdayLabels,
      Clock clock,
      @Value("${dashboard.default-start:2018-01-01}") String defaultStart) {
    this.placeRepository = placeRepository;
    this.feedDataRepository = feedDataRepository;
    this.dataDao = dataDao;
    this.weekdayLabels = weekdayLabels;
    this.clock = clock;
    this.defaultStart = LocalDate.parse(defaultStart);
  }

  public RepartitionResponse getRepartition(String placeId, DataType dataType,
      RepartitionType type, LocalDate start, LocalDate end) {
    DateRange range = resolveRange(start, end);
    FeedData feed = findFeed(placeId, dataType);

    RepartitionAxes axes = RepartitionAxisBuilder.build(type, range.start(), range.end(),
        weekdayLabels.shortLabels());
    List<RepartitionAggregate> aggregates = dataDao.fetchRepartition(feed.getId(), range.start(),
        range.end(), axes.xField(), axes.yField(), axes.frequency(), !type.weekStyle());

    // Vertical grids keep week-major cell order, only their displayed axes are swapped.
    Axis mergeAxis = type == RepartitionType.YEAR_VERTICAL ? axes.axis().transpose() : axes.axis();
    RepartitionGrid grid = AggregateGridBuilder.merge(mergeAxis, type.weekStyle(), aggregates);
    log.debug("Repartition {} ({} x {}) of {} at {}: {} aggregates on {} cells", type.code(),
        axes.xField().fieldName(), axes.yField().fieldName(), dataType, placeId,
        aggregates.size(), grid.size());
    return new RepartitionResponse(axes.axis(), grid);
  }

  public SeriesChart getEvolution(String placeId, DataType dataType, Frequency frequency,
      LocalDate start, LocalDate end) {
    DateRange range = resolveRange(start, end);
    FeedData feed = findFeed(placeId, dataType);

    List<DataPoint> rows = dataDao.fetchRange(feed.getId(), range.start(), range.end(), frequency);
    CalendarLabels axis = FrequencyCalendar.labels(frequency, range.start(), range.end());
    log.debug("Evolution {} of {} at {}: {} rows on {} buckets", frequency, dataType, placeId,
        rows.size(), axis.size());
    return EvolutionSeriesBuilder.build(axis, frequency, rows);
  }

  public SeriesChart getSumGroupBy(String placeId, DataType dataType, Frequency frequency,
      GroupByField groupBy, LocalDate start, LocalDate end) {
    DateRange range = resolveRange(start, end);
    FeedData feed = findFeed(placeId, dataType);

    List<GroupedValue> rows = dataDao.sumGroupBy(feed.getId(), range.start(), range.end(),
        frequency, groupBy);
    List<String> categories = switch (groupBy) {
      case WEEK_DAY -> weekdayLabels.shortLabels();
    };
    return GroupBySeriesBuilder.build(categories, rows);
  }

  public ScalarResult getSum(String placeId, DataType dataType, LocalDate start, LocalDate end) {
    return getAggregate(placeId, dataType, Frequency.DAY, Aggregation.SUM, start, end);
  }

  public ScalarResult getAggregate(String placeId, DataType dataType, Frequency frequency,
      Aggregation aggregation, LocalDate start, LocalDate end) {
    DateRange range = resolveRange(start, end);
    FeedData feed = findFeed(placeId, dataType);
    return new ScalarResult(
        dataDao.aggregate(feed.getId(), range.start(), range.end(), frequency, aggregation));
  }

  public ScalarResult countBelow(String placeId, DataType dataType, double threshold,
      Frequency frequency, LocalDate start, LocalDate end) {
    DateRange range = resolveRange(start, end);
    FeedData feed = findFeed(placeId, dataType);
    long count = dataDao.countBelow(feed.getId(), range.start(), range.end(), frequency,
        threshold);
    return new ScalarResult((double) count);
  }

  public XyChart getXy(String placeId, DataType dataTypeX, DataType dataTypeY,
      Frequency frequency, LocalDate start, LocalDate end) {
    DateRange range = resolveRange(start, end);
    FeedData feedX = findFeed(placeId, dataTypeX);
    FeedData feedY = findFeed(placeId, dataTypeY);

    List<XyPoint> rows = dataDao.fetchPairs(feedX.getId(), feedY.getId(), range.start(),
        range.end(), frequency);
    return XySeriesBuilder.build(frequency, rows);
  }

  private FeedData findFeed(String placeId, DataType dataType) {
    if (!StringUtils.hasText(placeId)) {
      throw new IllegalArgumentException("placeId must be provided");
    }
    if (!placeRepository.existsById(placeId)) {
      throw new NoSuchElementException("Place not found: " + placeId);
    }
    return feedDataRepository.findByPlaceIdAndDataType(placeId, dataType)
        .orElseThrow(() -> new NoSuchElementException(
            "No " + dataType + " feed for place " + placeId));
  }

  private DateRange resolveRange(LocalDate start, LocalDate end) {
    LocalDate effectiveStart = start != null ? start : defaultStart;
    LocalDate effectiveEnd = end != null ? end : LocalDate.now(clock);
    if (effectiveStart.isAfter(effectiveEnd)) {
      throw new IllegalArgumentException("start must be before or equal to end");
    }
    return new DateRange(effectiveStart.atStartOfDay(), effectiveEnd.atTime(END_OF_DAY));
  }

  private record DateRange(LocalDateTime start, LocalDateTime end) {}
}
