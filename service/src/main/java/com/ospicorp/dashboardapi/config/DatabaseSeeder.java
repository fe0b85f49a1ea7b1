package com.ospicorp.dashboardapi.config;

import com.ospicorp.dashboardapi.data.model.DataPoint;
import com.ospicorp.dashboardapi.data.model.enums.DataType;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;
import com.ospicorp.dashboardapi.data.repository.DataValueDao;
import com.ospicorp.dashboardapi.place.model.FeedData;
import com.ospicorp.dashboardapi.place.model.Place;
import com.ospicorp.dashboardapi.place.repository.FeedDataRepository;
import com.ospicorp.dashboardapi.place.repository.PlaceRepository;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Loads a demo place with hourly electricity and temperature readings, and their coarser
 * aggregates, so the dashboard has something to draw on a fresh database.
 */
@Component
public class DatabaseSeeder implements CommandLineRunner {
  static final String DEMO_PLACE_ID = "demo";
  static final LocalDateTime SEED_START = LocalDateTime.of(2018, 1, 1, 0, 0);
  static final int SEED_DAYS = 70;

  private static final Logger log = LoggerFactory.getLogger(DatabaseSeeder.class);
  private static final List<Frequency> ROLLUPS =
      List.of(Frequency.DAY, Frequency.WEEK, Frequency.MONTH, Frequency.YEAR);

  private final PlaceRepository placeRepository;
  private final FeedDataRepository feedDataRepository;
  private final DataValueDao dataDao;
  private final TransactionTemplate transactions;
  private final Environment environment;
  private final boolean seedEnabled;
  private final Random random = new Random(8675309L);

  public DatabaseSeeder(PlaceRepository placeRepository,
      FeedDataRepository feedDataRepository,
      DataValueDao dataDao,
      TransactionTemplate transactions,
      Environment environment,
      @Value("${dashboard.seed.enabled:false}") boolean seedEnabled) {
    this.placeRepository = placeRepository;
    this.feedDataRepository = feedDataRepository;
    this.dataDao = dataDao;
    this.transactions = transactions;
    this.environment = environment;
    this.seedEnabled = seedEnabled;
  }

  @Override
  public void run(String... args) {
    if (!seedEnabled) {
      log.info("Database seeding disabled via property dashboard.seed.enabled=false");
      return;
    }
    if (environment.acceptsProfiles(Profiles.of("prod"))) {
      log.info("Skipping database seeding because active profile includes prod");
      return;
    }
    if (placeRepository.existsById(DEMO_PLACE_ID)) {
      log.info("Demo place '{}' already present; skipping seeding", DEMO_PLACE_ID);
      return;
    }
    transactions.executeWithoutResult(status -> seedDatabase());
  }

  void seedDatabase() {
    log.info("Seeding demo place '{}' from {} over {} days", DEMO_PLACE_ID, SEED_START, SEED_DAYS);
    Place place = new Place();
    place.setId(DEMO_PLACE_ID);
    place.setName("Demo house");
    place.setAddress("1 rue de la Demo, Paris");
    place.setCreatedAt(Instant.now().truncatedTo(ChronoUnit.SECONDS));
    placeRepository.saveAndFlush(place);

    int total = 0;
    total += seedFeed(feed(DataType.CONSO_ELEC, "kWh"), true, this::electricity);
    total += seedFeed(feed(DataType.TEMPERATURE, "°C"), false, this::temperature);
    log.info("Inserted {} data values for demo place '{}'", total, DEMO_PLACE_ID);
  }

  private FeedData feed(DataType dataType, String unit) {
    FeedData feed = new FeedData();
    feed.setPlaceId(DEMO_PLACE_ID);
    feed.setDataType(dataType);
    feed.setUnit(unit);
    return feedDataRepository.saveAndFlush(feed);
  }

  private int seedFeed(FeedData feed, boolean additive, Reading reading) {
    List<DataPoint> hourly = new ArrayList<>(SEED_DAYS * 24);
    LocalDateTime end = SEED_START.plusDays(SEED_DAYS);
    for (LocalDateTime ts = SEED_START; ts.isBefore(end); ts = ts.plusHours(1)) {
      hourly.add(new DataPoint(ts, round(reading.at(ts))));
    }
    int inserted = dataDao.insertBatch(feed.getId(), Frequency.HOUR, hourly).length;
    for (Frequency frequency : ROLLUPS) {
      inserted += dataDao.insertBatch(feed.getId(), frequency,
          rollUp(hourly, frequency, additive)).length;
    }
    return inserted;
  }

  // energy adds up over a bucket, temperature is averaged
  static List<DataPoint> rollUp(List<DataPoint> hourly, Frequency frequency, boolean additive) {
    Map<LocalDateTime, double[]> buckets = new TreeMap<>();
    for (DataPoint point : hourly) {
      double[] acc = buckets.computeIfAbsent(frequency.bucketStart(point.date()),
          key -> new double[2]);
      acc[0] += point.value();
      acc[1]++;
    }
    List<DataPoint> rolled = new ArrayList<>(buckets.size());
    buckets.forEach((ts, acc) ->
        rolled.add(new DataPoint(ts, round(additive ? acc[0] : acc[0] / acc[1]))));
    return rolled;
  }

  private double electricity(LocalDateTime ts) {
    int hour = ts.getHour();
    double base = hour >= 7 && hour <= 22 ? 1.2 : 0.4;
    double evening = hour >= 18 && hour <= 21 ? 0.9 : 0.0;
    double weekend = ts.getDayOfWeek().getValue() >= 6 ? 0.3 : 0.0;
    return Math.max(0.0, base + evening + weekend + random.nextGaussian() * 0.15);
  }

  private double temperature(LocalDateTime ts) {
    double daily = 3.0 * Math.sin(2.0 * Math.PI * (ts.getHour() - 9) / 24.0);
    double seasonal = 0.05 * ChronoUnit.DAYS.between(SEED_START, ts);
    return 4.0 + seasonal + daily + random.nextGaussian() * 0.5;
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }

  @FunctionalInterface
  private interface Reading {
    double at(LocalDateTime ts);
  }
}
