package com.ospicorp.dashboardapi.data.model;

/**
 * Aggregated value for one cell of a repartition grid, addressed by its raw bucket coordinates.
 * {@code year} is the ISO week-based year and is only set for year-style grids.
 */
public record RepartitionAggregate(int xKey, int yKey, Integer year, Double value) {

  public static RepartitionAggregate of(int xKey, int yKey, Double value) {
    return new RepartitionAggregate(xKey, yKey, null, value);
  }
}
