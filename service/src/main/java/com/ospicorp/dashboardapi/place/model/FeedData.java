package com.ospicorp.dashboardapi.place.model;

import com.ospicorp.dashboardapi.data.model.enums.DataType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/** One measurement stream of a place, e.g. the electricity meter or the outdoor thermometer. */
@Entity
@Table(name = "feed_data")
public class FeedData {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "place_id", nullable = false)
  private String placeId;

  @Enumerated(EnumType.STRING)
  @Column(name = "data_type", nullable = false)
  private DataType dataType;

  private String unit;

  public FeedData() {
    // JPA default constructor
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getPlaceId() {
    return placeId;
  }

  public void setPlaceId(String placeId) {
    this.placeId = placeId;
  }

  public DataType getDataType() {
    return dataType;
  }

  public void setDataType(DataType dataType) {
    this.dataType = dataType;
  }

  public String getUnit() {
    return unit;
  }

  public void setUnit(String unit) {
    this.unit = unit;
  }
}
