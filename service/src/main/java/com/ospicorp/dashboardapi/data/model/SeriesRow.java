package com.ospicorp.dashboardapi.data.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

// Flattened series entry for CSV exports
@JsonPropertyOrder({"label", "date", "value"})
public record SeriesRow(String label, String date, Double value) {}
