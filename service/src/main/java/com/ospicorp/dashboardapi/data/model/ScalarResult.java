package com.ospicorp.dashboardapi.data.model;

// value is null when storage had no rows for the range
public record ScalarResult(Double value) {}
