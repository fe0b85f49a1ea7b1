package com.ospicorp.dashboardapi.data.model;

public record GroupedValue(int groupKey, Double value) {}
