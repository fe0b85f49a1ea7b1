package com.ospicorp.dashboardapi.data.model;

import java.time.LocalDateTime;

// Bucket timestamp (UTC) and its aggregated value as returned by storage
public record DataPoint(LocalDateTime date, Double value) {}
