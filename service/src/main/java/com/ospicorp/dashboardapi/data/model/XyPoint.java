package com.ospicorp.dashboardapi.data.model;

import java.time.LocalDateTime;

public record XyPoint(LocalDateTime date, Double xValue, Double yValue) {}
