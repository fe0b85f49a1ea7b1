package com.ospicorp.dashboardapi.data.model;

public record RepartitionResponse(Axis axe, RepartitionGrid data) {}
