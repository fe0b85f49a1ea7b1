package com.ospicorp.dashboardapi.data.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.stereotype.Component;

/** Translated short weekday names, Monday first, from the {@code weekday.short.N} messages. */
@Component
public class WeekdayLabels {
  private static final String KEY_PREFIX = "weekday.short.";

  private final MessageSource messages;

  public WeekdayLabels(MessageSource messages) {
    this.messages = messages;
  }

  public List<String> shortLabels() {
    return shortLabels(LocaleContextHolder.getLocale());
  }

  public List<String> shortLabels(Locale locale) {
    List<String> labels = new ArrayList<>(7);
    for (int day = 1; day <= 7; day++) {
      labels.add(messages.getMessage(KEY_PREFIX + day, null, locale));
    }
    return List.copyOf(labels);
  }
}
