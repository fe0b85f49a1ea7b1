package com.ospicorp.dashboardapi.config;

import com.ospicorp.dashboardapi.data.controller.CsvHttpMessageConverter;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.ShallowEtagHeaderFilter;
import org.springframework.web.servlet.LocaleResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import org.springframework.web.servlet.i18n.AcceptHeaderLocaleResolver;

/**
 * MVC wiring of the dashboard: CSV series exports, ETags on chart payloads and the locales
 * weekday labels are translated into.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
  static final List<Locale> LABEL_LOCALES = List.of(Locale.ENGLISH, Locale.FRENCH);

  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(0, new CsvHttpMessageConverter());
  }

  // charts are polled; unchanged data answers 304
  @Bean
  ShallowEtagHeaderFilter shallowEtagHeaderFilter() {
    return new ShallowEtagHeaderFilter();
  }

  /** Accept-Language picks the weekday bundle; anything unsupported gets English labels. */
  @Bean
  LocaleResolver localeResolver() {
    AcceptHeaderLocaleResolver resolver = new AcceptHeaderLocaleResolver();
    resolver.setSupportedLocales(LABEL_LOCALES);
    resolver.setDefaultLocale(Locale.ENGLISH);
    return resolver;
  }

  // stored buckets are UTC, so is "today"
  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
