package io.b2mash.b2b.recordcore.config;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.LocaleResolver;
import org.springframework.web.servlet.i18n.AcceptHeaderLocaleResolver;

@Configuration
@EnableConfigurationProperties(RecordCoreProperties.class)
public class RecordCoreConfig {

  public static final Locale INDONESIAN = Locale.forLanguageTag("id");

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  /** English by default; Indonesian when the Accept-Language header asks for it. */
  @Bean
  LocaleResolver localeResolver() {
    var resolver = new AcceptHeaderLocaleResolver();
    resolver.setSupportedLocales(List.of(Locale.ENGLISH, INDONESIAN));
    resolver.setDefaultLocale(Locale.ENGLISH);
    return resolver;
  }
}
