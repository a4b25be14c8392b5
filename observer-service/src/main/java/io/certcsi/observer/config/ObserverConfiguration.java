package io.certcsi.observer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.certcsi.observer.collector.MetricsCollector;
import io.certcsi.observer.observer.ObserverMetrics;
import io.certcsi.store.EventStore;
import io.certcsi.store.jdbc.JdbcEventStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import javax.sql.DataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObserverConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public EventStore eventStore(DataSource dataSource, ObjectMapper objectMapper) {
    JdbcEventStore store = new JdbcEventStore(dataSource, objectMapper);
    store.initializeSchema();
    return store;
  }

  @Bean
  public ObserverMetrics observerMetrics(MeterRegistry meterRegistry) {
    return new ObserverMetrics(meterRegistry);
  }

  @Bean
  public MetricsCollector metricsCollector(EventStore eventStore) {
    return new MetricsCollector(eventStore);
  }
}
