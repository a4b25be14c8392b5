package io.certcsi.observer.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class ObserverPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(
                  ConfigurationPropertiesAutoConfiguration.class, ValidationAutoConfiguration.class))
          .withUserConfiguration(Config.class);

  @Test
  void appliesDefaultsWhenNothingIsConfigured() {
    contextRunner.run(
        context -> {
          ObserverProperties properties = context.getBean(ObserverProperties.class);
          assertThat(properties.getNamespace()).isEqualTo("default");
          assertThat(properties.getWatchTimeout()).isEqualTo(Duration.ofMinutes(30));
          assertThat(properties.getShutdownTimeout()).isEqualTo(Duration.ofMinutes(1));
          assertThat(properties.getEntityCountInterval()).isEqualTo(Duration.ofSeconds(10));
          assertThat(properties.getEnabled()).containsExactlyInAnyOrder(ObserverKind.values());
        });
  }

  @Test
  void bindsExplicitValues() {
    contextRunner
        .withPropertyValues(
            "certcsi.observer.namespace=csi-cert",
            "certcsi.observer.watch-timeout=90s",
            "certcsi.observer.shutdown-timeout=15s",
            "certcsi.observer.entity-count-interval=2s",
            "certcsi.observer.enabled=persistent-volume-claim,volume-attachment")
        .run(
            context -> {
              ObserverProperties properties = context.getBean(ObserverProperties.class);
              assertThat(properties.getNamespace()).isEqualTo("csi-cert");
              assertThat(properties.getWatchTimeout()).isEqualTo(Duration.ofSeconds(90));
              assertThat(properties.getShutdownTimeout()).isEqualTo(Duration.ofSeconds(15));
              assertThat(properties.getEntityCountInterval()).isEqualTo(Duration.ofSeconds(2));
              assertThat(properties.getEnabled()).containsExactlyInAnyOrder(
                  ObserverKind.PERSISTENT_VOLUME_CLAIM, ObserverKind.VOLUME_ATTACHMENT);
              assertThat(properties.isEnabled(ObserverKind.POD)).isFalse();
            });
  }

  @Test
  void rejectsZeroWatchTimeout() {
    contextRunner
        .withPropertyValues("certcsi.observer.watch-timeout=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @EnableConfigurationProperties(ObserverProperties.class)
  private static class Config {}
}
