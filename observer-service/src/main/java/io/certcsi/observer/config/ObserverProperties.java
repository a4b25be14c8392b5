package io.certcsi.observer.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "certcsi.observer")
public class ObserverProperties {

    private final String namespace;
    private final Duration watchTimeout;
    private final Duration shutdownTimeout;
    private final Duration entityCountInterval;
    private final Set<ObserverKind> enabled;

    public ObserverProperties(@DefaultValue("default") @NotBlank String namespace,
                              @DefaultValue("30m") @NotNull Duration watchTimeout,
                              @DefaultValue("1m") @NotNull Duration shutdownTimeout,
                              @DefaultValue("10s") @NotNull Duration entityCountInterval,
                              @DefaultValue({"PERSISTENT_VOLUME_CLAIM", "POD", "VOLUME_ATTACHMENT", "ENTITY_COUNT"})
                              @NotEmpty Set<ObserverKind> enabled) {
        this.namespace = requireNonBlank(namespace, "namespace");
        this.watchTimeout = requirePositive(watchTimeout, "watchTimeout");
        this.shutdownTimeout = requirePositive(shutdownTimeout, "shutdownTimeout");
        this.entityCountInterval = requirePositive(entityCountInterval, "entityCountInterval");
        if (enabled == null || enabled.isEmpty()) {
            throw new IllegalArgumentException("enabled must name at least one observer");
        }
        this.enabled = Set.copyOf(EnumSet.copyOf(enabled));
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Upper bound of a single watch session. The API server is asked to end the stream after this
     * long and the client closes it itself if the server doesn't.
     */
    public Duration getWatchTimeout() {
        return watchTimeout;
    }

    /**
     * How long {@code stop()} waits for observers to flush.
     */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration getEntityCountInterval() {
        return entityCountInterval;
    }

    public Set<ObserverKind> getEnabled() {
        return enabled;
    }

    public boolean isEnabled(ObserverKind kind) {
        return enabled.contains(kind);
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
