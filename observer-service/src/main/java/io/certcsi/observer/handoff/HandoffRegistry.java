package io.certcsi.observer.handoff;

import io.certcsi.observation.model.Entity;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Passes already-created entities from one observer to another that needs them to resolve its own
 * notifications, e.g. the claim observer publishes each bound claim under its volume name for the
 * volume-attachment observer.
 * <p>
 * One registry per test case, owned by the runner. Lookups never block: the consuming observer may
 * ask before the producing observer has published, in which case it gets an empty result and
 * decides itself whether to retry later. Publishing the same key again overwrites the previous
 * value.
 */
public final class HandoffRegistry {

  private final ConcurrentMap<String, Entity> entries = new ConcurrentHashMap<>();

  public void publish(String key, Entity entity) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(entity, "entity");
    entries.put(key, entity);
  }

  public Optional<Entity> lookup(String key) {
    if (key == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(entries.get(key));
  }

  public int size() {
    return entries.size();
  }
}
