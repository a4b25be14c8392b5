package io.certcsi.observer.infra.kubernetes;

import io.certcsi.observation.model.EntityCount;
import io.certcsi.observer.observer.EntityCountSource;
import io.certcsi.observer.observer.ResourceStates;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Lists the claims and pods of a namespace and buckets them by state. Terminating wins over
 * bound/ready, anything else is still being created.
 */
public final class KubernetesEntityCountSource implements EntityCountSource {

  private final KubernetesClient client;
  private final String namespace;

  public KubernetesEntityCountSource(KubernetesClient client, String namespace) {
    this.client = Objects.requireNonNull(client, "client");
    this.namespace = Objects.requireNonNull(namespace, "namespace");
  }

  @Override
  public EntityCount sample(long testCaseId, Instant timestamp) {
    List<PersistentVolumeClaim> claims = client.persistentVolumeClaims().inNamespace(namespace).list().getItems();
    List<Pod> pods = client.pods().inNamespace(namespace).list().getItems();
    return count(testCaseId, timestamp, claims, pods);
  }

  static EntityCount count(long testCaseId, Instant timestamp, List<PersistentVolumeClaim> claims, List<Pod> pods) {
    int pvcCreating = 0;
    int pvcBound = 0;
    int pvcTerminating = 0;
    for (PersistentVolumeClaim claim : claims) {
      if (ResourceStates.isDeleting(claim)) {
        pvcTerminating++;
      } else if (ResourceStates.isBound(claim)) {
        pvcBound++;
      } else {
        pvcCreating++;
      }
    }
    int podsCreating = 0;
    int podsReady = 0;
    int podsTerminating = 0;
    for (Pod pod : pods) {
      if (ResourceStates.isDeleting(pod)) {
        podsTerminating++;
      } else if (ResourceStates.isReady(pod)) {
        podsReady++;
      } else {
        podsCreating++;
      }
    }
    return new EntityCount(testCaseId, timestamp, podsCreating, podsReady, podsTerminating,
        pvcCreating, pvcBound, pvcTerminating);
  }
}
