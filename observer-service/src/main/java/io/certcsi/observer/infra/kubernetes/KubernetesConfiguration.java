package io.certcsi.observer.infra.kubernetes;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Client built from the ambient kube config (in-cluster service account, {@code KUBECONFIG} or
 * {@code ~/.kube/config}).
 */
@Configuration
public class KubernetesConfiguration {

  @Bean(destroyMethod = "close")
  public KubernetesClient kubernetesClient() {
    return new KubernetesClientBuilder().build();
  }
}
