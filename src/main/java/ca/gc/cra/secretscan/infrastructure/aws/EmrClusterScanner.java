package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.DetailFetcher;
import ca.gc.cra.secretscan.application.port.ListingSource;
import ca.gc.cra.secretscan.application.port.ResourceScanner;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.emr.EmrClient;
import software.amazon.awssdk.services.emr.model.ClusterState;
import software.amazon.awssdk.services.emr.model.Command;
import software.amazon.awssdk.services.emr.model.ListBootstrapActionsRequest;
import software.amazon.awssdk.services.emr.model.ListBootstrapActionsResponse;
import software.amazon.awssdk.services.emr.model.ListClustersRequest;
import software.amazon.awssdk.services.emr.model.ListClustersResponse;
import software.amazon.awssdk.services.emr.model.ListStepsRequest;
import software.amazon.awssdk.services.emr.model.ListStepsResponse;
import software.amazon.awssdk.services.emr.model.StepSummary;

/**
 * Scans EMR step arguments, bootstrap action arguments and bootstrap scripts of active clusters.
 *
 * @since 0.1.0
 */
public final class EmrClusterScanner implements ResourceScanner {
  static final List<ClusterState> ACTIVE_STATES = List.of(
      ClusterState.RUNNING, ClusterState.WAITING, ClusterState.BOOTSTRAPPING, ClusterState.STARTING);

  private final EmrClient emr;
  private final S3TextReader scripts;

  public EmrClusterScanner(EmrClient emr, S3TextReader scripts) {
    this.emr = Objects.requireNonNull(emr, "emr");
    this.scripts = Objects.requireNonNull(scripts, "scripts");
  }

  @Override
  public ResourceType resourceType() {
    return ResourceType.EMR_CLUSTER;
  }

  @Override
  public ListingSource newListingSource() {
    return new TokenPagedListingSource(marker -> {
      ListClustersResponse response = emr.listClusters(
          ListClustersRequest.builder().marker(marker).clusterStates(ACTIVE_STATES).build());
      List<ResourceRef> refs = response.clusters().stream()
          .map(cluster -> new ResourceRef(resourceType(), cluster.id(), cluster.name()))
          .toList();
      return new TokenPagedListingSource.TokenPage(refs, response.marker());
    });
  }

  @Override
  public DetailFetcher detailFetcher() {
    return this::fetch;
  }

  private ResourceDetail fetch(ResourceRef ref) {
    ResourceDetail.Builder detail = ResourceDetail.builder(ref).label("Cluster ID", ref.id());
    String marker = null;
    do {
      ListStepsResponse steps =
          emr.listSteps(ListStepsRequest.builder().clusterId(ref.id()).marker(marker).build());
      for (StepSummary step : steps.steps()) {
        if (step.config() != null) {
          detail.text("Step: " + step.name(), String.join(" ", step.config().args()));
        }
      }
      marker = steps.marker();
    } while (!AwsText.isBlank(marker));

    marker = null;
    do {
      ListBootstrapActionsResponse actions = emr.listBootstrapActions(
          ListBootstrapActionsRequest.builder().clusterId(ref.id()).marker(marker).build());
      for (Command action : actions.bootstrapActions()) {
        detail.text("Bootstrap Action: " + action.name(), String.join(" ", action.args()));
        if (!AwsText.isBlank(action.scriptPath())) {
          detail.text("Bootstrap Script: " + action.scriptPath(), scripts.read(action.scriptPath()).orElse(null));
        }
      }
      marker = actions.marker();
    } while (!AwsText.isBlank(marker));
    return detail.build();
  }
}
