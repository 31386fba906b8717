package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.DetailFetcher;
import ca.gc.cra.secretscan.application.port.ListingSource;
import ca.gc.cra.secretscan.application.port.ResourceScanner;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.cloudformation.model.DescribeStackSetRequest;
import software.amazon.awssdk.services.cloudformation.model.ListStackSetsRequest;
import software.amazon.awssdk.services.cloudformation.model.ListStackSetsResponse;
import software.amazon.awssdk.services.cloudformation.model.Parameter;
import software.amazon.awssdk.services.cloudformation.model.StackSet;
import software.amazon.awssdk.services.cloudformation.model.StackSetStatus;

/**
 * Scans active CloudFormation stack set templates and parameters.
 *
 * @since 0.1.0
 */
public final class CloudFormationStackSetScanner implements ResourceScanner {
  private final CloudFormationClient cloudFormation;

  public CloudFormationStackSetScanner(CloudFormationClient cloudFormation) {
    this.cloudFormation = Objects.requireNonNull(cloudFormation, "cloudFormation");
  }

  @Override
  public ResourceType resourceType() {
    return ResourceType.CLOUDFORMATION_STACK_SET;
  }

  @Override
  public ListingSource newListingSource() {
    return new TokenPagedListingSource(token -> {
      ListStackSetsResponse response = cloudFormation.listStackSets(
          ListStackSetsRequest.builder().nextToken(token).status(StackSetStatus.ACTIVE).build());
      List<ResourceRef> refs = response.summaries().stream()
          .map(summary -> ResourceRef.of(resourceType(), summary.stackSetName()))
          .toList();
      return new TokenPagedListingSource.TokenPage(refs, response.nextToken());
    });
  }

  @Override
  public DetailFetcher detailFetcher() {
    return this::fetch;
  }

  private ResourceDetail fetch(ResourceRef ref) {
    StackSet stackSet = cloudFormation.describeStackSet(
        DescribeStackSetRequest.builder().stackSetName(ref.id()).build()).stackSet();
    if (stackSet == null) {
      throw new IllegalStateException("Stack set not found: " + ref.id());
    }
    return ResourceDetail.builder(ref)
        .label("StackSet ID", stackSet.stackSetId())
        .text("Template", stackSet.templateBody())
        .keyValues("Parameters",
            AwsText.toMap(stackSet.parameters(), Parameter::parameterKey, Parameter::parameterValue))
        .build();
  }
}
