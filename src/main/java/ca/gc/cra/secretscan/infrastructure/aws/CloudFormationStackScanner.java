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
import software.amazon.awssdk.services.cloudformation.model.DescribeStacksRequest;
import software.amazon.awssdk.services.cloudformation.model.GetTemplateRequest;
import software.amazon.awssdk.services.cloudformation.model.ListStacksRequest;
import software.amazon.awssdk.services.cloudformation.model.ListStacksResponse;
import software.amazon.awssdk.services.cloudformation.model.Parameter;
import software.amazon.awssdk.services.cloudformation.model.Stack;
import software.amazon.awssdk.services.cloudformation.model.StackStatus;

/**
 * Scans CloudFormation stack templates and parameters.
 *
 * @since 0.1.0
 */
public final class CloudFormationStackScanner implements ResourceScanner {
  static final List<StackStatus> LIVE_STATUSES = List.of(
      StackStatus.CREATE_COMPLETE,
      StackStatus.UPDATE_COMPLETE,
      StackStatus.UPDATE_ROLLBACK_COMPLETE,
      StackStatus.ROLLBACK_COMPLETE,
      StackStatus.IMPORT_COMPLETE,
      StackStatus.IMPORT_ROLLBACK_COMPLETE);

  private final CloudFormationClient cloudFormation;

  public CloudFormationStackScanner(CloudFormationClient cloudFormation) {
    this.cloudFormation = Objects.requireNonNull(cloudFormation, "cloudFormation");
  }

  @Override
  public ResourceType resourceType() {
    return ResourceType.CLOUDFORMATION_STACK;
  }

  @Override
  public ListingSource newListingSource() {
    return new TokenPagedListingSource(token -> {
      ListStacksResponse response = cloudFormation.listStacks(
          ListStacksRequest.builder().nextToken(token).stackStatusFilters(LIVE_STATUSES).build());
      List<ResourceRef> refs = response.stackSummaries().stream()
          .map(stack -> new ResourceRef(resourceType(), stack.stackId(), stack.stackName()))
          .toList();
      return new TokenPagedListingSource.TokenPage(refs, response.nextToken());
    });
  }

  @Override
  public DetailFetcher detailFetcher() {
    return this::fetch;
  }

  private ResourceDetail fetch(ResourceRef ref) {
    String template = cloudFormation.getTemplate(GetTemplateRequest.builder().stackName(ref.id()).build())
        .templateBody();
    List<Stack> stacks = cloudFormation.describeStacks(DescribeStacksRequest.builder().stackName(ref.id()).build())
        .stacks();
    List<Parameter> parameters = stacks.isEmpty() ? List.of() : stacks.get(0).parameters();
    return ResourceDetail.builder(ref)
        .label("Stack ID", ref.id())
        .text("Template", template)
        .keyValues("Parameters", AwsText.toMap(parameters, Parameter::parameterKey, Parameter::parameterValue))
        .build();
  }
}
