package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.DetailFetcher;
import ca.gc.cra.secretscan.application.port.ListingSource;
import ca.gc.cra.secretscan.application.port.ResourceScanner;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeLaunchTemplateVersionsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeLaunchTemplateVersionsResponse;
import software.amazon.awssdk.services.ec2.model.DescribeLaunchTemplatesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeLaunchTemplatesResponse;
import software.amazon.awssdk.services.ec2.model.LaunchTemplateVersion;

/**
 * Scans the user data of every version of every EC2 launch template.
 *
 * @since 0.1.0
 */
public final class LaunchTemplateScanner implements ResourceScanner {
  private final Ec2Client ec2;

  public LaunchTemplateScanner(Ec2Client ec2) {
    this.ec2 = Objects.requireNonNull(ec2, "ec2");
  }

  @Override
  public ResourceType resourceType() {
    return ResourceType.EC2_LAUNCH_TEMPLATE;
  }

  @Override
  public ListingSource newListingSource() {
    return new TokenPagedListingSource(token -> {
      DescribeLaunchTemplatesResponse response =
          ec2.describeLaunchTemplates(DescribeLaunchTemplatesRequest.builder().nextToken(token).build());
      List<ResourceRef> refs = response.launchTemplates().stream()
          .map(template -> new ResourceRef(
              resourceType(), template.launchTemplateId(), template.launchTemplateName()))
          .toList();
      return new TokenPagedListingSource.TokenPage(refs, response.nextToken());
    });
  }

  @Override
  public DetailFetcher detailFetcher() {
    return this::fetch;
  }

  private ResourceDetail fetch(ResourceRef ref) {
    ResourceDetail.Builder detail = ResourceDetail.builder(ref).label("Launch Template ID", ref.id());
    String token = null;
    do {
      DescribeLaunchTemplateVersionsResponse response = ec2.describeLaunchTemplateVersions(
          DescribeLaunchTemplateVersionsRequest.builder()
              .launchTemplateId(ref.id())
              .nextToken(token)
              .build());
      for (LaunchTemplateVersion version : response.launchTemplateVersions()) {
        if (version.launchTemplateData() != null) {
          detail.text(
              "UserData (version " + version.versionNumber() + ")",
              AwsText.decodeBase64(version.launchTemplateData().userData()));
        }
      }
      token = response.nextToken();
    } while (!AwsText.isBlank(token));
    return detail.build();
  }
}
