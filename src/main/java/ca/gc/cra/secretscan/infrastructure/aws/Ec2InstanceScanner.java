package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.DetailFetcher;
import ca.gc.cra.secretscan.application.port.ListingSource;
import ca.gc.cra.secretscan.application.port.ResourceScanner;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.AttributeValue;
import software.amazon.awssdk.services.ec2.model.DescribeInstanceAttributeRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceAttributeName;
import software.amazon.awssdk.services.ec2.model.Reservation;
import software.amazon.awssdk.services.ec2.model.Tag;

/**
 * Scans EC2 instance user data.
 *
 * @since 0.1.0
 */
public final class Ec2InstanceScanner implements ResourceScanner {
  static final String USER_DATA_FIELD = "UserData";

  private final Ec2Client ec2;

  public Ec2InstanceScanner(Ec2Client ec2) {
    this.ec2 = Objects.requireNonNull(ec2, "ec2");
  }

  @Override
  public ResourceType resourceType() {
    return ResourceType.EC2_INSTANCE;
  }

  @Override
  public ListingSource newListingSource() {
    return new TokenPagedListingSource(token -> {
      DescribeInstancesResponse response =
          ec2.describeInstances(DescribeInstancesRequest.builder().nextToken(token).build());
      List<ResourceRef> refs = new ArrayList<>();
      for (Reservation reservation : response.reservations()) {
        for (Instance instance : reservation.instances()) {
          refs.add(new ResourceRef(resourceType(), instance.instanceId(), nameTag(instance)));
        }
      }
      return new TokenPagedListingSource.TokenPage(refs, response.nextToken());
    });
  }

  @Override
  public DetailFetcher detailFetcher() {
    return this::fetch;
  }

  private ResourceDetail fetch(ResourceRef ref) {
    AttributeValue userData = ec2.describeInstanceAttribute(DescribeInstanceAttributeRequest.builder()
            .instanceId(ref.id())
            .attribute(InstanceAttributeName.USER_DATA)
            .build())
        .userData();
    return ResourceDetail.builder(ref)
        .label("Instance ID", ref.id())
        .text(USER_DATA_FIELD, userData == null ? null : AwsText.decodeBase64(userData.value()))
        .build();
  }

  private static String nameTag(Instance instance) {
    for (Tag tag : instance.tags()) {
      if ("Name".equals(tag.key())) {
        return tag.value();
      }
    }
    return instance.instanceId();
  }
}
