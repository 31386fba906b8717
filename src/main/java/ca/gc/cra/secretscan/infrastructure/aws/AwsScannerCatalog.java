package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.ResourceScanner;
import ca.gc.cra.secretscan.application.port.ThrottlingClassifier;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.util.List;
import java.util.Objects;

/**
 * Maps resource types to their AWS scanners.
 *
 * @since 0.1.0
 */
public final class AwsScannerCatalog {
  private final AwsClientFactory clients;
  private final ThrottlingClassifier throttling;
  private final CodeArchiveReader archives;

  public AwsScannerCatalog(AwsClientFactory clients, ThrottlingClassifier throttling) {
    this(clients, throttling, new HttpCodeArchiveReader());
  }

  AwsScannerCatalog(AwsClientFactory clients, ThrottlingClassifier throttling, CodeArchiveReader archives) {
    this.clients = Objects.requireNonNull(clients, "clients");
    this.throttling = Objects.requireNonNull(throttling, "throttling");
    this.archives = Objects.requireNonNull(archives, "archives");
  }

  /**
   * Builds scanners for the given types, preserving order.
   *
   * @param types resource types to scan
   * @return one scanner per type
   */
  public List<ResourceScanner> scannersFor(List<ResourceType> types) {
    return Objects.requireNonNull(types, "types").stream().map(this::scannerFor).toList();
  }

  ResourceScanner scannerFor(ResourceType type) {
    return switch (type) {
      case EC2_INSTANCE -> new Ec2InstanceScanner(clients.ec2());
      case EC2_LAUNCH_TEMPLATE -> new LaunchTemplateScanner(clients.ec2());
      case LAMBDA_FUNCTION -> new LambdaFunctionScanner(clients.lambda(), archives);
      case CLOUDFORMATION_STACK -> new CloudFormationStackScanner(clients.cloudFormation());
      case CLOUDFORMATION_STACK_SET -> new CloudFormationStackSetScanner(clients.cloudFormation());
      case CODEBUILD_PROJECT -> new CodeBuildProjectScanner(clients.codeBuild());
      case SAGEMAKER_PROCESSING_JOB -> new SageMakerProcessingJobScanner(clients.sageMaker());
      case GLUE_JOB -> new GlueJobScanner(clients.glue(), scripts());
      case EMR_CLUSTER -> new EmrClusterScanner(clients.emr(), scripts());
    };
  }

  private S3TextReader scripts() {
    return new S3TextReader(clients.s3(), throttling);
  }
}
