package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.codebuild.CodeBuildClient;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.emr.EmrClient;
import software.amazon.awssdk.services.glue.GlueClient;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sagemaker.SageMakerClient;
import software.amazon.awssdk.utils.SdkAutoCloseable;

/**
 * <strong>What:</strong> Builds synchronous AWS SDK clients bound to one region and credential profile.
 * <p><strong>Why:</strong> Scanners of the same service share a client, and every client is closed with the run.</p>
 * <p><strong>Role:</strong> Infrastructure factory used by {@link AwsScannerCatalog}.</p>
 * <p><strong>Thread-safety:</strong> Accessors are synchronized; each client is created at most once.</p>
 * <p><strong>Observability:</strong> Logs client creation at DEBUG and close failures at WARN.</p>
 *
 * @since 0.1.0
 */
public final class AwsClientFactory implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AwsClientFactory.class);
  private static final String DEFAULT_PROFILE = "default";

  private final Region region;
  private final AwsCredentialsProvider credentials;
  private final List<SdkAutoCloseable> created = new ArrayList<>();

  private Ec2Client ec2;
  private LambdaClient lambda;
  private CloudFormationClient cloudFormation;
  private CodeBuildClient codeBuild;
  private SageMakerClient sageMaker;
  private GlueClient glue;
  private EmrClient emr;
  private S3Client s3;

  /**
   * Creates a factory.
   *
   * @param region AWS region id, e.g. {@code us-east-1}
   * @param profile shared-credentials profile; blank or {@code default} selects the default provider chain,
   *     which also honours environment variables and instance roles
   */
  public AwsClientFactory(String region, String profile) {
    this.region = Region.of(Strings.requireNonBlank("region", region));
    this.credentials = profile == null || profile.isBlank() || DEFAULT_PROFILE.equals(profile.trim())
        ? DefaultCredentialsProvider.create()
        : ProfileCredentialsProvider.create(profile.trim());
  }

  /** @return region every client is bound to */
  public Region region() {
    return region;
  }

  public synchronized Ec2Client ec2() {
    if (ec2 == null) {
      ec2 = track("ec2", () -> Ec2Client.builder().region(region).credentialsProvider(credentials).build());
    }
    return ec2;
  }

  public synchronized LambdaClient lambda() {
    if (lambda == null) {
      lambda = track("lambda", () -> LambdaClient.builder().region(region).credentialsProvider(credentials).build());
    }
    return lambda;
  }

  public synchronized CloudFormationClient cloudFormation() {
    if (cloudFormation == null) {
      cloudFormation = track("cloudformation",
          () -> CloudFormationClient.builder().region(region).credentialsProvider(credentials).build());
    }
    return cloudFormation;
  }

  public synchronized CodeBuildClient codeBuild() {
    if (codeBuild == null) {
      codeBuild = track("codebuild",
          () -> CodeBuildClient.builder().region(region).credentialsProvider(credentials).build());
    }
    return codeBuild;
  }

  public synchronized SageMakerClient sageMaker() {
    if (sageMaker == null) {
      sageMaker = track("sagemaker",
          () -> SageMakerClient.builder().region(region).credentialsProvider(credentials).build());
    }
    return sageMaker;
  }

  public synchronized GlueClient glue() {
    if (glue == null) {
      glue = track("glue", () -> GlueClient.builder().region(region).credentialsProvider(credentials).build());
    }
    return glue;
  }

  public synchronized EmrClient emr() {
    if (emr == null) {
      emr = track("emr", () -> EmrClient.builder().region(region).credentialsProvider(credentials).build());
    }
    return emr;
  }

  public synchronized S3Client s3() {
    if (s3 == null) {
      s3 = track("s3", () -> S3Client.builder().region(region).credentialsProvider(credentials).build());
    }
    return s3;
  }

  private <T extends SdkAutoCloseable> T track(String service, Supplier<T> builder) {
    T client = Objects.requireNonNull(builder.get(), service);
    created.add(client);
    log.debug("Created {} client for region {}", service, region);
    return client;
  }

  @Override
  public synchronized void close() {
    for (SdkAutoCloseable client : created) {
      try {
        client.close();
      } catch (RuntimeException ex) {
        log.warn("Failed to close AWS client {}", client.getClass().getSimpleName(), ex);
      }
    }
    created.clear();
  }
}
