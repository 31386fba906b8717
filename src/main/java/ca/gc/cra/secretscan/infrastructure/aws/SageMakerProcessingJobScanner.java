package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.DetailFetcher;
import ca.gc.cra.secretscan.application.port.ListingSource;
import ca.gc.cra.secretscan.application.port.ResourceScanner;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.sagemaker.SageMakerClient;
import software.amazon.awssdk.services.sagemaker.model.AppSpecification;
import software.amazon.awssdk.services.sagemaker.model.DescribeProcessingJobRequest;
import software.amazon.awssdk.services.sagemaker.model.DescribeProcessingJobResponse;
import software.amazon.awssdk.services.sagemaker.model.ListProcessingJobsRequest;
import software.amazon.awssdk.services.sagemaker.model.ListProcessingJobsResponse;

/**
 * Scans SageMaker processing job environments and container arguments.
 *
 * @since 0.1.0
 */
public final class SageMakerProcessingJobScanner implements ResourceScanner {
  private final SageMakerClient sageMaker;

  public SageMakerProcessingJobScanner(SageMakerClient sageMaker) {
    this.sageMaker = Objects.requireNonNull(sageMaker, "sageMaker");
  }

  @Override
  public ResourceType resourceType() {
    return ResourceType.SAGEMAKER_PROCESSING_JOB;
  }

  @Override
  public ListingSource newListingSource() {
    return new TokenPagedListingSource(token -> {
      ListProcessingJobsResponse response =
          sageMaker.listProcessingJobs(ListProcessingJobsRequest.builder().nextToken(token).build());
      List<ResourceRef> refs = response.processingJobSummaries().stream()
          .map(job -> ResourceRef.of(resourceType(), job.processingJobName()))
          .toList();
      return new TokenPagedListingSource.TokenPage(refs, response.nextToken());
    });
  }

  @Override
  public DetailFetcher detailFetcher() {
    return this::fetch;
  }

  private ResourceDetail fetch(ResourceRef ref) {
    DescribeProcessingJobResponse job = sageMaker.describeProcessingJob(
        DescribeProcessingJobRequest.builder().processingJobName(ref.id()).build());
    AppSpecification app = job.appSpecification();
    return ResourceDetail.builder(ref)
        .label("Processing Job ARN", job.processingJobArn())
        .text("Container Entrypoint", app == null ? null : String.join(" ", app.containerEntrypoint()))
        .text("Container Arguments", app == null ? null : String.join("\n", app.containerArguments()))
        .keyValues("env variable", job.environment())
        .build();
  }
}
