package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.DetailFetcher;
import ca.gc.cra.secretscan.application.port.ListingSource;
import ca.gc.cra.secretscan.application.port.ResourceScanner;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.glue.GlueClient;
import software.amazon.awssdk.services.glue.model.GetJobRequest;
import software.amazon.awssdk.services.glue.model.Job;
import software.amazon.awssdk.services.glue.model.ListJobsRequest;
import software.amazon.awssdk.services.glue.model.ListJobsResponse;

/**
 * Scans Glue job scripts and default arguments.
 *
 * @since 0.1.0
 */
public final class GlueJobScanner implements ResourceScanner {
  private final GlueClient glue;
  private final S3TextReader scripts;

  public GlueJobScanner(GlueClient glue, S3TextReader scripts) {
    this.glue = Objects.requireNonNull(glue, "glue");
    this.scripts = Objects.requireNonNull(scripts, "scripts");
  }

  @Override
  public ResourceType resourceType() {
    return ResourceType.GLUE_JOB;
  }

  @Override
  public ListingSource newListingSource() {
    return new TokenPagedListingSource(token -> {
      ListJobsResponse response = glue.listJobs(ListJobsRequest.builder().nextToken(token).build());
      List<ResourceRef> refs = response.jobNames().stream()
          .map(name -> ResourceRef.of(resourceType(), name))
          .toList();
      return new TokenPagedListingSource.TokenPage(refs, response.nextToken());
    });
  }

  @Override
  public DetailFetcher detailFetcher() {
    return this::fetch;
  }

  private ResourceDetail fetch(ResourceRef ref) {
    Job job = glue.getJob(GetJobRequest.builder().jobName(ref.id()).build()).job();
    if (job == null) {
      throw new IllegalStateException("Glue job not found: " + ref.id());
    }
    String scriptLocation = job.command() == null ? null : job.command().scriptLocation();
    return ResourceDetail.builder(ref)
        .label("Script Location", scriptLocation)
        .text("Script", scripts.read(scriptLocation).orElse(null))
        .keyValues("Default Arguments", job.defaultArguments())
        .build();
  }
}
