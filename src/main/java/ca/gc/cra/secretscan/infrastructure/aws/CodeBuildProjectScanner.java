package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.DetailFetcher;
import ca.gc.cra.secretscan.application.port.ListingSource;
import ca.gc.cra.secretscan.application.port.ResourceScanner;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.codebuild.CodeBuildClient;
import software.amazon.awssdk.services.codebuild.model.BatchGetProjectsRequest;
import software.amazon.awssdk.services.codebuild.model.EnvironmentVariable;
import software.amazon.awssdk.services.codebuild.model.ListProjectsRequest;
import software.amazon.awssdk.services.codebuild.model.ListProjectsResponse;
import software.amazon.awssdk.services.codebuild.model.Project;
import software.amazon.awssdk.services.codebuild.model.ProjectSource;

/**
 * Scans CodeBuild buildspecs and environment variables.
 *
 * @since 0.1.0
 */
public final class CodeBuildProjectScanner implements ResourceScanner {
  static final String DEFAULT_BUILDSPEC = "buildspec.yml";

  private final CodeBuildClient codeBuild;

  public CodeBuildProjectScanner(CodeBuildClient codeBuild) {
    this.codeBuild = Objects.requireNonNull(codeBuild, "codeBuild");
  }

  @Override
  public ResourceType resourceType() {
    return ResourceType.CODEBUILD_PROJECT;
  }

  @Override
  public ListingSource newListingSource() {
    return new TokenPagedListingSource(token -> {
      ListProjectsResponse response =
          codeBuild.listProjects(ListProjectsRequest.builder().nextToken(token).build());
      List<ResourceRef> refs = response.projects().stream()
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
    List<Project> projects =
        codeBuild.batchGetProjects(BatchGetProjectsRequest.builder().names(ref.id()).build()).projects();
    if (projects.isEmpty()) {
      throw new IllegalStateException("Project not found: " + ref.id());
    }
    Project project = projects.get(0);
    ProjectSource source = project.source();
    String buildspec = source == null || AwsText.isBlank(source.buildspec())
        ? DEFAULT_BUILDSPEC
        : source.buildspec();
    List<EnvironmentVariable> variables =
        project.environment() == null ? List.of() : project.environment().environmentVariables();
    return ResourceDetail.builder(ref)
        .label("Source Location", source == null ? null : source.location())
        .text("Buildspec", buildspec)
        .keyValues("env variable", AwsText.toMap(variables, EnvironmentVariable::name, EnvironmentVariable::value))
        .build();
  }
}
