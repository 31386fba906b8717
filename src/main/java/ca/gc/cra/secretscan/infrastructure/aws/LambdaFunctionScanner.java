package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.DetailFetcher;
import ca.gc.cra.secretscan.application.port.ListingSource;
import ca.gc.cra.secretscan.application.port.ResourceScanner;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.FunctionConfiguration;
import software.amazon.awssdk.services.lambda.model.GetFunctionRequest;
import software.amazon.awssdk.services.lambda.model.GetFunctionResponse;
import software.amazon.awssdk.services.lambda.model.ListFunctionsRequest;
import software.amazon.awssdk.services.lambda.model.ListFunctionsResponse;
import software.amazon.awssdk.services.lambda.model.ListVersionsByFunctionRequest;
import software.amazon.awssdk.services.lambda.model.ListVersionsByFunctionResponse;

/**
 * Scans Lambda function code and environment variables across all published versions.
 *
 * <p>A package that cannot be downloaded is logged and skipped; the version's environment is still
 * scanned.</p>
 *
 * @since 0.1.0
 */
public final class LambdaFunctionScanner implements ResourceScanner {
  private static final Logger log = LoggerFactory.getLogger(LambdaFunctionScanner.class);

  private final LambdaClient lambda;
  private final CodeArchiveReader archives;

  public LambdaFunctionScanner(LambdaClient lambda, CodeArchiveReader archives) {
    this.lambda = Objects.requireNonNull(lambda, "lambda");
    this.archives = Objects.requireNonNull(archives, "archives");
  }

  @Override
  public ResourceType resourceType() {
    return ResourceType.LAMBDA_FUNCTION;
  }

  @Override
  public ListingSource newListingSource() {
    return new TokenPagedListingSource(marker -> {
      ListFunctionsResponse response =
          lambda.listFunctions(ListFunctionsRequest.builder().marker(marker).build());
      List<ResourceRef> refs = response.functions().stream()
          .map(function -> ResourceRef.of(resourceType(), function.functionName()))
          .toList();
      return new TokenPagedListingSource.TokenPage(refs, response.nextMarker());
    });
  }

  @Override
  public DetailFetcher detailFetcher() {
    return this::fetch;
  }

  private ResourceDetail fetch(ResourceRef ref) throws InterruptedException {
    ResourceDetail.Builder detail = ResourceDetail.builder(ref).label("Function", ref.id());
    for (String version : versions(ref.id())) {
      GetFunctionResponse function = lambda.getFunction(
          GetFunctionRequest.builder().functionName(ref.id()).qualifier(version).build());
      String location = function.code() == null ? null : function.code().location();
      if (!AwsText.isBlank(location)) {
        for (Map.Entry<String, String> entry : download(ref, version, location).entrySet()) {
          detail.text("Code: " + entry.getKey() + " (version " + version + ")", entry.getValue());
        }
      }
      FunctionConfiguration configuration = function.configuration();
      if (configuration != null && configuration.environment() != null) {
        detail.keyValues("env variable", configuration.environment().variables());
      }
    }
    return detail.build();
  }

  private List<String> versions(String functionName) {
    List<String> versions = new ArrayList<>();
    String marker = null;
    do {
      ListVersionsByFunctionResponse response = lambda.listVersionsByFunction(
          ListVersionsByFunctionRequest.builder().functionName(functionName).marker(marker).build());
      response.versions().forEach(version -> versions.add(version.version()));
      marker = response.nextMarker();
    } while (!AwsText.isBlank(marker));
    return versions;
  }

  private Map<String, String> download(ResourceRef ref, String version, String location)
      throws InterruptedException {
    try {
      return archives.read(location);
    } catch (IOException ex) {
      log.warn("Unable to download code of {} version {}: {}", ref.id(), version, ex.getMessage());
      return Map.of();
    }
  }
}
