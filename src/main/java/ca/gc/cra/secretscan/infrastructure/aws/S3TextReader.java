package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.ThrottlingClassifier;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;

/**
 * Reads script objects referenced by {@code s3://bucket/key} locations as UTF-8 text.
 *
 * <p>Throttling failures propagate so the caller's retry policy can back off. Any other SDK failure is
 * logged and reported as an empty result; the referencing resource is still scanned.</p>
 *
 * @since 0.1.0
 */
public class S3TextReader {
  private static final Logger log = LoggerFactory.getLogger(S3TextReader.class);
  static final String SCHEME = "s3://";

  private final S3Client s3;
  private final ThrottlingClassifier throttling;

  public S3TextReader(S3Client s3, ThrottlingClassifier throttling) {
    this.s3 = Objects.requireNonNull(s3, "s3");
    this.throttling = Objects.requireNonNull(throttling, "throttling");
  }

  /**
   * Downloads the object at {@code location}.
   *
   * @param location {@code s3://bucket/key} URI
   * @return object text; empty when the location is not an S3 URI or cannot be read
   */
  public Optional<String> read(String location) {
    Optional<Location> parsed = parse(location);
    if (parsed.isEmpty()) {
      log.debug("Not an S3 location: {}", location);
      return Optional.empty();
    }
    Location target = parsed.get();
    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(target.bucket()).key(target.key()).build();
      return Optional.of(s3.getObjectAsBytes(request).asUtf8String());
    } catch (SdkException ex) {
      if (throttling.isThrottling(ex)) {
        throw ex;
      }
      log.warn("Unable to read {}: {}", location, ex.getMessage());
      return Optional.empty();
    }
  }

  static Optional<Location> parse(String location) {
    if (location == null || !location.startsWith(SCHEME)) {
      return Optional.empty();
    }
    String path = location.substring(SCHEME.length());
    int slash = path.indexOf('/');
    if (slash <= 0 || slash == path.length() - 1) {
      return Optional.empty();
    }
    return Optional.of(new Location(path.substring(0, slash), path.substring(slash + 1)));
  }

  record Location(String bucket, String key) {}
}
