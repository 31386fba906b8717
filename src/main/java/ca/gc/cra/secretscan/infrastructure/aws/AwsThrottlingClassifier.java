package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.ThrottlingClassifier;
import java.util.Locale;
import java.util.Set;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkServiceException;

/**
 * Recognizes AWS throttling responses anywhere in a failure's cause chain.
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class AwsThrottlingClassifier implements ThrottlingClassifier {
  static final Set<String> THROTTLING_CODES = Set.of(
      "ThrottlingException",
      "Throttling",
      "TooManyRequestsException",
      "RequestLimitExceeded",
      "RequestThrottled",
      "RequestThrottledException",
      "ProvisionedThroughputExceededException",
      "SlowDown");
  private static final String RATE_EXCEEDED = "rate exceeded";
  private static final int MAX_CAUSE_DEPTH = 8;

  @Override
  public boolean isThrottling(Throwable failure) {
    Throwable current = failure;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof SdkServiceException service && service.isThrottlingException()) {
        return true;
      }
      if (current instanceof AwsServiceException aws) {
        AwsErrorDetails details = aws.awsErrorDetails();
        if (details != null && details.errorCode() != null && THROTTLING_CODES.contains(details.errorCode())) {
          return true;
        }
      }
      String message = current.getMessage();
      if (message != null && message.toLowerCase(Locale.ROOT).contains(RATE_EXCEEDED)) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
