package ca.gc.cra.secretscan.infrastructure.aws;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkServiceException;

class AwsThrottlingClassifierTest {
  private final AwsThrottlingClassifier classifier = new AwsThrottlingClassifier();

  @Test
  void recognizesThrottlingErrorCodes() {
    for (String code : AwsThrottlingClassifier.THROTTLING_CODES) {
      assertTrue(classifier.isThrottling(serviceException(code, 400)), code);
    }
  }

  @Test
  void recognizesHttp429() {
    assertTrue(classifier.isThrottling(SdkServiceException.builder().statusCode(429).build()));
  }

  @Test
  void recognizesRateExceededMessageInCauseChain() {
    RuntimeException wrapped = new RuntimeException("fetch failed",
        new IllegalStateException("Rate exceeded (Service: Glue)"));

    assertTrue(classifier.isThrottling(wrapped));
  }

  @Test
  void ignoresOtherServiceErrors() {
    assertFalse(classifier.isThrottling(serviceException("AccessDeniedException", 403)));
    assertFalse(classifier.isThrottling(new IllegalStateException("boom")));
  }

  @Test
  void stopsWalkingAfterBoundedDepth() {
    Throwable failure = new IllegalStateException("Rate exceeded");
    for (int i = 0; i < 10; i++) {
      failure = new RuntimeException("wrapper " + i, failure);
    }

    assertFalse(classifier.isThrottling(failure));
  }

  private static AwsServiceException serviceException(String code, int status) {
    return AwsServiceException.builder()
        .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(code).build())
        .statusCode(status)
        .build();
  }
}
