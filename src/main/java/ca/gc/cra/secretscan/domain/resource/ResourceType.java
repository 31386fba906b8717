package ca.gc.cra.secretscan.domain.resource;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * AWS resource types the scanner can enumerate, grouped by the service selector used on the command line.
 *
 * @since 0.1.0
 */
public enum ResourceType {
  EC2_INSTANCE("ec2-instance", "EC2 Instance", "ec2"),
  EC2_LAUNCH_TEMPLATE("ec2-launch-template", "Launch Template", "ec2"),
  LAMBDA_FUNCTION("lambda-function", "Lambda Function", "lambda"),
  CLOUDFORMATION_STACK("cloudformation-stack", "CloudFormation Stack", "cloudformation"),
  CLOUDFORMATION_STACK_SET("cloudformation-stack-set", "CloudFormation StackSet", "cloudformation"),
  CODEBUILD_PROJECT("codebuild-project", "CodeBuild Project", "codebuild"),
  SAGEMAKER_PROCESSING_JOB("sagemaker-processing-job", "SageMaker Processing Job", "sagemaker"),
  GLUE_JOB("glue-job", "Glue Job", "glue"),
  EMR_CLUSTER("emr-cluster", "EMR Cluster", "emr");

  /** Service selector accepted as shorthand for every type. */
  public static final String ALL_SERVICES = "all";
  /** Services scanned when none are configured. */
  public static final String DEFAULT_SERVICES = "ec2,cloudformation,sagemaker,emr,codebuild,glue";

  private final String id;
  private final String label;
  private final String service;

  ResourceType(String id, String label, String service) {
    this.id = id;
    this.label = label;
    this.service = service;
  }

  /** Stable identifier used in metric keys and logs. */
  public String id() {
    return id;
  }

  /** Human-readable label used in reports. */
  public String label() {
    return label;
  }

  /** Service selector this type belongs to. */
  public String service() {
    return service;
  }

  /**
   * Resolves a comma-separated service selector into resource types.
   *
   * <p>{@code all} selects every type and {@code cf} is accepted for {@code cloudformation}. The result
   * follows declaration order and contains no duplicates.</p>
   *
   * @param services selector such as {@code ec2,lambda}; blank selects {@link #DEFAULT_SERVICES}
   * @return resource types to scan
   * @throws IllegalArgumentException when a selector names no known service
   */
  public static List<ResourceType> forServices(String services) {
    String selector = services == null || services.isBlank() ? DEFAULT_SERVICES : services;
    Set<ResourceType> selected = EnumSet.noneOf(ResourceType.class);
    for (String token : selector.split(",")) {
      String service = normalizeService(token);
      if (service.isEmpty()) {
        continue;
      }
      if (service.equals(ALL_SERVICES)) {
        selected.addAll(EnumSet.allOf(ResourceType.class));
        continue;
      }
      boolean known = false;
      for (ResourceType type : values()) {
        if (type.service.equals(service)) {
          selected.add(type);
          known = true;
        }
      }
      if (!known) {
        throw new IllegalArgumentException("Unsupported service: " + token.trim());
      }
    }
    if (selected.isEmpty()) {
      throw new IllegalArgumentException("services must name at least one service");
    }
    return List.copyOf(new ArrayList<>(selected));
  }

  private static String normalizeService(String token) {
    String normalized = token.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("cf") ? "cloudformation" : normalized;
  }
}
