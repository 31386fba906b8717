package ca.gc.cra.secretscan.infrastructure.aws;

import java.io.IOException;
import java.util.Map;

/**
 * Downloads a deployment package and returns its text entries.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CodeArchiveReader {
  /**
   * Reads the zip archive served at {@code url}.
   *
   * @param url pre-signed download URL
   * @return entry name to UTF-8 content, in archive order; binary and oversized entries are omitted
   * @throws IOException when the download or archive cannot be read
   * @throws InterruptedException when interrupted while waiting for the download
   */
  Map<String, String> read(String url) throws IOException, InterruptedException;
}
