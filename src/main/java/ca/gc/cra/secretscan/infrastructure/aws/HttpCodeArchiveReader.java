package ca.gc.cra.secretscan.infrastructure.aws;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches Lambda deployment packages over HTTPS and unpacks their text entries in memory.
 *
 * <p>Entries larger than {@link #MAX_ENTRY_BYTES} or containing NUL bytes are skipped.</p>
 *
 * @since 0.1.0
 */
public final class HttpCodeArchiveReader implements CodeArchiveReader {
  private static final Logger log = LoggerFactory.getLogger(HttpCodeArchiveReader.class);
  static final int MAX_ENTRY_BYTES = 4 * 1024 * 1024;
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(2);

  private final HttpClient httpClient;

  public HttpCodeArchiveReader() {
    this(HttpClient.newBuilder()
        .connectTimeout(CONNECT_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  HttpCodeArchiveReader(HttpClient httpClient) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
  }

  @Override
  public Map<String, String> read(String url) throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder(URI.create(url)).timeout(REQUEST_TIMEOUT).GET().build();
    HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
    try (InputStream body = response.body()) {
      if (response.statusCode() / 100 != 2) {
        throw new IOException("Code download failed with HTTP " + response.statusCode());
      }
      return unzip(body);
    }
  }

  static Map<String, String> unzip(InputStream archive) throws IOException {
    Map<String, String> entries = new LinkedHashMap<>();
    try (ZipInputStream zip = new ZipInputStream(archive)) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if (!entry.isDirectory()) {
          byte[] content = readBounded(zip);
          if (content == null) {
            log.debug("Skipping oversized entry {}", entry.getName());
          } else if (isBinary(content)) {
            log.debug("Skipping binary entry {}", entry.getName());
          } else {
            entries.put(entry.getName(), new String(content, StandardCharsets.UTF_8));
          }
        }
        zip.closeEntry();
      }
    }
    return entries;
  }

  private static byte[] readBounded(InputStream in) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[8192];
    int read;
    while ((read = in.read(buffer)) != -1) {
      if (out.size() + read > MAX_ENTRY_BYTES) {
        return null;
      }
      out.write(buffer, 0, read);
    }
    return out.toByteArray();
  }

  private static boolean isBinary(byte[] content) {
    for (byte b : content) {
      if (b == 0) {
        return true;
      }
    }
    return false;
  }
}
