package com.scholary.video.composer.compositing;

import com.scholary.video.composer.retry.TransientInfraException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloads generated scene media to local files for ffmpeg.
 *
 * <p>Server errors are transient since the prediction service's CDN sometimes lags behind its API.
 * Client errors mean the media is gone and are not.
 */
@Component
public class SceneMediaFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(SceneMediaFetcher.class);

  private final HttpClient httpClient;
  private final Duration downloadTimeout;

  public SceneMediaFetcher(CompositorProperties properties) {
    this.downloadTimeout = Duration.ofSeconds(properties.downloadTimeoutSeconds());
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  /**
   * Download {@code media} into {@code directory}.
   *
   * @return the downloaded file
   * @throws IOException if the download fails at the network level
   */
  public Path fetch(SceneMedia media, Path directory) throws IOException, InterruptedException {
    URI uri = parse(media.mediaUrl());
    Path target = directory.resolve(String.format("scene-%03d.mp4", media.order()));
    Path partial = directory.resolve(target.getFileName() + ".part");

    LOGGER.debug("Fetching scene media: order={}, uri={}", media.order(), uri);

    HttpRequest request = HttpRequest.newBuilder().uri(uri).timeout(downloadTimeout).GET().build();
    HttpResponse<Path> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofFile(partial));

    int status = response.statusCode();
    if (status >= 500) {
      Files.deleteIfExists(partial);
      throw new TransientInfraException(
          String.format("Media host busy: status %d for scene %d", status, media.order()));
    }
    if (status < 200 || status >= 300) {
      Files.deleteIfExists(partial);
      throw new CompositingException(
          String.format("Scene %d media unavailable: status %d", media.order(), status));
    }
    if (Files.size(partial) == 0) {
      Files.deleteIfExists(partial);
      throw new CompositingException("Scene " + media.order() + " media is empty");
    }

    Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
    LOGGER.info(
        "Fetched scene media: order={}, size={} bytes", media.order(), Files.size(target));
    return target;
  }

  private static URI parse(String mediaUrl) {
    URI uri;
    try {
      uri = URI.create(mediaUrl);
    } catch (IllegalArgumentException e) {
      throw new CompositingException("Invalid scene media URL: " + mediaUrl, e);
    }
    String scheme = uri.getScheme();
    if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
      throw new CompositingException("Unsupported scene media URL: " + mediaUrl);
    }
    return uri;
  }
}
