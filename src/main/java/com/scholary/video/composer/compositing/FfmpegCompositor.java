package com.scholary.video.composer.compositing;

import com.scholary.video.composer.objectstore.ObjectStoreClient;
import com.scholary.video.composer.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.video.composer.objectstore.ObjectStoreProperties;
import com.scholary.video.composer.retry.ProgressListener;
import com.scholary.video.composer.retry.TransientInfraException;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Composites scene media with ffmpeg and publishes the result to object storage.
 *
 * <p>Progress per attempt:
 *
 * <ul>
 *   <li>0-20: downloading scene media
 *   <li>20-90: encoding, driven by ffmpeg's own progress output
 *   <li>90-100: upload and presign
 * </ul>
 *
 * <p>Each attempt works in its own temp directory, removed afterwards whatever the outcome.
 */
@Service
public class FfmpegCompositor implements Compositor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegCompositor.class);

  static final String CONTENT_TYPE = "video/mp4";
  private static final int FETCH_SHARE = 20;
  private static final int ENCODE_END = 90;

  private final CompositionPlanner planner;
  private final FfmpegFilterGraphCompiler compiler;
  private final CommandRunner commandRunner;
  private final SceneMediaFetcher mediaFetcher;
  private final ObjectStoreClient objectStore;
  private final CompositorProperties properties;
  private final String bucket;

  public FfmpegCompositor(
      CompositionPlanner planner,
      FfmpegFilterGraphCompiler compiler,
      CommandRunner commandRunner,
      SceneMediaFetcher mediaFetcher,
      ObjectStoreClient objectStore,
      CompositorProperties properties,
      ObjectStoreProperties objectStoreProperties) {
    this.planner = planner;
    this.compiler = compiler;
    this.commandRunner = commandRunner;
    this.mediaFetcher = mediaFetcher;
    this.objectStore = objectStore;
    this.properties = properties;
    this.bucket = objectStoreProperties.bucket();
  }

  @Override
  public CompositionResult compose(String jobId, List<SceneMedia> scenes, ProgressListener progress)
      throws IOException, InterruptedException {
    List<SceneMedia> ordered =
        scenes.stream().sorted(Comparator.comparingInt(SceneMedia::order)).toList();
    CompositionPlan plan = planner.plan(ordered);

    Path tempRoot = Path.of(properties.tempDir());
    Files.createDirectories(tempRoot);
    Path workDir = Files.createTempDirectory(tempRoot, "job-" + jobId + "-");

    LOGGER.info(
        "Compositing job {}: scenes={}, transitions={}, expectedDuration={}s",
        jobId,
        ordered.size(),
        plan.transitions().size(),
        FfmpegFilterGraphCompiler.formatSeconds(plan.totalDurationSeconds()));

    try {
      progress.onProgress(0);
      List<Path> inputs = new ArrayList<>();
      for (int i = 0; i < ordered.size(); i++) {
        inputs.add(mediaFetcher.fetch(ordered.get(i), workDir));
        progress.onProgress(FETCH_SHARE * (i + 1) / ordered.size());
      }

      Path output = workDir.resolve("final-" + UUID.randomUUID() + ".mp4");
      encode(plan, inputs, output, progress);
      progress.onProgress(ENCODE_END);

      String key = artifactKey(jobId);
      objectStore.putFile(bucket, key, output, CONTENT_TYPE);
      verifyUpload(key, Files.size(output));
      URL url = objectStore.presignGet(bucket, key, Duration.ofDays(properties.artifactTtlDays()));
      progress.onProgress(100);

      LOGGER.info("Published composited video for job {}: key={}", jobId, key);
      return new CompositionResult(url.toString(), key, plan.totalDurationSeconds());

    } finally {
      deleteRecursively(workDir);
    }
  }

  static String artifactKey(String jobId) {
    return "jobs/" + jobId + "/final.mp4";
  }

  private void encode(
      CompositionPlan plan, List<Path> inputs, Path output, ProgressListener progress)
      throws IOException, InterruptedException {
    List<String> command = compiler.compile(plan, properties.ffmpegBinary(), inputs, output);
    EncodeProgressParser parser =
        new EncodeProgressParser(plan.totalDurationSeconds(), FETCH_SHARE, ENCODE_END, progress);

    CommandRunner.CommandResult result =
        commandRunner.run(
            command, Duration.ofMinutes(properties.commandTimeoutMinutes()), parser::accept);

    if (!result.succeeded()) {
      throw new CompositingException(
          String.format(
              "ffmpeg exited with code %d: %s", result.exitCode(), result.outputTail()));
    }
    if (!Files.exists(output) || Files.size(output) == 0) {
      throw new CompositingException("ffmpeg finished without producing output");
    }
  }

  // A short object means the upload was cut off; uploading again may succeed.
  private void verifyUpload(String key, long expectedBytes) {
    ObjectMetadata stored = objectStore.getObjectMetadata(bucket, key);
    if (stored.contentLength() != expectedBytes) {
      throw new TransientInfraException(
          String.format(
              "Uploaded artifact %s is incomplete: %d of %d bytes",
              key, stored.contentLength(), expectedBytes));
    }
  }

  private void deleteRecursively(Path directory) {
    try (Stream<Path> paths = Files.walk(directory)) {
      paths.sorted(Comparator.reverseOrder()).forEach(this::deleteQuietly);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up work directory {}: {}", directory, e.getMessage());
    }
  }

  private void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }

  /**
   * Maps ffmpeg {@code -progress} key/value lines onto a slice of the overall percentage.
   *
   * <p>{@code out_time_us} and {@code out_time_ms} both carry microseconds.
   */
  static final class EncodeProgressParser {

    private final double totalSeconds;
    private final int from;
    private final int to;
    private final ProgressListener listener;
    private int lastReported = -1;

    EncodeProgressParser(double totalSeconds, int from, int to, ProgressListener listener) {
      this.totalSeconds = totalSeconds;
      this.from = from;
      this.to = to;
      this.listener = listener;
    }

    void accept(String line) {
      if (totalSeconds <= 0) {
        return;
      }
      int separator = line.indexOf('=');
      if (separator < 0) {
        return;
      }
      String key = line.substring(0, separator).trim();
      if (!key.equals("out_time_us") && !key.equals("out_time_ms")) {
        return;
      }
      long micros;
      try {
        micros = Long.parseLong(line.substring(separator + 1).trim());
      } catch (NumberFormatException e) {
        // ffmpeg prints N/A before the first frame
        return;
      }
      double fraction = Math.min(Math.max(micros / 1_000_000.0 / totalSeconds, 0.0), 1.0);
      int percent = from + (int) Math.floor(fraction * (to - from));
      if (percent > lastReported) {
        lastReported = percent;
        listener.onProgress(percent);
      }
    }
  }
}
