package com.scholary.video.composer.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.video.composer.objectstore.ObjectStoreClient.ObjectMetadata;
import java.net.URI;
import java.net.URL;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/** Runs against a real MinIO server. Skipped when Docker is not available. */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientTest {

  private static final String ACCESS_KEY = "minioadmin";
  private static final String SECRET_KEY = "minioadmin";
  private static final String BUCKET = "videos";

  @Container
  private static final GenericContainer<?> MINIO =
      new GenericContainer<>("minio/minio:latest")
          .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
          .withCommand("server", "/data")
          .withExposedPorts(9000)
          .waitingFor(
              new HttpWaitStrategy()
                  .forPath("/minio/health/ready")
                  .forPort(9000)
                  .withStartupTimeout(Duration.ofMinutes(2)));

  private static S3ObjectStoreClient client;

  @TempDir Path tempDir;

  @BeforeAll
  static void setUpBucket() {
    String endpoint = "http://" + MINIO.getHost() + ":" + MINIO.getMappedPort(9000);
    try (S3Client admin =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(ACCESS_KEY, SECRET_KEY)))
            .endpointOverride(URI.create(endpoint))
            .forcePathStyle(true)
            .build()) {
      admin.createBucket(builder -> builder.bucket(BUCKET));
    }
    client =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(endpoint, ACCESS_KEY, SECRET_KEY, BUCKET, "us-east-1", true));
  }

  @AfterAll
  static void tearDown() {
    if (client != null) {
      client.close();
    }
  }

  @Test
  void putFile_shouldStoreObjectWithContentType() throws Exception {
    Path video = tempDir.resolve("final.mp4");
    Files.write(video, new byte[2048]);

    client.putFile(BUCKET, "jobs/job-1/final.mp4", video, "video/mp4");

    ObjectMetadata metadata = client.getObjectMetadata(BUCKET, "jobs/job-1/final.mp4");
    assertThat(metadata.contentLength()).isEqualTo(2048);
    assertThat(metadata.contentType()).isEqualTo("video/mp4");
  }

  @Test
  void presignGet_shouldGrantTemporaryReadAccess() throws Exception {
    Path video = tempDir.resolve("final.mp4");
    Files.writeString(video, "not really a video");
    client.putFile(BUCKET, "jobs/job-2/final.mp4", video, "video/mp4");

    URL url = client.presignGet(BUCKET, "jobs/job-2/final.mp4", Duration.ofDays(7));

    assertThat(url.getQuery()).contains("X-Amz-Expires=604800");
    HttpResponse<String> response =
        HttpClient.newHttpClient()
            .send(
                HttpRequest.newBuilder(url.toURI()).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).isEqualTo("not really a video");
  }

  @Test
  void getObjectMetadata_shouldThrowExceptionForNonExistentObject() {
    assertThatThrownBy(() -> client.getObjectMetadata(BUCKET, "jobs/missing/final.mp4"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("jobs/missing/final.mp4");
  }

  @Test
  void putFile_shouldWrapFailuresForMissingBucket() throws Exception {
    Path video = tempDir.resolve("final.mp4");
    Files.writeString(video, "data");

    assertThatThrownBy(() -> client.putFile("no-such-bucket", "k", video, "video/mp4"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("bucket=no-such-bucket");
  }
}
