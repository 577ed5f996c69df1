package com.scholary.storage.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.ServerSideEncryption;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/** Public URL rules and upload options of each provider family. */
@ExtendWith(MockitoExtension.class)
class ProviderPublicUrlTest {

  @Mock private S3Client s3Client;
  @Mock private S3Presigner presigner;

  @Test
  void awsUsesGlobalHostForUsEast1() {
    assertThat(aws(Map.of("aws_region", "us-east-1")).generatePublicUrl("k"))
        .isEqualTo("https://b.s3.amazonaws.com/k");
    assertThat(aws(Map.of("aws_region", "eu-west-1")).generatePublicUrl("photos/my pic.jpg"))
        .isEqualTo("https://b.s3.eu-west-1.amazonaws.com/photos/my%20pic.jpg");
  }

  @Test
  void publicUrlSettingReplacesNativeUrl() {
    StorageAdapter adapter =
        aws(Map.of("aws_region", "eu-west-1", "public_url", "https://cdn.example.com/"));

    assertThat(adapter.generatePublicUrl("k")).isEqualTo("https://cdn.example.com/k");
  }

  @Test
  void awsUploadAddsStorageClassAndEncryption() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenReturn(PutObjectResponse.builder().eTag("\"e\"").build());
    StorageAdapter adapter = aws(Map.of("aws_region", "us-east-1", "enable_encryption", "true"));

    adapter.upload(new byte[] {1}, "k", new UploadOptions("text/plain", null, true, null, null));

    ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(request.capture(), any(RequestBody.class));
    assertThat(request.getValue().serverSideEncryption()).isEqualTo(ServerSideEncryption.AES256);
    assertThat(request.getValue().storageClassAsString()).isEqualTo("STANDARD");
  }

  @Test
  void awsInfoReportsRegionalEndpoint() {
    assertThat(aws(Map.of("aws_region", "eu-west-1")).info().endpoint())
        .isEqualTo("https://s3.eu-west-1.amazonaws.com");
  }

  @Test
  void r2PrefersDevSubdomain() {
    assertThat(r2(Map.of("r2_dev_subdomain", "pub-123")).generatePublicUrl("k"))
        .isEqualTo("https://pub-123.r2.dev/k");
    assertThat(r2(Map.of()).generatePublicUrl("k"))
        .isEqualTo("https://b.acc.r2.cloudflarestorage.com/k");
  }

  @Test
  void r2TransformsThroughWorker() {
    StorageAdapter withWorker = r2(Map.of("worker_domain", "img.example.com"));
    StorageAdapter withoutWorker = r2(Map.of());

    assertThat(withWorker.capabilities().supportsTransform()).isTrue();
    assertThat(
            withWorker.applyTransform(
                "a.jpg", "https://pub.r2.dev/a.jpg", ImageTransform.resize(300, 200)))
        .isEqualTo("https://img.example.com/a.jpg?w=300&h=200");
    assertThat(withoutWorker.capabilities().supportsTransform()).isFalse();
    assertThat(
            withoutWorker.applyTransform(
                "a.jpg", "https://pub.r2.dev/a.jpg", ImageTransform.resize(300, 200)))
        .isEqualTo("https://pub.r2.dev/a.jpg");
  }

  @Test
  void r2UploadsCarryNoAcl() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenReturn(PutObjectResponse.builder().eTag("\"e\"").build());

    r2(Map.of())
        .upload(new byte[] {1}, "k", new UploadOptions("text/plain", null, true, null, null));

    ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(request.capture(), any(RequestBody.class));
    assertThat(request.getValue().acl()).isNull();
  }

  @Test
  void spacesUsesCdnUnlessDisabled() {
    assertThat(spaces(Map.of()).generatePublicUrl("k"))
        .isEqualTo("https://b.nyc3.cdn.digitaloceanspaces.com/k");
    assertThat(spaces(Map.of("enable_cdn", "false")).generatePublicUrl("k"))
        .isEqualTo("https://b.nyc3.digitaloceanspaces.com/k");
    assertThat(spaces(Map.of("cdn_domain", "cdn.example.com")).generatePublicUrl("k"))
        .isEqualTo("https://cdn.example.com/k");
  }

  @Test
  void vultrAndLinodeUseRegionalHosts() {
    assertThat(create(ProviderType.VULTR_STORAGE, Map.of()).generatePublicUrl("k"))
        .isEqualTo("https://b.ewr1.vultrobjects.com/k");
    assertThat(
            create(ProviderType.VULTR_STORAGE, Map.of("cdn_domain", "files.example.com"))
                .generatePublicUrl("k"))
        .isEqualTo("https://files.example.com/k");
    assertThat(create(ProviderType.LINODE_STORAGE, Map.of()).generatePublicUrl("k"))
        .isEqualTo("https://b.us-east-1.linodeobjects.com/k");
  }

  @Test
  void customEndpointUsesPathStyleByDefault() {
    StorageAdapter adapter =
        create(ProviderType.CUSTOM_S3, Map.of("custom_endpoint", "http://minio:9000/"));

    assertThat(adapter.generatePublicUrl("a/b.txt")).isEqualTo("http://minio:9000/b/a/b.txt");
  }

  private StorageAdapter aws(Map<String, String> extra) {
    return create(ProviderType.AWS_S3, extra);
  }

  private StorageAdapter r2(Map<String, String> extra) {
    Map<String, String> settings = new HashMap<>(extra);
    settings.put("cloudflare_account_id", "acc");
    return create(ProviderType.CLOUDFLARE_R2, settings);
  }

  private StorageAdapter spaces(Map<String, String> extra) {
    return create(ProviderType.DIGITALOCEAN_SPACES, extra);
  }

  private StorageAdapter create(ProviderType type, Map<String, String> extra) {
    Map<String, String> settings = new HashMap<>(extra);
    settings.put("aws_access_key_id", "key");
    settings.put("aws_secret_access_key", "secret");
    settings.put("bucket_name", "b");
    ProviderConfig config =
        ProviderConfig.from(ProviderRegistry.defaults().find(type).orElseThrow(), settings);
    switch (type) {
      case AWS_S3:
        return new AwsS3Adapter(config, s3Client, presigner);
      case CLOUDFLARE_R2:
        return new CloudflareR2Adapter(config, s3Client, presigner);
      case DIGITALOCEAN_SPACES:
        return new DigitalOceanSpacesAdapter(config, s3Client, presigner);
      case VULTR_STORAGE:
        return new VultrStorageAdapter(config, s3Client, presigner);
      case LINODE_STORAGE:
        return new LinodeStorageAdapter(config, s3Client, presigner);
      default:
        return new S3StorageAdapter(config, s3Client, presigner);
    }
  }
}
