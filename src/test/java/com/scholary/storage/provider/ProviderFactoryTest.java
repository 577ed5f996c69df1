package com.scholary.storage.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.storage.error.ErrorKind;
import com.scholary.storage.error.StorageException;
import com.scholary.storage.error.StorageResult;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for ProviderFactory validation order and connection checks. */
@ExtendWith(MockitoExtension.class)
class ProviderFactoryTest {

  @Mock private Function<ProviderConfig, StorageAdapter> constructor;
  @Mock private StorageAdapter adapter;

  private ProviderFactory factory;

  @BeforeEach
  void setUp() {
    ProviderRegistry registry =
        ProviderRegistry.defaults()
            .withConstructor(ProviderType.AWS_S3, constructor)
            .withConstructor(ProviderType.CLOUDFLARE_R2, constructor)
            .withConstructor(ProviderType.CUSTOM_S3, constructor);
    factory = new ProviderFactory(registry);
  }

  @Test
  void unknownProviderListsValidTypes() {
    assertThatThrownBy(() -> factory.createProvider("gcs", awsSettings()))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("Unknown storage provider 'gcs'")
        .hasMessageContaining("aws-s3, cloudflare-r2")
        .extracting(e -> ((StorageException) e).kind())
        .isEqualTo(ErrorKind.CONFIGURATION);
    verifyNoInteractions(constructor);
  }

  @Test
  void emptyAccessKeyFailsBeforeAnyNetworkCall() {
    Map<String, String> settings = awsSettings();
    settings.put("aws_access_key_id", "");

    assertThatThrownBy(() -> factory.createProvider("aws-s3", settings))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("Missing required configuration for aws-s3: aws_access_key_id")
        .extracting(e -> ((StorageException) e).kind())
        .isEqualTo(ErrorKind.CONFIGURATION);
    verifyNoInteractions(constructor);
  }

  @Test
  void everyMissingFieldIsNamed() {
    assertThatThrownBy(() -> factory.createProvider("aws-s3", Map.of("bucket_name", "b")))
        .hasMessageContaining("aws_access_key_id, aws_secret_access_key, aws_region");
  }

  @Test
  void connectionFailureClosesAdapter() {
    when(constructor.apply(any())).thenReturn(adapter);
    doThrow(new StorageException(ErrorKind.CONNECTION, "Invalid access key ID"))
        .when(adapter)
        .testConnection();

    assertThatThrownBy(() -> factory.createProvider("aws-s3", awsSettings()))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("Connection test failed for aws-s3: Invalid access key ID")
        .extracting(e -> ((StorageException) e).kind())
        .isEqualTo(ErrorKind.CONNECTION);
    verify(adapter).close();
  }

  @Test
  void buildsValidatedConfig() {
    when(constructor.apply(any())).thenReturn(adapter);

    StorageAdapter created = factory.createProvider("aws-s3", awsSettings());

    ArgumentCaptor<ProviderConfig> config = ArgumentCaptor.forClass(ProviderConfig.class);
    verify(constructor).apply(config.capture());
    verify(adapter).testConnection();
    assertThat(created).isSameAs(adapter);
    assertThat(config.getValue().bucket()).isEqualTo("uploads");
    assertThat(config.getValue().region()).isEqualTo("eu-west-1");
    assertThat(config.getValue().timeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.getValue().storageClass()).isEqualTo("STANDARD");
    assertThat(config.getValue().pathStyle()).isFalse();
    assertThat(config.getValue().toString()).doesNotContain("secret-value");
  }

  @Test
  void skipsConnectionTestWhenAsked() {
    when(constructor.apply(any())).thenReturn(adapter);

    factory.createProvider("aws-s3", awsSettings(), false);

    verify(constructor).apply(any());
    verifyNoInteractions(adapter);
  }

  @Test
  void cloudflareAcceptsAccountIdAliasAndDerivesEndpoint() {
    when(constructor.apply(any())).thenReturn(adapter);
    Map<String, String> settings = new HashMap<>();
    settings.put("aws_access_key_id", "key");
    settings.put("aws_secret_access_key", "secret");
    settings.put("bucket_name", "assets");
    settings.put("account_id", "acc123");
    settings.put("worker_domain", "img.example.com");

    factory.createProvider("cloudflare-r2", settings, false);

    ArgumentCaptor<ProviderConfig> config = ArgumentCaptor.forClass(ProviderConfig.class);
    verify(constructor).apply(config.capture());
    assertThat(config.getValue().endpoint()).isEqualTo("https://acc123.r2.cloudflarestorage.com");
    assertThat(config.getValue().region()).isEqualTo("auto");
    assertThat(config.getValue().capabilities().supportsTransform()).isTrue();
  }

  @Test
  void rejectsMalformedEndpointAndTimeout() {
    Map<String, String> custom = new HashMap<>();
    custom.put("aws_access_key_id", "key");
    custom.put("aws_secret_access_key", "secret");
    custom.put("bucket_name", "b");
    custom.put("custom_endpoint", "ftp://minio.local");

    assertThatThrownBy(() -> factory.createProvider("custom-s3", custom))
        .hasMessageContaining("must start with http:// or https://");

    custom.put("custom_endpoint", "http://minio.local:9000");
    custom.put("timeout_seconds", "soon");
    assertThatThrownBy(() -> factory.createProvider("custom-s3", custom))
        .hasMessageContaining("timeout_seconds")
        .extracting(e -> ((StorageException) e).kind())
        .isEqualTo(ErrorKind.CONFIGURATION);
    verifyNoInteractions(constructor);
  }

  @Test
  void constructorFailureBecomesConfigurationError() {
    when(constructor.apply(any())).thenThrow(new IllegalArgumentException("bad region"));

    assertThatThrownBy(() -> factory.createProvider("aws-s3", awsSettings()))
        .hasMessageContaining("Failed to initialize provider aws-s3: bad region")
        .extracting(e -> ((StorageException) e).kind())
        .isEqualTo(ErrorKind.CONFIGURATION);
  }

  @Test
  void testProviderConfigReportsInsteadOfThrowing() {
    StorageResult<ProviderInfo> failed = factory.testProviderConfig("aws-s3", Map.of());

    assertThat(failed.success()).isFalse();
    assertThat(failed.error().kind()).isEqualTo(ErrorKind.CONFIGURATION);

    ProviderInfo info =
        new ProviderInfo("aws-s3", "Amazon S3", "eu-west-1", "uploads", null, null);
    when(constructor.apply(any())).thenReturn(adapter);
    when(adapter.info()).thenReturn(info);

    StorageResult<ProviderInfo> passed = factory.testProviderConfig("aws-s3", awsSettings());

    assertThat(passed.success()).isTrue();
    assertThat(passed.data()).isEqualTo(info);
    verify(adapter).close();
  }

  @Test
  void providerEndpoints() {
    assertThat(factory.providerEndpoint("digitalocean-spaces", "sgp1"))
        .isEqualTo("https://sgp1.digitaloceanspaces.com");
    assertThat(factory.providerEndpoint("aws-s3", "eu-west-1"))
        .isEqualTo("https://s3.eu-west-1.amazonaws.com");
    assertThat(factory.providerEndpoint("aws-s3", null)).isEqualTo("https://s3.amazonaws.com");
    assertThat(factory.providerEndpoint("custom-s3", null)).isNull();
    assertThat(factory.availableProviders()).hasSize(6);
  }

  private static Map<String, String> awsSettings() {
    Map<String, String> settings = new HashMap<>();
    settings.put("aws_access_key_id", "AKIAEXAMPLE");
    settings.put("aws_secret_access_key", "secret-value");
    settings.put("bucket_name", "uploads");
    settings.put("aws_region", "eu-west-1");
    return settings;
  }
}
