package com.scholary.storage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.storage.config.StorageProperties.ProviderProperties;
import com.scholary.storage.event.OperationAuditLogger;
import com.scholary.storage.event.StorageEventListener;
import com.scholary.storage.event.StorageEventPublisher;
import com.scholary.storage.image.ImageOptimizer;
import com.scholary.storage.path.PathManager;
import com.scholary.storage.provider.ProviderFactory;
import com.scholary.storage.provider.ProviderRegistry;
import com.scholary.storage.provider.StorageAdapter;
import com.scholary.storage.retry.RetryExecutor;
import com.scholary.storage.service.StorageService;
import com.scholary.storage.url.UrlCache;
import com.scholary.storage.url.UrlService;
import java.time.Clock;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the storage engine.
 *
 * <p>Builds the primary and backup providers through the {@link ProviderFactory} at startup, so a
 * bad provider configuration stops the application with a message naming the missing settings.
 */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ProviderRegistry providerRegistry() {
    return ProviderRegistry.defaults();
  }

  @Bean
  public ProviderFactory providerFactory(ProviderRegistry registry) {
    return new ProviderFactory(registry);
  }

  @Bean(destroyMethod = "close")
  public ConfiguredProviders configuredProviders(
      ProviderFactory factory, StorageProperties properties) {
    StorageAdapter primary = create(factory, properties.primary());
    StorageAdapter backup = null;
    if (properties.backup() != null) {
      try {
        backup = create(factory, properties.backup());
      } catch (RuntimeException e) {
        primary.close();
        throw e;
      }
    }
    return new ConfiguredProviders(primary, backup);
  }

  @Bean
  public PathManager pathManager(StorageProperties properties, Clock clock) {
    return new PathManager(properties.paths(), clock);
  }

  @Bean
  public ImageOptimizer imageOptimizer() {
    return new ImageOptimizer();
  }

  @Bean
  public UrlCache urlCache(StorageProperties properties, Clock clock) {
    return new UrlCache(properties.urls().cacheMaxSize(), clock);
  }

  @Bean
  public UrlService urlService(
      ConfiguredProviders providers,
      PathManager pathManager,
      StorageProperties properties,
      UrlCache urlCache,
      @Qualifier("urlExecutor") Executor urlExecutor) {
    return new UrlService(
        providers.primary(), pathManager, properties.urls(), urlCache, urlExecutor);
  }

  @Bean
  public RetryExecutor retryExecutor(StorageProperties properties) {
    return new RetryExecutor(properties.retry().toPolicy());
  }

  @Bean
  @ConditionalOnProperty(prefix = "storage.audit", name = "log-operations", havingValue = "true")
  public OperationAuditLogger operationAuditLogger(ObjectMapper objectMapper) {
    return new OperationAuditLogger(objectMapper);
  }

  @Bean
  public StorageEventPublisher storageEventPublisher(
      ObjectProvider<StorageEventListener> listeners,
      @Qualifier("listenerExecutor") Executor listenerExecutor) {
    return new StorageEventPublisher(listeners.orderedStream().toList(), listenerExecutor);
  }

  @Bean
  public StorageService storageService(
      ConfiguredProviders providers,
      ProviderFactory providerFactory,
      PathManager pathManager,
      ImageOptimizer imageOptimizer,
      UrlService urlService,
      RetryExecutor retryExecutor,
      StorageEventPublisher eventPublisher,
      StorageProperties properties,
      @Qualifier("imageExecutor") Executor imageExecutor,
      Clock clock) {
    return new StorageService(
        providers.primary(),
        providers.backup().orElse(null),
        providerFactory,
        pathManager,
        imageOptimizer,
        urlService,
        retryExecutor,
        eventPublisher,
        properties,
        imageExecutor,
        clock);
  }

  private static StorageAdapter create(ProviderFactory factory, ProviderProperties provider) {
    return factory.createProvider(
        provider.type(), provider.settingsOrEmpty(), provider.verifyConnection());
  }
}
