package com.scholary.storage.provider;

import com.scholary.storage.error.ErrorKind;
import com.scholary.storage.error.StorageException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link StorageAdapter} backed by a sorted map, with scripted failures and call counters.
 *
 * <p>Operations are named {@code upload}, {@code delete}, {@code exists}, {@code getMetadata},
 * {@code list}, {@code download}, {@code signedUrl}, {@code publicUrl} and {@code testConnection}.
 */
public class InMemoryStorageAdapter implements StorageAdapter {

  private final ProviderType type;
  private final String bucket;
  private final NavigableMap<String, StoredObject> objects = new ConcurrentSkipListMap<>();
  private final Map<String, UploadOptions> uploadOptions = new ConcurrentHashMap<>();
  private final Map<String, Deque<RuntimeException>> scripted = new ConcurrentHashMap<>();
  private final Map<String, RuntimeException> permanent = new ConcurrentHashMap<>();
  private final Map<String, RuntimeException> keyFailures = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
  private final AtomicInteger signatures = new AtomicInteger();

  private volatile ProviderCapabilities capabilities = ProviderCapabilities.none();
  private volatile boolean signingEnabled = true;
  private volatile boolean closed;

  public InMemoryStorageAdapter(ProviderType type, String bucket) {
    this.type = type;
    this.bucket = bucket;
  }

  public InMemoryStorageAdapter withCapabilities(ProviderCapabilities newCapabilities) {
    this.capabilities = newCapabilities;
    return this;
  }

  public InMemoryStorageAdapter withoutSigning() {
    this.signingEnabled = false;
    return this;
  }

  /** Throw the given errors, one per call, before the operation behaves normally again. */
  public void failNext(String operation, RuntimeException... errors) {
    scripted
        .computeIfAbsent(operation, op -> new ArrayDeque<>())
        .addAll(Arrays.asList(errors));
  }

  public void failAlways(String operation, RuntimeException error) {
    permanent.put(operation, error);
  }

  /** Fail every upload whose key ends with the given suffix. */
  public void failUploadsEndingWith(String keySuffix, RuntimeException error) {
    keyFailures.put(keySuffix, error);
  }

  public int calls(String operation) {
    AtomicInteger count = calls.get(operation);
    return count != null ? count.get() : 0;
  }

  public void seed(String key, byte[] data, String contentType) {
    objects.put(key, new StoredObject(data.clone(), contentType, Map.of(), etagOf(data)));
  }

  public void seed(String key, String content) {
    seed(key, content.getBytes(StandardCharsets.UTF_8), "text/plain");
  }

  public boolean contains(String key) {
    return objects.containsKey(key);
  }

  public byte[] content(String key) {
    StoredObject object = objects.get(key);
    return object != null ? object.data() : null;
  }

  public StoredObject object(String key) {
    return objects.get(key);
  }

  public UploadOptions lastUploadOptions(String key) {
    return uploadOptions.get(key);
  }

  public List<String> keys() {
    return new ArrayList<>(objects.keySet());
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public AdapterUploadResult upload(byte[] data, String key, UploadOptions options) {
    before("upload");
    for (Map.Entry<String, RuntimeException> failure : keyFailures.entrySet()) {
      if (key.endsWith(failure.getKey())) {
        throw failure.getValue();
      }
    }
    String etag = etagOf(data);
    objects.put(
        key,
        new StoredObject(data.clone(), options.effectiveContentType(), options.metadata(), etag));
    uploadOptions.put(key, options);
    return new AdapterUploadResult(publicUrl(key), key, data.length, etag, providerId());
  }

  @Override
  public DeleteOutcome delete(String key) {
    before("delete");
    uploadOptions.remove(key);
    return new DeleteOutcome(key, objects.remove(key) != null);
  }

  @Override
  public boolean exists(String key) {
    before("exists");
    return objects.containsKey(key);
  }

  @Override
  public ObjectMetadata getMetadata(String key) {
    before("getMetadata");
    StoredObject object = require(key);
    return new ObjectMetadata(
        object.data().length, object.contentType(), object.etag(), object.metadata(), null);
  }

  @Override
  public ListPage list(String prefix, int maxKeys, String continuationToken) {
    before("list");
    NavigableMap<String, StoredObject> view =
        continuationToken != null ? objects.tailMap(continuationToken, false) : objects;
    List<ObjectSummary> page = new ArrayList<>();
    String last = null;
    boolean more = false;
    for (Map.Entry<String, StoredObject> entry : view.entrySet()) {
      if (prefix != null && !entry.getKey().startsWith(prefix)) {
        continue;
      }
      if (page.size() == maxKeys) {
        more = true;
        break;
      }
      StoredObject object = entry.getValue();
      page.add(new ObjectSummary(entry.getKey(), object.data().length, object.etag(), null));
      last = entry.getKey();
    }
    return new ListPage(page, more ? last : null);
  }

  @Override
  public StoredObject download(String key) {
    before("download");
    return require(key);
  }

  @Override
  public String generateSignedUrl(String key, SignedUrlRequest request) {
    before("signedUrl");
    if (!signingEnabled) {
      throw new StorageException(
          ErrorKind.CONFIGURATION, "Signed URLs require credentials", providerId(), key, null);
    }
    StringBuilder url =
        new StringBuilder("https://signed.example/")
            .append(bucket)
            .append('/')
            .append(key)
            .append("?op=")
            .append(request.operation())
            .append("&expires=")
            .append(request.expiresIn().toSeconds());
    String disposition = request.responseHeaders().get(SignedUrlRequest.CONTENT_DISPOSITION);
    if (disposition != null) {
      url.append("&response-content-disposition=")
          .append(URLEncoder.encode(disposition, StandardCharsets.UTF_8));
    }
    return url.append("&sig=").append(signatures.incrementAndGet()).toString();
  }

  @Override
  public String generatePublicUrl(String key) {
    before("publicUrl");
    return publicUrl(key);
  }

  @Override
  public void testConnection() {
    before("testConnection");
  }

  @Override
  public ProviderCapabilities capabilities() {
    return capabilities;
  }

  @Override
  public ProviderType providerType() {
    return type;
  }

  @Override
  public ProviderInfo info() {
    return new ProviderInfo(
        type.id(), "In-memory " + type.id(), "local", bucket, null, capabilities);
  }

  @Override
  public void close() {
    closed = true;
  }

  private void before(String operation) {
    calls.computeIfAbsent(operation, op -> new AtomicInteger()).incrementAndGet();
    RuntimeException always = permanent.get(operation);
    if (always != null) {
      throw always;
    }
    Deque<RuntimeException> queue = scripted.get(operation);
    if (queue != null) {
      RuntimeException next;
      synchronized (queue) {
        next = queue.poll();
      }
      if (next != null) {
        throw next;
      }
    }
  }

  private StoredObject require(String key) {
    StoredObject object = objects.get(key);
    if (object == null) {
      throw new StorageException(
          ErrorKind.NOT_FOUND, "Object not found: " + key, providerId(), key, null);
    }
    return object;
  }

  private String publicUrl(String key) {
    return "https://" + bucket + ".example.com/" + key;
  }

  private static String etagOf(byte[] data) {
    return Integer.toHexString(Arrays.hashCode(data));
  }
}
