package com.scholary.storage.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one JSON line per completed storage operation to a dedicated logger, so file activity can
 * be shipped to an analytics index without a database.
 */
public class OperationAuditLogger implements StorageEventListener {

  private static final Logger AUDIT = LoggerFactory.getLogger("storage.audit");
  private static final Logger LOGGER = LoggerFactory.getLogger(OperationAuditLogger.class);

  private final ObjectMapper objectMapper;

  public OperationAuditLogger(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void onEvent(StorageEvent event) {
    AUDIT.info(toJson(event));
  }

  String toJson(StorageEvent event) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("operation", event.type().name().toLowerCase(Locale.ROOT));
    entry.put("key", event.key());
    entry.put("provider", event.provider());
    entry.put("size", event.size());
    entry.put("backup", event.backup());
    entry.put("actor", event.actor());
    entry.put("timestamp", event.occurredAt().toString());
    entry.put("attributes", event.attributes());
    try {
      return objectMapper.writeValueAsString(entry);
    } catch (JsonProcessingException e) {
      LOGGER.warn("Failed to serialize audit entry: key={}", event.key(), e);
      return String.format("{\"operation\":\"%s\",\"key\":\"%s\"}", event.type(), event.key());
    }
  }
}
