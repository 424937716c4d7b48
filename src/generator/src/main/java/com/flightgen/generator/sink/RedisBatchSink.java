package com.flightgen.generator.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightgen.generator.pipeline.Batch;
import com.flightgen.generator.plane.TelemetryRow;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Pushes batches as JSON rows onto a Redis list named {@code <keyPrefix><table>}.
 *
 * <p>A batch is sent as a single {@code RPUSH}, so it lands whole or not at all.
 */
public class RedisBatchSink implements BatchSink {
  private static final Logger log = LoggerFactory.getLogger(RedisBatchSink.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;

  public RedisBatchSink(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
  }

  @Override
  public void send(String tableName, Batch batch) throws SinkException {
    if (batch.size() == 0) {
      return;
    }
    List<String> payloads = new ArrayList<>(batch.size());
    for (TelemetryRow row : batch.rows()) {
      try {
        payloads.add(objectMapper.writeValueAsString(toEvent(row)));
      } catch (JsonProcessingException ex) {
        throw new SinkException("Failed to serialize row " + row.sequence() + " of plane " + row.planeId(), ex);
      }
    }

    String key = keyFor(tableName);
    try {
      redisTemplate.opsForList().rightPushAll(key, payloads);
    } catch (DataAccessException ex) {
      throw new SinkException("RPUSH of " + batch.size() + " rows to " + key + " failed: " + ex.getMessage(), ex);
    }
    log.debug("Pushed {} rows for plane {} to {}", batch.size(), batch.planeId(), key);
  }

  public String keyFor(String tableName) {
    return keyPrefix + tableName;
  }

  private Map<String, Object> toEvent(TelemetryRow row) {
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("plane_id", row.planeId().toString());
    event.put("seq", row.sequence());
    event.put("ts", row.timestamp().toString());
    event.put("latitude", row.latitude());
    event.put("longitude", row.longitude());
    event.put("altitude", row.altitude());
    event.put("ground_speed", row.groundSpeed());
    event.put("heading", row.heading());
    event.put("pitch", row.pitch());
    event.put("roll", row.roll());
    event.put("yaw", row.yaw());
    event.put("aoa", row.angleOfAttack());
    event.put("oat", row.outsideAirTemp());
    return event;
  }
}
