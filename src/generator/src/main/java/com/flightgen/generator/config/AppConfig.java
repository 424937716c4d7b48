package com.flightgen.generator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightgen.generator.sink.JdbcBatchSink;
import com.flightgen.generator.sink.RedisBatchSink;
import io.lettuce.core.RedisURI;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class AppConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // Any type other than redis gets the JDBC sink; RunConfiguration rejects unknown types before use.
  @Bean(destroyMethod = "close")
  @ConditionalOnExpression("'${generator.sink.type:jdbc}' != 'redis'")
  public JdbcBatchSink jdbcBatchSink(GeneratorProperties properties) {
    GeneratorProperties.Sink sink = properties.sink();
    return JdbcBatchSink.create(properties.connectionString(), sink == null ? null : sink.jdbc());
  }

  // With the redis sink the connection string is a Redis URI, e.g. redis://localhost:6379/0.
  @Bean
  @ConditionalOnProperty(prefix = "generator.sink", name = "type", havingValue = "redis")
  public LettuceConnectionFactory redisConnectionFactory(GeneratorProperties properties) {
    RedisURI uri;
    try {
      uri = RedisURI.create(properties.connectionString());
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("connection-string must be a Redis URI for the redis sink", ex);
    }
    RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
    standalone.setDatabase(uri.getDatabase());
    if (uri.getPassword() != null) {
      standalone.setPassword(RedisPassword.of(uri.getPassword()));
    }
    return new LettuceConnectionFactory(standalone);
  }

  @Bean
  @ConditionalOnProperty(prefix = "generator.sink", name = "type", havingValue = "redis")
  public RedisBatchSink redisBatchSink(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, GeneratorProperties properties) {
    GeneratorProperties.Sink sink = properties.sink();
    String keyPrefix = sink == null || sink.redis() == null ? "" : sink.redis().keyPrefix();
    return new RedisBatchSink(redisTemplate, objectMapper, keyPrefix);
  }
}
