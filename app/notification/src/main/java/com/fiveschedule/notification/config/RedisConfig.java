/*
 * Where: infrastructure configuration
 * What: provides the StringRedisTemplate used by the cache layer
 * Why: cache values are JSON strings, so string serializers on both key and value
 */
package com.fiveschedule.notification.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RedisConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }
}
