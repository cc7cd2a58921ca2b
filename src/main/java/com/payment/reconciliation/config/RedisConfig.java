package com.payment.reconciliation.config;

import com.payment.reconciliation.core.IdempotencyRecord;
import com.payment.reconciliation.core.IdempotencyRecordRedisSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis template for the idempotency cache: string keys, JSON
 * {@link IdempotencyRecord} values.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, IdempotencyRecord> idempotencyRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, IdempotencyRecord> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new IdempotencyRecordRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }
}
