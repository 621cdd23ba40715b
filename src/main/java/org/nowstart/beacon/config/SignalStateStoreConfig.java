package org.nowstart.beacon.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.beacon.repository.InMemorySignalStateStore;
import org.nowstart.beacon.repository.RedisSignalStateStore;
import org.nowstart.beacon.repository.SignalStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Slf4j
@Configuration
public class SignalStateStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "beacon.signal", name = "state-store", havingValue = "memory", matchIfMissing = true)
    public SignalStateStore inMemorySignalStateStore(Clock clock) {
        log.info("event=state_store_init type=memory");
        return new InMemorySignalStateStore(clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "beacon.signal", name = "state-store", havingValue = "redis")
    public SignalStateStore redisSignalStateStore(StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper) {
        log.info("event=state_store_init type=redis");
        return new RedisSignalStateStore(stringRedisTemplate, objectMapper);
    }
}
