package com.creator.settlement.core;

import com.creator.settlement.api.SettlementException;
import com.creator.settlement.domain.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Serializes payout requests per creator with a Redis lock (SET NX PX), so two concurrent
 * requests cannot both pass the monthly limit check.
 * <p>
 * Fails open when Redis is unreachable: the ledger debit stays atomic on its own, only the
 * monthly limit becomes approximate again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayoutLockService {

    private static final String KEY_PREFIX = "settlement:payout-lock:";
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    @Value("${settlement.payout.lock-ttl-ms:30000}")
    private long lockTtlMs;

    public <T> T withCreatorLock(String creatorId, Supplier<T> action) {
        String key = KEY_PREFIX + creatorId;
        String token = UUID.randomUUID().toString();
        boolean held = acquire(key, token, creatorId);
        try {
            return action.get();
        } finally {
            if (held) {
                release(key, token, creatorId);
            }
        }
    }

    private boolean acquire(String key, String token, String creatorId) {
        Boolean acquired;
        try {
            acquired = redisTemplate.opsForValue().setIfAbsent(key, token, Duration.ofMillis(lockTtlMs));
        } catch (Exception e) {
            log.warn("Payout lock unavailable for creatorId={} (Redis error), proceeding without lock: {}",
                    creatorId, e.getMessage());
            return false;
        }
        if (!Boolean.TRUE.equals(acquired)) {
            log.warn("Payout already in progress for creatorId={}", creatorId);
            throw new SettlementException(ErrorKind.RATE_LIMITED, "PAYOUT_IN_PROGRESS",
                    "Another payout request is in progress");
        }
        return true;
    }

    private void release(String key, String token, String creatorId) {
        try {
            redisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(key), token);
        } catch (Exception e) {
            // Lock expires on its own after the TTL
            log.warn("Failed to release payout lock for creatorId={}: {}", creatorId, e.getMessage());
        }
    }
}
