package com.bookedbarber.ratelimit.store;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Distributed counter store backed by Redis.
 *
 * Every multi-step operation runs as a Lua script so that check, increment and expiry happen
 * atomically on the Redis side. Calls are bounded by a short timeout and wrapped in a
 * Resilience4j circuit breaker; both failure modes come back as {@link StoreResult#unavailable}.
 *
 * @author BookedBarber Platform Engineering
 */
@Slf4j
public class RedisCounterStore implements CounterStore {

    /*
     * KEYS = counters, ARGV = limit1, ttl1, delta1, limit2, ttl2, delta2, ...
     * Returns {deniedIndex (1-based, 0 when allowed), count1, count2, ...}
     */
    private static final String CHECK_AND_INCREMENT_ALL =
            "local n = #KEYS\n" +
            "local counts = {}\n" +
            "for i = 1, n do\n" +
            "  local current = tonumber(redis.call('GET', KEYS[i]) or '0')\n" +
            "  if current + tonumber(ARGV[(i - 1) * 3 + 3]) > tonumber(ARGV[(i - 1) * 3 + 1]) then\n" +
            "    local denied = {i}\n" +
            "    for j = 1, n do\n" +
            "      denied[j + 1] = tonumber(redis.call('GET', KEYS[j]) or '0')\n" +
            "    end\n" +
            "    return denied\n" +
            "  end\n" +
            "end\n" +
            "local result = {0}\n" +
            "for i = 1, n do\n" +
            "  local count = redis.call('INCRBY', KEYS[i], tonumber(ARGV[(i - 1) * 3 + 3]))\n" +
            "  if redis.call('TTL', KEYS[i]) == -1 then\n" +
            "    redis.call('EXPIRE', KEYS[i], tonumber(ARGV[(i - 1) * 3 + 2]))\n" +
            "  end\n" +
            "  result[i + 1] = count\n" +
            "end\n" +
            "return result";

    private static final String INCREMENT_WITH_TTL =
            "local count = redis.call('INCRBY', KEYS[1], tonumber(ARGV[1]))\n" +
            "if redis.call('TTL', KEYS[1]) == -1 then\n" +
            "  redis.call('EXPIRE', KEYS[1], tonumber(ARGV[2]))\n" +
            "end\n" +
            "return count";

    private static final String PUSH_BOUNDED =
            "redis.call('LPUSH', KEYS[1], ARGV[1])\n" +
            "redis.call('LTRIM', KEYS[1], 0, tonumber(ARGV[2]) - 1)\n" +
            "redis.call('EXPIRE', KEYS[1], tonumber(ARGV[3]))\n" +
            "return redis.call('LLEN', KEYS[1])";

    private static final String ADD_TO_SET =
            "redis.call('SADD', KEYS[1], ARGV[1])\n" +
            "if redis.call('TTL', KEYS[1]) == -1 then\n" +
            "  redis.call('EXPIRE', KEYS[1], tonumber(ARGV[2]))\n" +
            "end\n" +
            "return redis.call('SCARD', KEYS[1])";

    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> CHECK_AND_INCREMENT_ALL_SCRIPT =
            RedisScript.of(CHECK_AND_INCREMENT_ALL, List.class);
    private static final RedisScript<Long> INCREMENT_WITH_TTL_SCRIPT = RedisScript.of(INCREMENT_WITH_TTL, Long.class);
    private static final RedisScript<Long> PUSH_BOUNDED_SCRIPT = RedisScript.of(PUSH_BOUNDED, Long.class);
    private static final RedisScript<Long> ADD_TO_SET_SCRIPT = RedisScript.of(ADD_TO_SET, Long.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final CircuitBreaker circuitBreaker;
    private final Duration timeout;

    public RedisCounterStore(ReactiveStringRedisTemplate redisTemplate, CircuitBreaker circuitBreaker, Duration timeout) {
        this.redisTemplate = redisTemplate;
        this.circuitBreaker = circuitBreaker;
        this.timeout = timeout;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<StoreResult<CounterOutcome>> incrementAllIfBelow(List<CounterSpec> counters) {
        if (counters.isEmpty()) {
            return Mono.just(StoreResult.ok(new CounterOutcome(-1, List.of())));
        }
        List<String> keys = new ArrayList<>(counters.size());
        List<String> args = new ArrayList<>(counters.size() * 3);
        for (CounterSpec counter : counters) {
            keys.add(counter.key());
            args.add(String.valueOf(counter.limit()));
            args.add(String.valueOf(ttlSeconds(counter.ttl())));
            args.add(String.valueOf(counter.delta()));
        }

        Flux<Object> raw = (Flux<Object>) (Flux<?>) redisTemplate.execute(CHECK_AND_INCREMENT_ALL_SCRIPT, keys, args);
        Mono<CounterOutcome> call = raw.collectList()
                .map(RedisCounterStore::flattenLongs)
                .map(values -> {
                    if (values.size() != counters.size() + 1) {
                        throw new IllegalStateException("Unexpected script reply size " + values.size());
                    }
                    int denied = values.get(0).intValue() - 1;
                    return new CounterOutcome(denied, values.subList(1, values.size()));
                });
        return guarded("incrementAllIfBelow", call);
    }

    @Override
    public Mono<StoreResult<Long>> increment(String key, long delta, Duration ttl) {
        Mono<Long> call = redisTemplate.execute(INCREMENT_WITH_TTL_SCRIPT, List.of(key),
                        List.of(String.valueOf(delta), String.valueOf(ttlSeconds(ttl))))
                .next();
        return guarded("increment", call);
    }

    @Override
    public Mono<StoreResult<Long>> get(String key) {
        Mono<Long> call = redisTemplate.opsForValue().get(key)
                .map(Long::parseLong)
                .defaultIfEmpty(0L);
        return guarded("get", call);
    }

    @Override
    public Mono<StoreResult<Optional<String>>> getValue(String key) {
        Mono<Optional<String>> call = redisTemplate.opsForValue().get(key)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
        return guarded("getValue", call);
    }

    @Override
    public Mono<StoreResult<Boolean>> setValue(String key, String value, Duration ttl) {
        Mono<Boolean> call = redisTemplate.opsForValue().set(key, value, ttl)
                .defaultIfEmpty(Boolean.FALSE);
        return guarded("setValue", call);
    }

    @Override
    public Mono<StoreResult<Long>> pushBounded(String key, String value, int maxLength, Duration ttl) {
        Mono<Long> call = redisTemplate.execute(PUSH_BOUNDED_SCRIPT, List.of(key),
                        List.of(value, String.valueOf(maxLength), String.valueOf(ttlSeconds(ttl))))
                .next();
        return guarded("pushBounded", call);
    }

    @Override
    public Mono<StoreResult<List<String>>> range(String key, int count) {
        Mono<List<String>> call = redisTemplate.opsForList().range(key, 0, count - 1L)
                .collectList();
        return guarded("range", call);
    }

    @Override
    public Mono<StoreResult<Long>> addToSet(String key, String member, Duration ttl) {
        Mono<Long> call = redisTemplate.execute(ADD_TO_SET_SCRIPT, List.of(key),
                        List.of(member, String.valueOf(ttlSeconds(ttl))))
                .next();
        return guarded("addToSet", call);
    }

    @Override
    public Mono<StoreResult<Boolean>> delete(String key) {
        Mono<Boolean> call = redisTemplate.delete(key).map(deleted -> deleted > 0);
        return guarded("delete", call);
    }

    private <T> Mono<StoreResult<T>> guarded(String operation, Mono<T> call) {
        return call
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .map(StoreResult::ok)
                .switchIfEmpty(Mono.fromSupplier(() ->
                        StoreResult.unavailable(StoreFailure.ERROR, operation + " returned no reply")))
                .onErrorResume(e -> Mono.just(toFailure(operation, e)));
    }

    private <T> StoreResult<T> toFailure(String operation, Throwable e) {
        StoreFailure failure;
        if (e instanceof TimeoutException) {
            failure = StoreFailure.TIMEOUT;
        } else if (e instanceof CallNotPermittedException) {
            failure = StoreFailure.CIRCUIT_OPEN;
        } else {
            failure = StoreFailure.ERROR;
        }
        log.debug("REDIS_STORE_UNAVAILABLE: operation={}, failure={}, error={}", operation, failure, e.toString());
        return StoreResult.unavailable(failure, operation + ": " + e.getMessage());
    }

    private static long ttlSeconds(Duration ttl) {
        return Math.max(1L, ttl.toSeconds());
    }

    static List<Long> flattenLongs(List<?> reply) {
        if (reply.size() == 1 && reply.get(0) instanceof List<?> nested) {
            return flattenLongs(nested);
        }
        List<Long> values = new ArrayList<>(reply.size());
        for (Object element : reply) {
            if (element instanceof Number number) {
                values.add(number.longValue());
            } else if (element != null) {
                values.add(Long.parseLong(element.toString()));
            }
        }
        return Collections.unmodifiableList(values);
    }
}
