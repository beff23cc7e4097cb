package io.thinmesh.redis;

import io.thinmesh.cost.SpendLedger;
import io.thinmesh.model.LedgerSnapshot;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Spend ledger as Redis hashes ({@code spent}, {@code in_flight},
 * {@code ceiling}, {@code halted}); reservations live in a per-run hash. The
 * check and the increment of a reservation are one Lua script, so concurrent
 * workers see each other's holds.
 */
public final class RedisSpendLedger implements SpendLedger {
    private static final String PRELUDE = """
            local function num(key, field, default)
              local v = redis.call('HGET', key, field)
              if v then
                return tonumber(v)
              end
              return default
            end
            local function int(x)
              return string.format('%d', x)
            end
            local function ensure(key, now)
              redis.call('HSETNX', key, 'spent', '0')
              redis.call('HSETNX', key, 'in_flight', '0')
              redis.call('HSETNX', key, 'ceiling', '-1')
              redis.call('HSETNX', key, 'halted', '0')
              redis.call('HSET', key, 'updated_at_ms', now)
            end
            """;

    /** KEYS: run ledger, global ledger, reservations. ARGV: reservation id, amount, global ceiling, now. */
    private static final DefaultRedisScript<Long> RESERVE = new DefaultRedisScript<>(PRELUDE + """
            ensure(KEYS[1], ARGV[4])
            ensure(KEYS[2], ARGV[4])
            local previous = tonumber(redis.call('HGET', KEYS[3], ARGV[1]) or '0')
            local delta = tonumber(ARGV[2]) - previous
            local function fits(key, limit)
              if limit < 0 then
                return true
              end
              local used = num(key, 'spent', 0) + num(key, 'in_flight', 0)
              return used - previous < limit and used + delta <= limit
            end
            local ok = num(KEYS[1], 'halted', 0) == 0 and fits(KEYS[1], num(KEYS[1], 'ceiling', -1))
            if ok then
              ok = fits(KEYS[2], tonumber(ARGV[3]))
            end
            if not ok then
              redis.call('HSET', KEYS[1], 'halted', '1')
              return 0
            end
            redis.call('HSET', KEYS[1], 'in_flight', int(num(KEYS[1], 'in_flight', 0) + delta))
            redis.call('HSET', KEYS[2], 'in_flight', int(num(KEYS[2], 'in_flight', 0) + delta), 'ceiling', ARGV[3])
            redis.call('HSET', KEYS[3], ARGV[1], ARGV[2])
            return 1
            """, Long.class);

    /** KEYS: run ledger, global ledger, reservations. ARGV: reservation id, charge, now. */
    private static final DefaultRedisScript<Long> CLOSE = new DefaultRedisScript<>(PRELUDE + """
            local held = redis.call('HGET', KEYS[3], ARGV[1])
            if not held then
              return 0
            end
            redis.call('HDEL', KEYS[3], ARGV[1])
            for i = 1, 2 do
              ensure(KEYS[i], ARGV[3])
              local inflight = num(KEYS[i], 'in_flight', 0) - tonumber(held)
              if inflight < 0 then
                inflight = 0
              end
              redis.call('HSET', KEYS[i], 'in_flight', int(inflight),
                'spent', int(num(KEYS[i], 'spent', 0) + tonumber(ARGV[2])))
            end
            return 1
            """, Long.class);

    /** KEYS: run ledger. ARGV: ceiling, now. */
    private static final DefaultRedisScript<Long> SET_CEILING = new DefaultRedisScript<>(PRELUDE + """
            ensure(KEYS[1], ARGV[2])
            redis.call('HSET', KEYS[1], 'ceiling', ARGV[1], 'halted', '0')
            return 1
            """, Long.class);

    private final RedisConnections redis;
    private final StringRedisTemplate template;
    private final RedisKeys keys;

    public RedisSpendLedger(RedisConnections redis) {
        this.redis = redis;
        this.template = redis.template();
        this.keys = redis.keys();
    }

    @Override
    public boolean reserve(String runId, String reservationId, long amountMicros, long globalCeilingMicros) {
        Long granted = redis.call("reserve " + reservationId, () -> template.execute(RESERVE,
                List.of(keys.ledger(runId), keys.ledger(GLOBAL_SCOPE), keys.reservations(runId)),
                reservationId, Long.toString(amountMicros), Long.toString(globalCeilingMicros), now()));
        return granted != null && granted == 1L;
    }

    @Override
    public boolean settle(String runId, String reservationId, long actualMicros) {
        return close(runId, reservationId, actualMicros);
    }

    @Override
    public boolean release(String runId, String reservationId) {
        return close(runId, reservationId, 0L);
    }

    private boolean close(String runId, String reservationId, long chargeMicros) {
        Long closed = redis.call("close reservation " + reservationId, () -> template.execute(CLOSE,
                List.of(keys.ledger(runId), keys.ledger(GLOBAL_SCOPE), keys.reservations(runId)),
                reservationId, Long.toString(chargeMicros), now()));
        return closed != null && closed == 1L;
    }

    @Override
    public void setCeiling(String runId, long ceilingMicros) {
        redis.call("set ceiling " + runId, () -> template.execute(SET_CEILING, List.of(keys.ledger(runId)),
                Long.toString(ceilingMicros), now()));
    }

    @Override
    public Optional<LedgerSnapshot> snapshot(String scope) {
        HashOperations<String, String, String> hashes = template.opsForHash();
        Map<String, String> fields = redis.call("ledger snapshot " + scope, () -> hashes.entries(keys.ledger(scope)));
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new LedgerSnapshot(
                scope,
                Long.parseLong(fields.getOrDefault("spent", "0")),
                Long.parseLong(fields.getOrDefault("in_flight", "0")),
                Long.parseLong(fields.getOrDefault("ceiling", "-1")),
                "1".equals(fields.get("halted")),
                Long.parseLong(fields.getOrDefault("updated_at_ms", "0"))
        ));
    }

    private static String now() {
        return Long.toString(Instant.now().toEpochMilli());
    }
}
