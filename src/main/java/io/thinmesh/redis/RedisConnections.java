package io.thinmesh.redis;

import io.thinmesh.error.TransientStorageException;
import io.thinmesh.util.Retries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * One Lettuce connection factory and template per process, shared by the
 * Redis router, manifest and ledger.
 */
public final class RedisConnections implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RedisConnections.class);

    private final LettuceConnectionFactory factory;
    private final StringRedisTemplate template;
    private final RedisKeys keys;
    private final Retries.Policy retryPolicy;

    private RedisConnections(LettuceConnectionFactory factory, String keyPrefix, Retries.Policy retryPolicy) {
        this.factory = factory;
        this.template = new StringRedisTemplate(factory);
        this.keys = new RedisKeys(keyPrefix);
        this.retryPolicy = retryPolicy;
    }

    /**
     * @param url {@code redis://[:password@]host[:port][/db]}
     */
    public static RedisConnections open(String url, String keyPrefix, Retries.Policy retryPolicy) {
        URI uri = URI.create(url);
        if (!"redis".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) {
            throw new IllegalArgumentException("Not a redis URL: " + url);
        }
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(
                uri.getHost(), uri.getPort() > 0 ? uri.getPort() : 6379);
        String path = uri.getPath();
        if (path != null && path.length() > 1) {
            standalone.setDatabase(Integer.parseInt(path.substring(1)));
        }
        String userInfo = uri.getUserInfo();
        if (userInfo != null && !userInfo.isBlank()) {
            int colon = userInfo.indexOf(':');
            String password = colon >= 0 ? userInfo.substring(colon + 1) : userInfo;
            if (colon > 0) {
                standalone.setUsername(userInfo.substring(0, colon));
            }
            standalone.setPassword(RedisPassword.of(password));
        }
        LettuceClientConfiguration client = LettuceClientConfiguration.builder()
                .commandTimeout(Duration.ofSeconds(10))
                .build();
        LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone, client);
        factory.afterPropertiesSet();
        factory.start();
        log.info("Connected Redis backend at {}:{} (db {})", standalone.getHostName(), standalone.getPort(),
                standalone.getDatabase());
        return new RedisConnections(factory, keyPrefix, retryPolicy);
    }

    StringRedisTemplate template() {
        return template;
    }

    RedisKeys keys() {
        return keys;
    }

    /**
     * Runs a Redis call, retrying connection failures and timeouts as
     * {@link TransientStorageException}.
     */
    <T> T call(String operation, Supplier<T> work) {
        return Retries.call(operation, retryPolicy, () -> {
            try {
                return work.get();
            } catch (DataAccessResourceFailureException | QueryTimeoutException e) {
                throw new TransientStorageException(operation + ": " + e.getMessage(), e);
            }
        });
    }

    @Override
    public void close() {
        factory.destroy();
    }
}
