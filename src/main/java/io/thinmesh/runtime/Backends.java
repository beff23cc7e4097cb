package io.thinmesh.runtime;

import io.thinmesh.artifact.ArtifactStore;
import io.thinmesh.artifact.FileArtifactStore;
import io.thinmesh.artifact.HttpArtifactStore;
import io.thinmesh.config.ThinMeshConfig;
import io.thinmesh.observability.AuditLogger;
import io.thinmesh.redis.RedisConnections;
import io.thinmesh.redis.RedisManifestStore;
import io.thinmesh.redis.RedisSpendLedger;
import io.thinmesh.redis.RedisTaskRouter;
import io.thinmesh.router.RedeliveryPolicy;
import io.thinmesh.storage.Database;
import io.thinmesh.storage.SqliteManifestStore;
import io.thinmesh.storage.SqliteSpendLedger;
import io.thinmesh.storage.SqliteTaskRouter;
import io.thinmesh.util.Retries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Picks the queue backend ({@code sqlite:} or {@code redis://}) and the
 * artifact backend ({@code file:} or {@code http://}) from configuration.
 */
public final class Backends {
    private static final Logger log = LoggerFactory.getLogger(Backends.class);
    private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(30);

    private Backends() {
    }

    public static OrchestratorContext open(ThinMeshConfig config) {
        Retries.Policy retryPolicy = new Retries.Policy(Retries.Policy.DEFAULT.maxAttempts(),
                config.baseBackoffMs(), config.maxBackoffMs());
        RedeliveryPolicy redelivery = new RedeliveryPolicy(config.maxAttempts(), config.baseBackoffMs(),
                config.maxBackoffMs());
        ArtifactStore artifacts = config.isHttpArtifacts()
                ? new HttpArtifactStore(config.artifactUrl(), HTTP_TIMEOUT, retryPolicy)
                : new FileArtifactStore(config.artifactsDir(), retryPolicy);
        AuditLogger audit = new AuditLogger(config.auditFile());

        if (config.isRedisQueue()) {
            RedisConnections redis = RedisConnections.open(config.queueUrl(), config.keyPrefix(), retryPolicy);
            log.info("Using redis queue backend with artifacts at {}", config.artifactUrl());
            return new OrchestratorContext(
                    config,
                    artifacts,
                    new RedisTaskRouter(redis, config.consumerGroup(), config::leaseMsFor, redelivery),
                    new RedisManifestStore(redis),
                    new RedisSpendLedger(redis),
                    audit,
                    redis
            );
        }

        Database database = new Database(config.dbFile(), retryPolicy);
        database.init();
        log.info("Using sqlite queue backend {} with artifacts at {}", database.dbFile(), config.artifactUrl());
        return new OrchestratorContext(
                config,
                artifacts,
                new SqliteTaskRouter(database, config.consumerGroup(), config::leaseMsFor, redelivery),
                new SqliteManifestStore(database),
                new SqliteSpendLedger(database),
                audit,
                null
        );
    }
}
