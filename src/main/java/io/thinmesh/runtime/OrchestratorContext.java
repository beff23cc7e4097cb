package io.thinmesh.runtime;

import io.thinmesh.artifact.ArtifactStore;
import io.thinmesh.config.ThinMeshConfig;
import io.thinmesh.cost.CostGuard;
import io.thinmesh.cost.SpendLedger;
import io.thinmesh.manifest.ManifestStore;
import io.thinmesh.observability.AuditLogger;
import io.thinmesh.router.TaskRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Every backend client of one process, built once by {@link Backends#open}
 * and handed to the planner and workers. Closing it closes the clients.
 */
public final class OrchestratorContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OrchestratorContext.class);

    private final ThinMeshConfig config;
    private final ArtifactStore artifacts;
    private final TaskRouter router;
    private final ManifestStore manifest;
    private final SpendLedger ledger;
    private final CostGuard costGuard;
    private final AuditLogger audit;
    private final AutoCloseable connection;

    OrchestratorContext(ThinMeshConfig config, ArtifactStore artifacts, TaskRouter router, ManifestStore manifest,
                        SpendLedger ledger, AuditLogger audit, AutoCloseable connection) {
        this.config = config;
        this.artifacts = artifacts;
        this.router = router;
        this.manifest = manifest;
        this.ledger = ledger;
        this.costGuard = new CostGuard(ledger, config.globalCeilingMicros());
        this.audit = audit;
        this.connection = connection;
    }

    public ThinMeshConfig config() {
        return config;
    }

    public ArtifactStore artifacts() {
        return artifacts;
    }

    public TaskRouter router() {
        return router;
    }

    public ManifestStore manifest() {
        return manifest;
    }

    public SpendLedger ledger() {
        return ledger;
    }

    public CostGuard costGuard() {
        return costGuard;
    }

    public AuditLogger audit() {
        return audit;
    }

    @Override
    public void close() {
        closeQuietly("router", router);
        closeQuietly("manifest", manifest);
        closeQuietly("ledger", ledger);
        closeQuietly("artifacts", artifacts);
        if (connection != null) {
            closeQuietly("connection", connection);
        }
    }

    private static void closeQuietly(String what, AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Failed to close {}: {}", what, e.getMessage(), e);
        }
    }
}
