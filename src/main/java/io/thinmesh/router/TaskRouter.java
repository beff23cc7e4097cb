package io.thinmesh.router;

import io.thinmesh.model.CompletionBatch;
import io.thinmesh.model.DeadLetter;
import io.thinmesh.model.NackResult;
import io.thinmesh.model.TaskEnvelope;
import io.thinmesh.model.TaskOutcome;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable at-least-once queue of {@link TaskEnvelope}s, one FIFO per task type.
 *
 * <p>A claimed message is leased to one worker. If the lease expires before an
 * {@link #ack} or {@link #nack}, the message is redelivered to another worker of
 * the same consumer group. Acks and nacks are fenced on the delivery's lease
 * token: once a lease has been reclaimed, the old holder's calls return
 * {@code false} / {@link NackResult#STALE_LEASE} and change nothing.
 *
 * <p>Every ack, and every dead letter the router produces on its own, appends
 * one {@link io.thinmesh.model.CompletionEvent} to the run's completion log.
 */
public interface TaskRouter extends AutoCloseable {

    /**
     * @return the message id
     */
    String enqueue(TaskEnvelope envelope);

    /**
     * Blocks up to {@code timeout} for a message of one of {@code taskTypes}.
     * Expired leases are reclaimed first; a reclaimed message whose attempts are
     * exhausted is dead-lettered instead of delivered.
     */
    Optional<TaskEnvelope> claim(String consumerGroup, String workerId, Collection<String> taskTypes, Duration timeout);

    boolean ack(TaskEnvelope delivery, TaskOutcome outcome);

    default NackResult nack(TaskEnvelope delivery, String error) {
        return nack(delivery, error, 0L);
    }

    /**
     * Returns the message for redelivery, or dead-letters it as failed when the
     * delivery was its last allowed attempt. {@code chargedMicros} is what this
     * attempt spent; the failed completion carries the total over all attempts.
     */
    NackResult nack(TaskEnvelope delivery, String error, long chargedMicros);

    /**
     * Returns the message for redelivery without counting this delivery as a
     * failed attempt. Used when the worker backs out for reasons outside the
     * task itself, like a storage outage or a cancellation.
     */
    boolean release(TaskEnvelope delivery, String reason);

    /**
     * Blocks up to {@code timeout} for completion events after {@code cursor}.
     * A null cursor reads from the start of the run's log.
     */
    CompletionBatch pollCompletions(String runId, String cursor, int max, Duration timeout);

    /**
     * Position of the newest completion event of the run, usable as a cursor.
     */
    String completionCursor(String runId);

    /**
     * Task keys of the run with a queued or claimed message.
     */
    Set<String> outstandingTaskKeys(String runId);

    /**
     * @param runId null for every run
     */
    List<DeadLetter> deadLetters(String runId);

    /**
     * Queued plus claimed messages per task type.
     */
    Map<String, Long> queueDepths();

    @Override
    default void close() {
    }
}
