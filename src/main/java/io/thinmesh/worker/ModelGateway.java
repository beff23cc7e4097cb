package io.thinmesh.worker;

/**
 * External service that performs paid model calls. The core never looks
 * inside requests or responses beyond the cost figures.
 */
public interface ModelGateway {
    long estimateMicros(TaskContext context) throws Exception;

    Invocation invoke(TaskContext context) throws Exception;

    record Invocation(byte[] output, String contentType, long costMicros) {
    }
}
