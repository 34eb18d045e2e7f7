package io.clype.sqsbatcher.transport;

import java.util.List;

import io.clype.sqsbatcher.model.BatchItem;
import io.clype.sqsbatcher.model.BatchSendResult;

/**
 * Performs one batched send to a queue and reports per-entry outcomes.
 *
 * <p>Implementations are shared across buffers and must not keep per-batch state.
 * A call either returns a structured result (possibly with rejected entries) or throws
 * a {@link RuntimeException} when the call itself failed.</p>
 */
public interface BatchTransport {

    /**
     * Sends the items in one call, in the given order.
     *
     * @param queueUrl the destination queue
     * @param items    the entries to send (1-10)
     * @return accepted ids and rejected entries
     */
    BatchSendResult sendBatch(String queueUrl, List<BatchItem> items);
}
