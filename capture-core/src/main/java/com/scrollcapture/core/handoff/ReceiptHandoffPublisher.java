package com.scrollcapture.core.handoff;

/**
 * Hands an accepted receipt image to whatever uploads it.
 *
 * <p>The capture pipeline only knows this interface; the upload itself lives outside it.
 * Implementations MUST NOT block the caller (fire-and-forget or fully reactive) and must
 * absorb their own delivery failures.
 */
public interface ReceiptHandoffPublisher {

    void publish(AcceptedReceipt receipt);
}
