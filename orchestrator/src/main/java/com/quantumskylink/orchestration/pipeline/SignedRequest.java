package com.quantumskylink.orchestration.pipeline;

import java.time.Instant;

/**
 * Anti-replay fields every signed workflow request carries.
 */
public interface SignedRequest {

    String nonce();

    long sequenceNumber();

    Instant timestamp();

    String signature();

    String algorithm();
}
