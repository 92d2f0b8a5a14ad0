package com.airgate.autoreply;

/**
 * Terminal state of {@link InboundPipeline#handle}.
 */
public enum PipelineOutcome {
    /** Reply generated, delivered and committed (or kept for retry). */
    REPLIED,
    /** The admission gate said no. */
    REJECTED,
    /** The engagement judge vetoed a probabilistic accept. */
    VETOED,
    /** Accepted, but nothing was delivered. */
    NO_REPLY,
    /** Own message or a session that is not enabled. */
    IGNORED
}
