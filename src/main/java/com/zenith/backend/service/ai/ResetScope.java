package com.zenith.backend.service.ai;

public enum ResetScope {
    /** The caller's threads and briefs. */
    USER,
    /** Every assistant, thread and brief. */
    GLOBAL
}
