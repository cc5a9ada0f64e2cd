package com.zenith.backend.service.ai;

/**
 * AI opinion on a prospective purchase. {@code verdict} is {@link Verdict#UNKNOWN} when the
 * reply carried no recognisable verdict line or the reply was a fallback.
 */
public record PurchaseAdvice(Verdict verdict, String advice, boolean fallback) {

    public enum Verdict {
        APPROVE,
        CAUTION,
        DENY,
        UNKNOWN
    }
}
