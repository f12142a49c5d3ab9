package com.flexledger.inventory;

import java.math.BigDecimal;

/** Outcome of matching one disposal against open lots. */
public final class DisposalResult {
    private final BigDecimal matchedQuantity;
    private final BigDecimal consumedCost;
    private final BigDecimal shortfallQuantity;
    private final int lotsTouched;

    DisposalResult(BigDecimal matchedQuantity, BigDecimal consumedCost, BigDecimal shortfallQuantity, int lotsTouched) {
        this.matchedQuantity = matchedQuantity;
        this.consumedCost = consumedCost;
        this.shortfallQuantity = shortfallQuantity;
        this.lotsTouched = lotsTouched;
    }

    public BigDecimal getMatchedQuantity() {
        return matchedQuantity;
    }

    /** Cost of the lots consumed; the shortfall contributes nothing. */
    public BigDecimal getConsumedCost() {
        return consumedCost;
    }

    /** Quantity disposed beyond every open lot, treated as acquired at zero cost. */
    public BigDecimal getShortfallQuantity() {
        return shortfallQuantity;
    }

    public boolean hasShortfall() {
        return shortfallQuantity.signum() > 0;
    }

    public int getLotsTouched() {
        return lotsTouched;
    }
}
