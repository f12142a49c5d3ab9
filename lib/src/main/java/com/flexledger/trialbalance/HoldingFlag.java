package com.flexledger.trialbalance;

public enum HoldingFlag {
    /** A disposal of this instrument ran past its open lots and took the excess at zero cost. */
    SHORTFALL,
    /** The broker's position report disagrees with the open lots, or omits the instrument. */
    BROKER_MISMATCH
}
