package com.flexledger.engine;

public enum RunStatus {
    BALANCED,
    UNBALANCED
}
