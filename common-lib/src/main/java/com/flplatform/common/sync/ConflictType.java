package com.flplatform.common.sync;

public enum ConflictType {
    VERSION_MISMATCH,
    WEIGHT_HASH_MISMATCH,
    ROUND_MISMATCH
}
