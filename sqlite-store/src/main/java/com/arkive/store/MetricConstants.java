package com.arkive.store;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public abstract class MetricConstants {
    public static final String CONTENTION_RETRY_METRIC = "store-contention-retry";
    public static final String AUDIT_ERROR_METRIC = "audit-log-error";
    public static final String CHAIN_VIOLATION_METRIC = "audit-chain-violation";
    public static final String BACKUP_ERROR_METRIC = "backup-error";
    public static final String ACTION_TAG = "action";
    public static final String EXCEPTION_TAG = "exception";
}
