package com.example.iptvcatalog.domain.enumtype;

public enum SyncOutcome {
    SUCCESS,
    FAILED,
    SOURCE_DELETED
}
