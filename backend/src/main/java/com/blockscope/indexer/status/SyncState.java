package com.blockscope.indexer.status;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncState {
    DISABLED("disabled"),
    STARTING("starting"),
    CATCHING_UP("catching_up"),
    SYNCED("synced"),
    DEGRADED("degraded"),
    ERROR("error");

    private final String code;

    SyncState(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
