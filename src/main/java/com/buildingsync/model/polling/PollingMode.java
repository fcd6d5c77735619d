package com.buildingsync.model.polling;

public enum PollingMode {
    FAST,
    SLOW
}
