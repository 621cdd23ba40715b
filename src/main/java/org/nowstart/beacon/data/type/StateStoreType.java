package org.nowstart.beacon.data.type;

public enum StateStoreType {
    MEMORY,
    REDIS
}
