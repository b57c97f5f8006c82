package org.iomclient.broker;

public enum StreamMode {
    READ(1),
    WRITE(2);

    private final int code;

    StreamMode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
