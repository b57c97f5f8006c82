package org.iomclient.broker;

public enum Protocol {
    COM(0),
    IOM(2);

    private final int code;

    Protocol(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
