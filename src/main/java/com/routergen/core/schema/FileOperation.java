package com.routergen.core.schema;

public enum FileOperation {
    LIST("list"),
    READ("read"),
    WRITE("write"),
    PATCH("patch");

    private final String wire;

    FileOperation(String wire) {
        this.wire = wire;
    }

    public String getWire() {
        return wire;
    }

    public static FileOperation fromWire(String value) {
        for (FileOperation op : values()) {
            if (op.wire.equals(value)) return op;
        }
        throw new IllegalArgumentException("Unknown file operation: " + value);
    }
}
