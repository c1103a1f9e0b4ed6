package net.bluemud.async.select;

import java.nio.channels.SelectionKey;

/**
 * Channel readiness that can be watched, mapped onto {@link SelectionKey} operations.
 */
public enum Readiness {
    READ(SelectionKey.OP_READ),
    WRITE(SelectionKey.OP_WRITE),
    ACCEPT(SelectionKey.OP_ACCEPT),
    CONNECT(SelectionKey.OP_CONNECT);

    private final int ops;

    Readiness(int ops) {
        this.ops = ops;
    }

    public int ops() {
        return ops;
    }
}
