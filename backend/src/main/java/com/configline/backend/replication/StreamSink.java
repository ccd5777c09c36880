package com.configline.backend.replication;

import java.io.IOException;

/** Transport end of one subscriber. Implementations need not be thread-safe; one thread writes. */
public interface StreamSink {

    void send(String json) throws IOException;

    void comment(String text) throws IOException;

    void complete();

    /** Registers a callback run when the client goes away or the transport fails. */
    void onDisconnect(Runnable callback);
}
