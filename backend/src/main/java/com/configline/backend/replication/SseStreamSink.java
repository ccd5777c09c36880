package com.configline.backend.replication;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

public class SseStreamSink implements StreamSink {

    private final SseEmitter emitter;

    public SseStreamSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    public SseEmitter emitter() {
        return emitter;
    }

    @Override
    public void send(String json) throws IOException {
        emitter.send(SseEmitter.event().data(json));
    }

    @Override
    public void comment(String text) throws IOException {
        emitter.send(SseEmitter.event().comment(text));
    }

    @Override
    public void complete() {
        emitter.complete();
    }

    @Override
    public void onDisconnect(Runnable callback) {
        emitter.onCompletion(callback);
        emitter.onTimeout(callback);
        emitter.onError(e -> callback.run());
    }
}
