package com.airgate.autoreply.state;

import com.airgate.common.infra.Debouncer;
import lombok.extern.slf4j.Slf4j;

/**
 * Debounced persistence of {@link EngineStateStore}. Mutations call
 * {@link #requestSave()}; shutdown calls {@link #close()}, which saves
 * synchronously.
 */
@Slf4j
public class StateSaver implements AutoCloseable {

    private final Debouncer debouncer;

    public StateSaver(EngineStateStore store, int debounceSeconds) {
        this.debouncer = new Debouncer("airgate-state-saver", debounceSeconds * 1000L, store::save);
    }

    public void requestSave() {
        debouncer.request();
    }

    public void flush() {
        debouncer.flush();
    }

    @Override
    public void close() {
        log.info("Flushing engine state");
        debouncer.flush();
        debouncer.close();
    }
}
