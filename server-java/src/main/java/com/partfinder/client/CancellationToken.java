package com.partfinder.client;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks the upstream HTTP calls made on behalf of one search so they can all be
 * cancelled when the caller gives up.
 */
@Slf4j
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Call> calls = new CopyOnWriteArrayList<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Registers a call before it is executed. A call registered after cancellation
     * is cancelled immediately.
     */
    public Call register(Call call) {
        calls.add(call);
        if (cancelled.get()) {
            call.cancel();
        }
        return call;
    }

    public void unregister(Call call) {
        calls.remove(call);
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancelling {} in-flight upstream call(s)", calls.size());
            calls.forEach(Call::cancel);
            calls.clear();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
