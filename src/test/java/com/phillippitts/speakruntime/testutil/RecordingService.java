package com.phillippitts.speakruntime.testutil;

import com.phillippitts.speakruntime.service.lifecycle.ServiceLifecycle;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Service that records each callback it receives; optionally throws from every callback.
 */
public class RecordingService implements ServiceLifecycle {

    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final boolean failing;

    public RecordingService() {
        this(false);
    }

    public RecordingService(boolean failing) {
        this.failing = failing;
    }

    public List<String> calls() {
        return calls;
    }

    private void record(String callback) {
        calls.add(callback);
        if (failing) {
            throw new IllegalStateException(callback + " failed");
        }
    }

    @Override
    public void onLaunched() {
        record("onLaunched");
    }

    @Override
    public void onWillForeground() {
        record("onWillForeground");
    }

    @Override
    public void onDidBackground() {
        record("onDidBackground");
    }

    @Override
    public void onWillTerminate() {
        record("onWillTerminate");
    }

    @Override
    public void onLowMemory() {
        record("onLowMemory");
    }

    @Override
    public void onSleep() {
        record("onSleep");
    }

    @Override
    public void onWake() {
        record("onWake");
    }
}
