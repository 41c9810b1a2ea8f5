package com.rcassist.application.analysis;

import com.rcassist.domain.analysis.model.RunStage;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Token through which a caller abandons a run. Checked at stage boundaries only; I/O already in
 * flight finishes or times out on its own.
 */
public class RunCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static RunCancellation none() {
        return new RunCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void throwIfCancelled(RunStage next) {
        if (cancelled.get()) {
            throw new RunCancelledException("Analysis run cancelled before " + next);
        }
    }
}
