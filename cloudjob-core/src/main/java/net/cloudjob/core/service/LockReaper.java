package net.cloudjob.core.service;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** 주기 점검: 죽었거나 멈춘 보유자의 리스를 회수해서 다시 픽업 가능하게 한다 */
public final class LockReaper {
    private final JobPicker picker;
    private final AtomicLong released = new AtomicLong();

    public LockReaper(JobPicker picker) {
        this.picker = picker;
    }

    public List<String> reapOnce() throws Exception {
        List<String> ids = picker.releaseExpiredLocks();
        released.addAndGet(ids.size());
        return ids;
    }

    public long released() {
        return released.get();
    }
}
