package net.cloudjob.core.scheduler;

import net.cloudjob.core.service.JobDispatcher;
import net.cloudjob.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 전용 스레드에서 tick 을 interval 간격으로 돌리는 루프.
 * tick 예외/Error 는 로그 + 카운트 후 다음 주기에 재시도 (VM 치명 오류는 루프를 멈춘다). 정지 플래그는 tick 경계에서만 확인한다.
 */
public final class PeriodicLoop {
    private static final Logger log = LoggerFactory.getLogger(PeriodicLoop.class);

    /** true 를 반환하면 대기 없이 바로 다음 tick */
    @FunctionalInterface
    public interface Tick {
        boolean run() throws Exception;
    }

    private final String name;
    private final Duration interval;
    private final Tick tick;
    private final Clock clock;

    private final Object monitor = new Object();
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private volatile boolean running;
    private volatile boolean inTick;
    private volatile Instant startedAt;
    private volatile Instant lastTickAt;
    private Thread thread;

    public PeriodicLoop(String name, Duration interval, Tick tick, Clock clock) {
        this.name = name;
        this.interval = interval;
        this.tick = tick;
        this.clock = clock;
    }

    public synchronized void start() {
        if (thread != null) throw new IllegalStateException("Loop already started: " + name);
        running = true;
        startedAt = clock.now();
        thread = new Thread(this::runLoop, "cloudjob-" + name);
        thread.setDaemon(true);
        thread.start();
    }

    private void runLoop() {
        log.info("{} loop started (interval={})", name, interval);
        while (running) {
            boolean again = false;
            inTick = true;
            try {
                again = tick.run();
            } catch (Throwable t) {
                errors.incrementAndGet();
                log.error("{} loop tick failed", name, t);
                if (JobDispatcher.isFatal(t)) {
                    running = false;
                    throw (Error) t;
                }
            } finally {
                inTick = false;
                lastTickAt = clock.now();
                ticks.incrementAndGet();
            }
            if (!again) sleepInterval();
        }
        log.info("{} loop stopped", name);
    }

    private void sleepInterval() {
        long deadline = System.nanoTime() + interval.toNanos();
        synchronized (monitor) {
            while (running) {
                long leftMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (leftMs <= 0) return;
                try {
                    monitor.wait(leftMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    running = false;
                    return;
                }
            }
        }
    }

    /** 정지 요청. 대기 중이면 즉시 깨우고, tick 중이면 tick 이 끝난 뒤 종료 */
    public void signalStop() {
        running = false;
        synchronized (monitor) {
            monitor.notifyAll();
        }
    }

    /** @return timeout 안에 스레드가 끝났으면 true */
    public boolean join(Duration timeout) throws InterruptedException {
        Thread t;
        synchronized (this) {
            t = thread;
        }
        if (t == null) return true;
        t.join(Math.max(1, timeout.toMillis()));
        return !t.isAlive();
    }

    public synchronized boolean isAlive() {
        return thread != null && thread.isAlive();
    }

    /** 살아 있고, tick 중이거나 최근 3 주기 안에 tick 을 끝냈으면 건강 */
    public boolean isHealthy(Instant now) {
        if (!running || !isAlive()) return false;
        if (inTick) return true;
        Instant ref = lastTickAt != null ? lastTickAt : startedAt;
        return ref != null && now.isBefore(ref.plus(interval.multipliedBy(3)));
    }

    public LoopStatus status(Instant now) {
        return new LoopStatus(name, running, isAlive(), isHealthy(now), lastTickAt, ticks.get(), errors.get());
    }

    public String name() {
        return name;
    }

    public Duration interval() {
        return interval;
    }

    public long ticks() {
        return ticks.get();
    }

    public long errors() {
        return errors.get();
    }

    public record LoopStatus(String name, boolean running, boolean alive, boolean healthy,
                             Instant lastTickAt, long ticks, long errors) {
    }
}
