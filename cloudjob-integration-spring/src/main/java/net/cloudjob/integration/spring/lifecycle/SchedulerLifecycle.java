package net.cloudjob.integration.spring.lifecycle;

import net.cloudjob.core.scheduler.SchedulerCoordinator;
import org.springframework.context.SmartLifecycle;

/** 컨텍스트가 뜨면 세 루프를 시작하고, 닫힐 때 가장 먼저 정지(join)한다 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final SchedulerCoordinator coordinator;

    public SchedulerLifecycle(SchedulerCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void start() {
        coordinator.start();
    }

    @Override
    public void stop() {
        coordinator.stop();
    }

    @Override
    public boolean isRunning() {
        return coordinator.isRunning();
    }

    /** 데이터소스 등 다른 빈보다 늦게 시작하고 먼저 정지 */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 100;
    }
}
