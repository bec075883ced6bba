package model.bo;

import engine.EventQueue;
import lombok.Getter;
import lombok.Setter;
import service.dispatch.Dispatcher;
import service.log.SimulationEventLog;
import service.monitor.SimulationMonitor;

import java.util.UUID;

/**
 * 单次仿真的运行上下文
 * 事件队列、派单员、监控器与仿真时钟归本上下文独占，不同仿真之间互不共享
 */
@Getter
public class SimulationContext {

    private final String simulationId = UUID.randomUUID().toString();

    /**
     * 仿真时钟
     * 只能通过事件处理向前推进，取值为最近处理事件的时间戳
     */
    @Setter
    private long simTime = 0L;

    private final EventQueue eventQueue = new EventQueue();
    private final Dispatcher dispatcher;
    private final SimulationMonitor monitor;
    private final SimulationEventLog eventLog;

    // 已处理的事件总数
    private long processedEventCount = 0L;

    public SimulationContext(Dispatcher dispatcher, SimulationMonitor monitor, SimulationEventLog eventLog) {
        this.dispatcher = dispatcher;
        this.monitor = monitor;
        this.eventLog = eventLog;
    }

    public void incrementProcessedEventCount() {
        processedEventCount++;
    }
}
