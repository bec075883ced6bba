package engine;

import common.consts.EventTypeEnum;
import service.dispatch.Dispatcher;
import service.monitor.SimulationMonitor;

import java.util.List;

/**
 * 事件处理器扩展点
 * 每种事件类型对应一个处理器，SimulationEngine 按类型分派。
 */
public interface SimEventHandler {

    /**
     * 该处理器负责的事件类型
     */
    EventTypeEnum getType();

    /**
     * 执行事件：只修改派单状态与实体状态、通知监控器，并返回由此产生的新事件
     */
    List<SimEvent> handle(SimEvent event, Dispatcher dispatcher, SimulationMonitor monitor);
}
