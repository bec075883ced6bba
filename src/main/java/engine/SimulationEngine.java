package engine;

import common.config.SimulationConfig;
import common.consts.ActivityTypeEnum;
import common.consts.ActorTypeEnum;
import common.consts.EventTypeEnum;
import common.exception.EventProcessingException;
import common.exception.SimulationDeadLoopException;
import lombok.extern.slf4j.Slf4j;
import model.bo.SimulationContext;
import model.dto.response.SimulationReport;
import model.dto.snapshot.EventLogEntryDto;
import model.entity.Driver;
import model.entity.Rider;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;
import service.dispatch.DispatchAlgorithm;
import service.dispatch.Dispatcher;
import service.log.SimulationErrorLog;
import service.log.SimulationEventLog;
import service.monitor.SimulationMonitor;
import service.monitor.impl.ActivityMonitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 离散事件仿真引擎
 * 引擎本身只持有无状态的处理器和配置；队列、派单员、监控器与时钟都在 {@link SimulationContext} 中，
 * 每个仿真独占一份。
 */
@Component
@Slf4j
public class SimulationEngine implements InitializingBean {

    private final SimulationConfig simulationConfig;
    private final SimulationErrorLog errorLog;
    private final DispatchAlgorithm dispatchAlgorithm;
    private final List<SimEventHandler> handlerBeans;
    private final Map<EventTypeEnum, SimEventHandler> handlerMap = new EnumMap<>(EventTypeEnum.class);

    public SimulationEngine(SimulationConfig simulationConfig,
                            SimulationErrorLog errorLog,
                            DispatchAlgorithm dispatchAlgorithm,
                            List<SimEventHandler> handlerBeans) {
        this.simulationConfig = simulationConfig;
        this.errorLog = errorLog;
        this.dispatchAlgorithm = dispatchAlgorithm;
        this.handlerBeans = handlerBeans;
    }

    @Override
    public void afterPropertiesSet() {
        // 通过 Spring 注入的处理器列表进行注册
        for (SimEventHandler handler : handlerBeans) {
            SimEventHandler previous = handlerMap.put(handler.getType(), handler);
            if (previous != null) {
                throw new IllegalStateException(String.format("事件类型 %s 注册了多个处理器: %s, %s",
                        handler.getType(), previous.getClass().getSimpleName(), handler.getClass().getSimpleName()));
            }
        }
        // 每种事件都必须有处理器，否则仿真会丢事件
        for (EventTypeEnum type : EventTypeEnum.values()) {
            if (!handlerMap.containsKey(type)) {
                throw new IllegalStateException("事件类型 " + type + " 没有对应的处理器");
            }
        }
    }

    /**
     * 不经 Spring 装配时使用的处理器全集
     */
    public static List<SimEventHandler> defaultHandlers() {
        return List.of(new RiderRequestHandler(), new DriverRequestHandler(), new CancellationHandler(),
                new PickupHandler(), new DropoffHandler());
    }

    /**
     * 创建新的仿真上下文，并按给定顺序装入初始事件
     */
    public SimulationContext createContext(List<SimEvent> initialEvents) {
        boolean releaseMatchedDrivers = simulationConfig.getDispatcher().isReleaseMatchedDrivers();
        Dispatcher dispatcher = new Dispatcher(dispatchAlgorithm, releaseMatchedDrivers);
        SimulationContext context = new SimulationContext(dispatcher, new ActivityMonitor(),
                new SimulationEventLog(simulationConfig.getEventLogCapacity()));
        for (SimEvent event : initialEvents) {
            scheduleEvent(context, event);
        }
        log.info("仿真 {} 已创建: 初始事件数={}, 派单后释放司机={}",
                context.getSimulationId(), initialEvents.size(), releaseMatchedDrivers);
        return context;
    }

    // 注入新事件
    public void scheduleEvent(SimulationContext context, SimEvent event) {
        if (event.getTimestamp() < context.getSimTime()) {
            throw new IllegalArgumentException(String.format("不能调度早于当前仿真时间的事件: eventTime=%d, simTime=%d",
                    event.getTimestamp(), context.getSimTime()));
        }
        context.getEventQueue().add(event);
    }

    /**
     * 处理下一个事件（单事件推进）
     *
     * @return 所处理事件的日志条目，如果没有事件则返回null
     */
    public EventLogEntryDto stepNextEvent(SimulationContext context) {
        EventQueue queue = context.getEventQueue();
        if (queue.isEmpty()) {
            return null;
        }
        return processEvent(context, queue.removeMin());
    }

    /**
     * 推进仿真到指定时间：处理所有时间戳不晚于目标时间的事件，然后将时钟拨到目标时间
     */
    public void runUntil(SimulationContext context, long targetSimTime) {
        drain(context, targetSimTime);
        if (targetSimTime > context.getSimTime()) {
            context.setSimTime(targetSimTime);
        }
    }

    /**
     * 运行仿真直到事件队列为空，返回监控器的统计报告
     */
    public SimulationReport run(SimulationContext context) {
        drain(context, Long.MAX_VALUE);
        log.info("仿真 {} 运行结束: 最终时间={}, 处理事件数={}",
                context.getSimulationId(), context.getSimTime(), context.getProcessedEventCount());
        log.debug("派单状态:\n{}", context.getDispatcher());
        return context.getMonitor().report();
    }

    private void drain(SimulationContext context, long targetSimTime) {
        EventQueue queue = context.getEventQueue();
        int sameTimeEventCount = 0;
        long lastProcessedTime = -1L;
        int maxEventsPerTimestamp = simulationConfig.getMaxEventsPerTimestamp();

        while (!queue.isEmpty()) {
            SimEvent nextEvent = queue.peek();
            if (nextEvent.getTimestamp() > targetSimTime) {
                break;
            }

            // 死循环检测：检查同一时间戳的事件数量，阈值未配置时不检测
            if (nextEvent.getTimestamp() == lastProcessedTime) {
                sameTimeEventCount++;
                if (maxEventsPerTimestamp > 0 && sameTimeEventCount > maxEventsPerTimestamp) {
                    String errorMsg = String.format("仿真死循环检测: 时间戳 %d 已处理 %d 个事件，超过阈值 %d",
                            lastProcessedTime, sameTimeEventCount, maxEventsPerTimestamp);
                    errorLog.recordDeadLoopError(context.getSimulationId(), lastProcessedTime,
                            sameTimeEventCount, maxEventsPerTimestamp, errorMsg);
                    throw new SimulationDeadLoopException(errorMsg, lastProcessedTime, sameTimeEventCount);
                }
            } else {
                lastProcessedTime = nextEvent.getTimestamp();
                sameTimeEventCount = 1;
            }

            processEvent(context, queue.removeMin());
        }
    }

    /**
     * 处理单个事件：推进时钟、执行处理器、回填新事件、记录日志
     */
    private EventLogEntryDto processEvent(SimulationContext context, SimEvent event) {
        context.setSimTime(event.getTimestamp());
        log.debug("处理事件: {}", event);

        SimEventHandler handler = handlerMap.get(event.getType());
        if (handler == null) {
            throw new IllegalStateException("事件类型 " + event.getType() + " 没有对应的处理器");
        }

        List<SimEvent> spawned;
        try {
            spawned = handler.handle(event, context.getDispatcher(), context.getMonitor());
        } catch (RuntimeException e) {
            String errorMsg = String.format("事件处理异常: Type=%s, Id=%s, Time=%d",
                    event.getType(), event.getEventId(), event.getTimestamp());
            errorLog.recordEventProcessingError(context.getSimulationId(), event.getEventId(), event.getType(),
                    event.getTimestamp(), errorMsg, e);
            log.error(errorMsg, e);
            throw new EventProcessingException(errorMsg, event.getEventId(), event.getType(),
                    event.getTimestamp(), e);
        }

        for (SimEvent child : spawned) {
            scheduleEvent(context, child);
        }
        context.incrementProcessedEventCount();

        EventLogEntryDto logEntry = toLogEntry(event, spawned.size());
        context.getEventLog().append(logEntry);
        return logEntry;
    }

    private static EventLogEntryDto toLogEntry(SimEvent event, int spawnedCount) {
        EventLogEntryDto logEntry = new EventLogEntryDto();
        logEntry.setSimTime(event.getTimestamp());
        logEntry.setType(event.getType());
        logEntry.setEventId(event.getEventId());
        logEntry.setParentEventId(event.getParentEventId());
        logEntry.setRiderId(event.getRider() != null ? event.getRider().getIdentifier() : null);
        logEntry.setDriverId(event.getDriver() != null ? event.getDriver().getIdentifier() : null);
        logEntry.setDescription(event.toString());
        logEntry.setSpawnedCount(spawnedCount);
        return logEntry;
    }

    /**
     * 乘客叫车
     * 有空闲司机则司机出发接人并安排上车事件；无论是否派到车，都在耐心耗尽时安排取消事件
     */
    @Component
    public static class RiderRequestHandler implements SimEventHandler {

        @Override
        public EventTypeEnum getType() {
            return EventTypeEnum.RIDER_REQUEST;
        }

        @Override
        public List<SimEvent> handle(SimEvent event, Dispatcher dispatcher, SimulationMonitor monitor) {
            Rider rider = event.getRider();
            long now = event.getTimestamp();
            monitor.notify(now, ActorTypeEnum.RIDER, ActivityTypeEnum.REQUEST, rider.getIdentifier(), rider.getOrigin());

            List<SimEvent> events = new ArrayList<>(2);
            Driver driver = dispatcher.requestDriver(rider);
            if (driver != null) {
                long travelTime = driver.startDrive(rider.getOrigin());
                events.add(SimEvent.pickup(event.getEventId(), now + travelTime, rider, driver));
            } else {
                log.debug("乘客 {} 暂无空闲司机，进入等待", rider.getIdentifier());
            }
            events.add(SimEvent.cancellation(event.getEventId(), now + rider.getPatience(), rider));
            return events;
        }
    }

    /**
     * 司机接单
     * 首次接单时完成登记；有等待中的乘客则出发接人
     */
    @Component
    public static class DriverRequestHandler implements SimEventHandler {

        @Override
        public EventTypeEnum getType() {
            return EventTypeEnum.DRIVER_REQUEST;
        }

        @Override
        public List<SimEvent> handle(SimEvent event, Dispatcher dispatcher, SimulationMonitor monitor) {
            Driver driver = event.getDriver();
            long now = event.getTimestamp();
            monitor.notify(now, ActorTypeEnum.DRIVER, ActivityTypeEnum.REQUEST, driver.getIdentifier(), driver.getLocation());

            Rider rider = dispatcher.requestRider(driver);
            if (rider == null) {
                return Collections.emptyList();
            }
            long travelTime = driver.startDrive(rider.getOrigin());
            return List.of(SimEvent.pickup(event.getEventId(), now + travelTime, rider, driver));
        }
    }

    /**
     * 乘客取消 已被接到的乘客不受影响
     */
    @Component
    public static class CancellationHandler implements SimEventHandler {

        @Override
        public EventTypeEnum getType() {
            return EventTypeEnum.CANCELLATION;
        }

        @Override
        public List<SimEvent> handle(SimEvent event, Dispatcher dispatcher, SimulationMonitor monitor) {
            Rider rider = event.getRider();
            monitor.notify(event.getTimestamp(), ActorTypeEnum.RIDER, ActivityTypeEnum.CANCEL,
                    rider.getIdentifier(), rider.getOrigin());

            if (!dispatcher.isSatisfied(rider)) {
                rider.markCancelled();
                dispatcher.cancelRide(rider);
                log.debug("乘客 {} 等待超时，已取消", rider.getIdentifier());
            }
            return Collections.emptyList();
        }
    }

    /**
     * 司机到达上车点
     * 乘客未取消则载客前往目的地；已取消则司机原地重新接单
     */
    @Component
    public static class PickupHandler implements SimEventHandler {

        @Override
        public EventTypeEnum getType() {
            return EventTypeEnum.PICKUP;
        }

        @Override
        public List<SimEvent> handle(SimEvent event, Dispatcher dispatcher, SimulationMonitor monitor) {
            Rider rider = event.getRider();
            Driver driver = event.getDriver();
            long now = event.getTimestamp();

            driver.endDrive();
            monitor.notify(now, ActorTypeEnum.RIDER, ActivityTypeEnum.PICKUP, rider.getIdentifier(), rider.getDestination());
            monitor.notify(now, ActorTypeEnum.DRIVER, ActivityTypeEnum.PICKUP, driver.getIdentifier(), driver.getLocation());

            if (dispatcher.isCancelled(rider)) {
                log.debug("司机 {} 到达时乘客 {} 已取消，重新接单", driver.getIdentifier(), rider.getIdentifier());
                return List.of(SimEvent.driverRequest(event.getEventId(), now, driver));
            }
            long travelTime = driver.startRide(rider);
            rider.markSatisfied();
            dispatcher.endSuccessfulRide(rider);
            return List.of(SimEvent.dropoff(event.getEventId(), now + travelTime, rider, driver));
        }
    }

    /**
     * 司机送达乘客，恢复空闲并重新接单
     */
    @Component
    public static class DropoffHandler implements SimEventHandler {

        @Override
        public EventTypeEnum getType() {
            return EventTypeEnum.DROPOFF;
        }

        @Override
        public List<SimEvent> handle(SimEvent event, Dispatcher dispatcher, SimulationMonitor monitor) {
            Rider rider = event.getRider();
            Driver driver = event.getDriver();
            long now = event.getTimestamp();

            driver.endRide();
            monitor.notify(now, ActorTypeEnum.DRIVER, ActivityTypeEnum.DROPOFF, driver.getIdentifier(), driver.getLocation());
            dispatcher.endSuccessfulRide(rider);
            return List.of(SimEvent.driverRequest(event.getEventId(), now, driver));
        }
    }
}
