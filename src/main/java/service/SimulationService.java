package service;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import engine.SimEvent;
import engine.SimulationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.bo.SimulationContext;
import model.dto.response.SimulationReport;
import model.dto.snapshot.DriverSnapshotDto;
import model.dto.snapshot.EventLogEntryDto;
import model.dto.snapshot.RiderSnapshotDto;
import model.dto.snapshot.SimulationSnapshotDto;
import model.entity.Driver;
import model.entity.Rider;
import org.springframework.stereotype.Service;
import service.dispatch.Dispatcher;
import service.log.SimulationErrorLog;
import service.script.EventScriptParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 仿真服务
 * 持有当前仿真上下文，串行化所有来自接口的操作
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SimulationService {

    private final SimulationEngine engine;
    private final EventScriptParser scriptParser;
    private final SimulationErrorLog errorLog;

    private SimulationContext current;

    /**
     * 解析脚本并以其初始事件开始新的仿真，旧仿真被丢弃
     */
    public synchronized SimulationContext load(String script) {
        return load(scriptParser.parse(script));
    }

    public synchronized SimulationContext load(List<SimEvent> initialEvents) {
        errorLog.clear();
        current = engine.createContext(initialEvents);
        return current;
    }

    /**
     * 从文件装载并一次跑完，返回统计报告
     */
    public synchronized SimulationReport runScript(Path scriptPath) {
        load(scriptParser.parse(scriptPath));
        return run();
    }

    public synchronized void reset() {
        if (current != null) {
            log.info("仿真 {} 已丢弃", current.getSimulationId());
        }
        current = null;
        errorLog.clear();
    }

    /**
     * @return 所处理事件的日志，没有更多事件时返回 null
     */
    public synchronized EventLogEntryDto stepNextEvent() {
        return engine.stepNextEvent(requireContext());
    }

    public synchronized void runUntil(long targetSimTime) {
        engine.runUntil(requireContext(), targetSimTime);
    }

    public synchronized SimulationReport run() {
        return engine.run(requireContext());
    }

    public synchronized SimulationReport report() {
        return requireContext().getMonitor().report();
    }

    public synchronized List<EventLogEntryDto> listEvents(long sinceSimTime) {
        return requireContext().getEventLog().listSince(sinceSimTime);
    }

    public synchronized boolean isLoaded() {
        return current != null;
    }

    /**
     * 组装当前仿真的状态快照
     */
    public synchronized SimulationSnapshotDto snapshot() {
        SimulationContext context = requireContext();
        Dispatcher dispatcher = context.getDispatcher();

        SimulationSnapshotDto snapshot = new SimulationSnapshotDto();
        snapshot.setSimulationId(context.getSimulationId());
        snapshot.setSimTime(context.getSimTime());
        snapshot.setPendingEventCount(context.getEventQueue().size());
        snapshot.setProcessedEventCount(context.getProcessedEventCount());

        snapshot.setWaitingRiders(riderIds(dispatcher.getWaitingRiders()));
        snapshot.setCancelledRiders(riderIds(dispatcher.getCancelledRiders()));
        snapshot.setSatisfiedRiders(riderIds(dispatcher.getSatisfiedRiders()));
        snapshot.setIdleDrivers(driverIds(dispatcher.getIdleDrivers()));
        snapshot.setTotalDrivers(driverIds(dispatcher.getTotalDrivers()));

        snapshot.setDrivers(dispatcher.getTotalDrivers().stream().map(driver -> {
            DriverSnapshotDto dto = new DriverSnapshotDto();
            dto.setIdentifier(driver.getIdentifier());
            dto.setLocation(driver.getLocation());
            dto.setDestination(driver.getDestination());
            dto.setSpeed(driver.getSpeed());
            dto.setIdle(driver.isIdle());
            dto.setInIdlePool(dispatcher.isIdle(driver));
            return dto;
        }).collect(Collectors.toList()));

        // 三个分区互斥，合并即全部已叫车乘客
        List<Rider> riders = new ArrayList<>(dispatcher.getWaitingRiders());
        riders.addAll(dispatcher.getCancelledRiders());
        riders.addAll(dispatcher.getSatisfiedRiders());
        snapshot.setRiders(riders.stream().map(rider -> {
            RiderSnapshotDto dto = new RiderSnapshotDto();
            dto.setIdentifier(rider.getIdentifier());
            dto.setOrigin(rider.getOrigin());
            dto.setDestination(rider.getDestination());
            dto.setPatience(rider.getPatience());
            dto.setStatus(rider.getStatus());
            return dto;
        }).collect(Collectors.toList()));

        return snapshot;
    }

    private SimulationContext requireContext() {
        if (current == null) {
            throw new BusinessException(ErrorCodes.SIMULATION_NOT_LOADED);
        }
        return current;
    }

    private static List<String> riderIds(List<Rider> riders) {
        return riders.stream().map(Rider::getIdentifier).collect(Collectors.toList());
    }

    private static List<String> driverIds(List<Driver> drivers) {
        return drivers.stream().map(Driver::getIdentifier).collect(Collectors.toList());
    }
}
