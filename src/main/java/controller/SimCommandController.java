package controller;

import common.Result;
import model.dto.response.SimulationReport;
import model.dto.snapshot.EventLogEntryDto;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.SimulationService;

/**
 * 仿真推进控制器
 */
@RestController
@RequestMapping("/sim/command")
public class SimCommandController {

    private final SimulationService simulationService;

    public SimCommandController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    /**
     * 单事件推进：处理下一个事件
     */
    @PostMapping("/step/next-event")
    public Result stepNextEvent() {
        EventLogEntryDto event = simulationService.stepNextEvent();
        if (event == null) {
            return Result.success("没有待处理的事件", null);
        }
        return Result.success("事件处理成功", event);
    }

    /**
     * 推进到指定仿真时间
     */
    @PostMapping("/run-until")
    public Result runUntil(@RequestParam("time") long time) {
        simulationService.runUntil(time);
        return Result.success();
    }

    /**
     * 跑完全部事件并返回统计报告
     */
    @PostMapping("/run")
    public Result run() {
        SimulationReport report = simulationService.run();
        return Result.success("仿真运行完成", report);
    }
}
