package controller;

import common.Result;
import model.dto.snapshot.EventLogEntryDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.SimulationService;

import java.util.List;

/**
 * 仿真事件日志查询接口
 */
@RestController
@RequestMapping("/sim/events")
public class SimEventController {

    private final SimulationService simulationService;

    public SimEventController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    /**
     * 查询指定仿真时间之后处理的事件
     */
    @GetMapping
    public Result listEvents(@RequestParam(name = "since", defaultValue = "0") long sinceSimTime) {
        List<EventLogEntryDto> entries = simulationService.listEvents(sinceSimTime);
        return Result.success("查询成功", entries);
    }
}
