package controller;

import common.Result;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import service.SimulationService;

/**
 * 仿真状态查询接口
 */
@RestController
@RequestMapping("/sim/state")
public class SimStateController {

    private final SimulationService simulationService;

    public SimStateController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    /**
     * 当前仿真的完整快照
     */
    @GetMapping("/snapshot")
    public Result getSnapshot() {
        return Result.success("查询成功", simulationService.snapshot());
    }

    /**
     * 当前统计报告 数据不足时返回错误信息
     */
    @GetMapping("/report")
    public Result getReport() {
        return Result.success("查询成功", simulationService.report());
    }
}
