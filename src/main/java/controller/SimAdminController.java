package controller;

import common.Result;
import model.bo.SimulationContext;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import service.SimulationService;

import java.util.HashMap;
import java.util.Map;

/**
 * 仿真场景管理接口：重置与装载
 */
@RestController
@RequestMapping("/sim/admin")
public class SimAdminController {

    private final SimulationService simulationService;

    public SimAdminController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    /**
     * 丢弃当前仿真
     */
    @PostMapping("/reset")
    public Result reset() {
        simulationService.reset();
        return Result.success("重置成功", null);
    }

    /**
     * 以事件脚本装载新场景
     */
    @PostMapping(value = "/load", consumes = MediaType.TEXT_PLAIN_VALUE)
    public Result load(@RequestBody String script) {
        SimulationContext context = simulationService.load(script);
        Map<String, Object> result = new HashMap<>();
        result.put("simulationId", context.getSimulationId());
        result.put("pendingEventCount", context.getEventQueue().size());
        return Result.success("场景装载成功", result);
    }
}
