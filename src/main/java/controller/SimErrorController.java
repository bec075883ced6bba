package controller;

import common.Result;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.log.SimulationErrorLog;

import java.util.List;

/**
 * 仿真错误日志查询接口
 */
@RestController
@RequestMapping("/sim/errors")
public class SimErrorController {

    private final SimulationErrorLog errorLog;

    public SimErrorController(SimulationErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    @GetMapping
    public Result listErrors(@RequestParam(name = "since", defaultValue = "0") long sinceSimTime) {
        List<SimulationErrorLog.ErrorLogEntry> entries = errorLog.listSince(sinceSimTime);
        return Result.success("查询成功", entries);
    }

    @GetMapping("/all")
    public Result listAllErrors() {
        return Result.success("查询成功", errorLog.listAll());
    }
}
