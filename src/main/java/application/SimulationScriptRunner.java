package application;

import common.config.SimulationConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import model.dto.response.SimulationReport;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import service.SimulationService;

import java.nio.file.Path;

/**
 * 启动时按 ride.sim.script 指定的脚本跑完一次仿真并输出报告
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "ride.sim", name = "script")
public class SimulationScriptRunner implements ApplicationRunner {

    private final SimulationService simulationService;
    private final SimulationConfig simulationConfig;

    @Getter
    private SimulationReport lastReport;

    public SimulationScriptRunner(SimulationService simulationService, SimulationConfig simulationConfig) {
        this.simulationService = simulationService;
        this.simulationConfig = simulationConfig;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path script = Path.of(simulationConfig.getScript());
        log.info("开始运行仿真脚本: {}", script.toAbsolutePath());
        lastReport = simulationService.runScript(script);
        log.info("仿真结束 rider_wait_time={} driver_total_distance={} driver_ride_distance={}",
                lastReport.getRiderWaitTime(), lastReport.getDriverTotalDistance(), lastReport.getDriverRideDistance());
    }
}
