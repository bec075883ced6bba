package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 仿真运行配置
 * 与调度策略、日志容量、死循环保护相关的参数统一从这里管理，可以通过 Spring 配置文件覆盖：
 *
 * ride.sim.max-events-per-timestamp
 * ride.sim.event-log-capacity
 * ride.sim.dispatcher.release-matched-drivers
 * ride.sim.script
 */
@Configuration
@ConfigurationProperties(prefix = "ride.sim")
@Data
public class SimulationConfig {

    /**
     * 单一时间戳下允许处理的最大事件数量，用于排查自定义处理器引入的死循环
     * 小于等于 0 表示不限制；内置处理器在同一时刻产生的事件总是有限的
     */
    private int maxEventsPerTimestamp = 0;

    /**
     * 每个仿真保留的最近事件日志条数
     */
    private int eventLogCapacity = 1000;

    /**
     * 启动时自动运行的事件脚本路径，为空则不运行
     */
    private String script;

    /**
     * 派单相关配置
     */
    private DispatcherProperties dispatcher = new DispatcherProperties();

    @Data
    public static class DispatcherProperties {

        /**
         * true：派单成功后司机立即移出空闲列表，空闲后再次接单时重新加入
         * false：与原始行为一致，已派单司机仍留在空闲列表中，可能被重复派单
         */
        private boolean releaseMatchedDrivers = true;
    }
}
