package service.monitor;

import common.consts.ActivityTypeEnum;
import common.consts.ActorTypeEnum;
import model.dto.response.SimulationReport;
import model.entity.Location;

/**
 * 仿真监控器：接收事件处理过程中的活动通知，并据此生成统计报告
 */
public interface SimulationMonitor {

    void notify(long timestamp, ActorTypeEnum actorType, ActivityTypeEnum activityType,
                String identifier, Location location);

    /**
     * @throws common.exception.StatisticsUnavailableException 某项统计没有可用数据
     */
    SimulationReport report();
}
