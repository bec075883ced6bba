package service.monitor.impl;

import common.consts.ActivityTypeEnum;
import common.consts.ActorTypeEnum;
import common.consts.ErrorCodes;
import common.exception.StatisticsUnavailableException;
import common.util.GridUtil;
import model.bo.Activity;
import model.dto.response.SimulationReport;
import model.entity.Location;
import service.monitor.SimulationMonitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按主体记录活动的监控器
 * 结构：主体类型 -> 主体ID -> 按通知顺序排列的活动
 */
public class ActivityMonitor implements SimulationMonitor {

    private final Map<ActorTypeEnum, Map<String, List<Activity>>> activities = new EnumMap<>(ActorTypeEnum.class);

    public ActivityMonitor() {
        for (ActorTypeEnum actorType : ActorTypeEnum.values()) {
            activities.put(actorType, new LinkedHashMap<>());
        }
    }

    @Override
    public void notify(long timestamp, ActorTypeEnum actorType, ActivityTypeEnum activityType,
                       String identifier, Location location) {
        activities.get(actorType)
                .computeIfAbsent(identifier, id -> new ArrayList<>())
                .add(new Activity(timestamp, actorType, activityType, identifier, location));
    }

    @Override
    public SimulationReport report() {
        return new SimulationReport(averageWaitTime(), averageTotalDistance(), averageRideDistance());
    }

    /**
     * 某个主体的全部活动，未记录过时返回空列表
     */
    public List<Activity> getActivities(ActorTypeEnum actorType, String identifier) {
        List<Activity> list = activities.get(actorType).get(identifier);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public int getDriverCount() {
        return activities.get(ActorTypeEnum.DRIVER).size();
    }

    public int getRiderCount() {
        return activities.get(ActorTypeEnum.RIDER).size();
    }

    /**
     * 已上车或已取消乘客的平均等待时间
     * 第一条活动是叫车，第二条是上车或取消
     */
    double averageWaitTime() {
        long waitTime = 0L;
        int count = 0;
        for (List<Activity> riderActivities : activities.get(ActorTypeEnum.RIDER).values()) {
            if (riderActivities.size() >= 2) {
                waitTime += riderActivities.get(1).getTimestamp() - riderActivities.get(0).getTimestamp();
                count++;
            }
        }
        if (count == 0) {
            throw new StatisticsUnavailableException("rider_wait_time", ErrorCodes.NO_FINISHED_RIDER);
        }
        return (double) waitTime / count;
    }

    /**
     * 至少有两条活动的司机的平均行驶距离，按相邻活动位置累加
     */
    double averageTotalDistance() {
        long totalDistance = 0L;
        int count = 0;
        for (List<Activity> driverActivities : activities.get(ActorTypeEnum.DRIVER).values()) {
            if (driverActivities.size() >= 2) {
                for (int i = 0; i < driverActivities.size() - 1; i++) {
                    totalDistance += GridUtil.manhattanDistance(driverActivities.get(i).getLocation(),
                            driverActivities.get(i + 1).getLocation());
                }
                count++;
            }
        }
        if (count == 0) {
            throw new StatisticsUnavailableException("driver_total_distance", ErrorCodes.NO_MOVING_DRIVER);
        }
        return (double) totalDistance / count;
    }

    /**
     * 载客距离：相邻的 上车 -> 下车 活动之间的距离，按全部司机平均
     */
    double averageRideDistance() {
        Map<String, List<Activity>> drivers = activities.get(ActorTypeEnum.DRIVER);
        long rideDistance = 0L;
        for (List<Activity> driverActivities : drivers.values()) {
            for (int i = 0; i < driverActivities.size() - 1; i++) {
                Activity current = driverActivities.get(i);
                Activity next = driverActivities.get(i + 1);
                if (current.getActivityType() == ActivityTypeEnum.PICKUP
                        && next.getActivityType() == ActivityTypeEnum.DROPOFF) {
                    rideDistance += GridUtil.manhattanDistance(current.getLocation(), next.getLocation());
                }
            }
        }
        if (drivers.isEmpty()) {
            throw new StatisticsUnavailableException("driver_ride_distance", ErrorCodes.NO_DRIVER);
        }
        return (double) rideDistance / drivers.size();
    }

    @Override
    public String toString() {
        return String.format("Monitor (%d drivers, %d riders)", getDriverCount(), getRiderCount());
    }
}
