package model.entity;

import common.util.GridUtil;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 司机实体
 * 空闲司机没有目的地；行驶中的司机一定有目的地
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Driver {

    @EqualsAndHashCode.Include
    private final String identifier;  // 司机ID
    private final int speed;          // 每个时间单位行驶的格数，0 表示瞬时到达

    private Location location;        // 当前位置
    private Location destination;     // 当前目的地，空闲或刚到达时为 null
    private boolean idle = true;

    public Driver(String identifier, Location location, int speed) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("司机ID不能为空");
        }
        if (location == null) {
            throw new IllegalArgumentException(String.format("司机 [%s] 的位置不能为空", identifier));
        }
        if (speed < 0) {
            throw new IllegalArgumentException(String.format("司机 [%s] 的速度不能为负: %d", identifier, speed));
        }
        this.identifier = identifier;
        this.location = location;
        this.speed = speed;
    }

    /**
     * 从当前位置到目标点所需的时间
     */
    public long getTravelTime(Location target) {
        return GridUtil.travelTime(location, target, speed);
    }

    /**
     * 开始驶向接客点，返回行驶耗时
     */
    public long startDrive(Location target) {
        long time = getTravelTime(target);
        this.idle = false;
        this.destination = target;
        return time;
    }

    /**
     * 到达接客点 司机仍处于非空闲状态，等待开始载客或重新接单
     */
    public void endDrive() {
        requireDestination("结束接驾");
        this.location = destination;
        this.destination = null;
        this.idle = false;
    }

    /**
     * 载上乘客驶向其目的地，返回行驶耗时
     */
    public long startRide(Rider rider) {
        long time = getTravelTime(rider.getDestination());
        this.idle = false;
        this.destination = rider.getDestination();
        return time;
    }

    /**
     * 到达乘客目的地，司机恢复空闲
     */
    public void endRide() {
        requireDestination("结束行程");
        this.location = destination;
        this.destination = null;
        this.idle = true;
    }

    private void requireDestination(String action) {
        if (destination == null) {
            throw new IllegalStateException(String.format("司机 [%s] %s失败: 当前没有目的地", identifier, action));
        }
    }

    @Override
    public String toString() {
        return String.format("ID: %s, Location: %s, Speed: %d", identifier, location, speed);
    }
}
