package engine;

import common.consts.EventTypeEnum;
import lombok.Getter;
import model.entity.Driver;
import model.entity.Rider;

import java.util.UUID;

/**
 * 仿真事件
 * 事件构造后不可变，处理事件不会修改事件本身；按 type 分派到对应的 {@link SimEventHandler}
 */
@Getter
public final class SimEvent {
    private final String eventId;         // 本次事件唯一标识
    private final String parentEventId;   // 触发本事件的上游事件ID，初始事件为 null
    private final long timestamp;         // 事件发生的仿真时间
    private final EventTypeEnum type;     // 事件类型

    // 事件负载 按类型携带乘客、司机或两者
    private final Rider rider;
    private final Driver driver;

    private SimEvent(String parentEventId, long timestamp, EventTypeEnum type, Rider rider, Driver driver) {
        if (timestamp < 0) {
            throw new IllegalArgumentException("事件时间戳不能为负: " + timestamp);
        }
        this.eventId = UUID.randomUUID().toString();
        this.parentEventId = parentEventId;
        this.timestamp = timestamp;
        this.type = type;
        this.rider = rider;
        this.driver = driver;
    }

    public static SimEvent riderRequest(long timestamp, Rider rider) {
        return riderRequest(null, timestamp, rider);
    }

    public static SimEvent riderRequest(String parentEventId, long timestamp, Rider rider) {
        return new SimEvent(parentEventId, timestamp, EventTypeEnum.RIDER_REQUEST, require(rider, "rider"), null);
    }

    public static SimEvent driverRequest(long timestamp, Driver driver) {
        return driverRequest(null, timestamp, driver);
    }

    public static SimEvent driverRequest(String parentEventId, long timestamp, Driver driver) {
        return new SimEvent(parentEventId, timestamp, EventTypeEnum.DRIVER_REQUEST, null, require(driver, "driver"));
    }

    public static SimEvent cancellation(String parentEventId, long timestamp, Rider rider) {
        return new SimEvent(parentEventId, timestamp, EventTypeEnum.CANCELLATION, require(rider, "rider"), null);
    }

    public static SimEvent pickup(String parentEventId, long timestamp, Rider rider, Driver driver) {
        return new SimEvent(parentEventId, timestamp, EventTypeEnum.PICKUP,
                require(rider, "rider"), require(driver, "driver"));
    }

    public static SimEvent dropoff(String parentEventId, long timestamp, Rider rider, Driver driver) {
        return new SimEvent(parentEventId, timestamp, EventTypeEnum.DROPOFF,
                require(rider, "rider"), require(driver, "driver"));
    }

    private static <T> T require(T payload, String name) {
        if (payload == null) {
            throw new IllegalArgumentException("事件负载缺失: " + name);
        }
        return payload;
    }

    @Override
    public String toString() {
        switch (type) {
            case RIDER_REQUEST:
                return timestamp + " -- " + rider + ": Request a driver";
            case DRIVER_REQUEST:
                return timestamp + " -- " + driver + ": Request a rider";
            case CANCELLATION:
                return timestamp + " -- " + rider + ": Cancellation by rider";
            case PICKUP:
                return timestamp + " -- " + driver + " -- " + rider + ": Pick up time by driver of rider";
            case DROPOFF:
                return timestamp + " -- " + driver + " -- " + rider + ": Dropoff time by driver of rider";
            default:
                return timestamp + " -- " + type;
        }
    }
}
