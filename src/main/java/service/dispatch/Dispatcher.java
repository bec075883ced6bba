package service.dispatch;

import lombok.extern.slf4j.Slf4j;
import model.entity.Driver;
import model.entity.Rider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 派单员
 * 乘客叫车时为其指派最近的空闲司机，没有空闲司机则留在等待列表；
 * 司机接单时登记该司机，并把等待最久的乘客交给他。
 *
 * 乘客与司机均按 identifier 记账。每个仿真独占一个 Dispatcher 实例。
 */
@Slf4j
public class Dispatcher {

    private final DispatchAlgorithm dispatchAlgorithm;
    private final boolean releaseMatchedDrivers;

    //  乘客分区 三者互斥
    private final Map<String, Rider> waitingRiders = new LinkedHashMap<>();
    private final Map<String, Rider> cancelledRiders = new LinkedHashMap<>();
    private final Map<String, Rider> satisfiedRiders = new LinkedHashMap<>();

    //  司机分区 idle 是 total 的子集
    private final Map<String, Driver> idleDrivers = new LinkedHashMap<>();
    private final Map<String, Driver> totalDrivers = new LinkedHashMap<>();

    /**
     * @param dispatchAlgorithm     选车算法
     * @param releaseMatchedDrivers 派单后是否立即将司机移出空闲列表
     */
    public Dispatcher(DispatchAlgorithm dispatchAlgorithm, boolean releaseMatchedDrivers) {
        this.dispatchAlgorithm = dispatchAlgorithm;
        this.releaseMatchedDrivers = releaseMatchedDrivers;
    }

    /**
     * 为乘客找司机
     * 乘客总是先进入等待列表，直到被接到或取消才移出。
     * 司机的 idle 标记不由这里修改，由调用方在司机出发时设置。
     *
     * @return 耗时最短的空闲司机，没有则返回 null
     */
    public Driver requestDriver(Rider rider) {
        waitingRiders.putIfAbsent(rider.getIdentifier(), rider);

        Driver driver = dispatchAlgorithm.selectDriver(rider, idleDrivers.values());
        if (driver != null && releaseMatchedDrivers) {
            idleDrivers.remove(driver.getIdentifier());
        }
        if (driver != null) {
            log.debug("乘客 {} 匹配到司机 {}", rider.getIdentifier(), driver.getIdentifier());
        }
        return driver;
    }

    /**
     * 为司机找乘客
     * 新司机登记到总表，空闲则同时加入空闲列表。返回等待最久的乘客，但不把他移出等待列表。
     *
     * @return 等待列表队首的乘客，没有则返回 null
     */
    public Rider requestRider(Driver driver) {
        String driverId = driver.getIdentifier();
        Driver registered = totalDrivers.get(driverId);
        if (registered == null) {
            totalDrivers.put(driverId, driver);
            if (driver.isIdle()) {
                idleDrivers.put(driverId, driver);
            }
            log.debug("司机 {} 完成登记", driverId);
        } else if (releaseMatchedDrivers && registered.getDestination() == null) {
            // 没有目的地的已登记司机重新回到空闲列表
            idleDrivers.putIfAbsent(driverId, registered);
        }

        if (waitingRiders.isEmpty()) {
            return null;
        }
        Rider rider = waitingRiders.values().iterator().next();
        if (releaseMatchedDrivers) {
            idleDrivers.remove(driverId);
        }
        return rider;
    }

    /**
     * 取消等待中的乘客；已接到或已取消的乘客不受影响
     */
    public void cancelRide(Rider rider) {
        Rider removed = waitingRiders.remove(rider.getIdentifier());
        if (removed != null) {
            cancelledRiders.put(removed.getIdentifier(), removed);
        }
    }

    /**
     * 等待中的乘客被成功接到；其他状态的乘客不受影响
     */
    public void endSuccessfulRide(Rider rider) {
        Rider removed = waitingRiders.remove(rider.getIdentifier());
        if (removed != null) {
            satisfiedRiders.put(removed.getIdentifier(), removed);
        }
    }

    public boolean isWaiting(Rider rider) {
        return waitingRiders.containsKey(rider.getIdentifier());
    }

    public boolean isCancelled(Rider rider) {
        return cancelledRiders.containsKey(rider.getIdentifier());
    }

    public boolean isSatisfied(Rider rider) {
        return satisfiedRiders.containsKey(rider.getIdentifier());
    }

    public boolean isRegistered(Driver driver) {
        return totalDrivers.containsKey(driver.getIdentifier());
    }

    public boolean isIdle(Driver driver) {
        return idleDrivers.containsKey(driver.getIdentifier());
    }

    public List<Rider> getWaitingRiders() {
        return snapshot(waitingRiders);
    }

    public List<Rider> getCancelledRiders() {
        return snapshot(cancelledRiders);
    }

    public List<Rider> getSatisfiedRiders() {
        return snapshot(satisfiedRiders);
    }

    public List<Driver> getIdleDrivers() {
        return snapshot(idleDrivers);
    }

    public List<Driver> getTotalDrivers() {
        return snapshot(totalDrivers);
    }

    private static <T> List<T> snapshot(Map<String, T> partition) {
        return Collections.unmodifiableList(new ArrayList<>(partition.values()));
    }

    @Override
    public String toString() {
        return "rider's statuses:\n"
                + " - waiting riders: " + waitingRiders.keySet() + "\n"
                + " - cancelled requests: " + cancelledRiders.keySet() + "\n"
                + " - satisfied riders: " + satisfiedRiders.keySet() + "\n"
                + "driver's statuses:\n"
                + " - idle drivers: " + idleDrivers.keySet() + "\n"
                + " - total drivers: " + totalDrivers.keySet();
    }
}
