package service.dispatch.impl;

import model.entity.Driver;
import model.entity.Rider;
import org.springframework.stereotype.Component;
import service.dispatch.DispatchAlgorithm;

import java.util.Collection;

/**
 * 最近司机优先
 * 选择到乘客上车点耗时最短的司机，耗时相同取登记最早的
 */
@Component
public class NearestDriverAlgorithm implements DispatchAlgorithm {

    @Override
    public Driver selectDriver(Rider rider, Collection<Driver> candidates) {
        Driver best = null;
        long bestTime = Long.MAX_VALUE;
        for (Driver driver : candidates) {
            long time = driver.getTravelTime(rider.getOrigin());
            // 严格小于 保留先出现的司机
            if (time < bestTime) {
                best = driver;
                bestTime = time;
            }
        }
        return best;
    }
}
