package service.dispatch;

import model.entity.Driver;
import model.entity.Rider;

import java.util.Collection;

/**
 * 派单算法接口
 * 从候选司机中为乘客挑选一名司机，替换实现即可接管选车逻辑
 */
public interface DispatchAlgorithm {
    /**
     * @param rider      叫车的乘客
     * @param candidates 空闲司机，按登记顺序迭代
     * @return 选中的司机，没有候选时返回 null
     */
    Driver selectDriver(Rider rider, Collection<Driver> candidates);
}
