package model.entity;

import common.consts.RiderStatusEnum;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 乘客实体
 * 派单记账只按 identifier 判等，状态变化不影响身份
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Rider {

    @EqualsAndHashCode.Include
    private final String identifier;     // 乘客ID
    private final Location origin;       // 上车点
    private final Location destination;  // 目的地
    private final long patience;         // 最多等待的仿真时长

    private RiderStatusEnum status = RiderStatusEnum.WAITING;

    public Rider(String identifier, Location origin, Location destination, long patience) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("乘客ID不能为空");
        }
        if (origin == null || destination == null) {
            throw new IllegalArgumentException(String.format("乘客 [%s] 的上车点和目的地不能为空", identifier));
        }
        if (patience < 0) {
            throw new IllegalArgumentException(String.format("乘客 [%s] 的耐心值不能为负: %d", identifier, patience));
        }
        this.identifier = identifier;
        this.origin = origin;
        this.destination = destination;
        this.patience = patience;
    }

    public void markCancelled() {
        transitTo(RiderStatusEnum.CANCELLED);
    }

    public void markSatisfied() {
        transitTo(RiderStatusEnum.SATISFIED);
    }

    /**
     * 终态只能设置一次，重复设置同一终态视为幂等
     */
    private void transitTo(RiderStatusEnum target) {
        if (status == target) {
            return;
        }
        if (status.isTerminal()) {
            throw new IllegalStateException(String.format("乘客 [%s] 已处于终态 %s，不能变更为 %s",
                    identifier, status.getCode(), target.getCode()));
        }
        this.status = target;
    }

    @Override
    public String toString() {
        return String.format("ID: %s, Origin: %s, Destination: %s, Status: %s, Patience: %d",
                identifier, origin, destination, status.getCode(), patience);
    }
}
