package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 乘客状态枚举
 * 只能从 WAITING 流转到 CANCELLED 或 SATISFIED，终态之间不可互转
 */
@Getter
@AllArgsConstructor
public enum RiderStatusEnum {
    WAITING("waiting", "等待派车"),
    CANCELLED("cancelled", "已取消"),
    SATISFIED("satisfied", "已接到");

    private final String code;
    private final String desc;

    public boolean isTerminal() {
        return this != WAITING;
    }
}
