package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 监控器记录的活动类型
 */
@Getter
@AllArgsConstructor
public enum ActivityTypeEnum {
    REQUEST("request", "发起请求"),
    CANCEL("cancel", "取消"),
    PICKUP("pickup", "上车"),
    DROPOFF("dropoff", "下车");

    private final String code;
    private final String desc;
}
