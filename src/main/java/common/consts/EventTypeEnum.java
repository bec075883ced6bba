package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 离散事件仿真中的所有事件类型
 */
@Getter
@AllArgsConstructor
public enum EventTypeEnum {
    //  请求事件
    RIDER_REQUEST("乘客叫车"),
    DRIVER_REQUEST("司机接单"),

    //  乘客耐心耗尽
    CANCELLATION("乘客取消"),

    //  行程事件
    PICKUP("司机接到乘客"),
    DROPOFF("司机送达乘客");

    private final String desc;
}
