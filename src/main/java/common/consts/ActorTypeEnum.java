package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 活动主体类型
 */
@Getter
@AllArgsConstructor
public enum ActorTypeEnum {
    RIDER("rider", "乘客"),
    DRIVER("driver", "司机");

    private final String code;
    private final String desc;
}
