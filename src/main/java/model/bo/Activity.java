package model.bo;

import common.consts.ActivityTypeEnum;
import common.consts.ActorTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import model.entity.Location;

/**
 * 监控器记录的一条活动
 */
@Getter
@ToString
@AllArgsConstructor
public class Activity {
    private final long timestamp;
    private final ActorTypeEnum actorType;
    private final ActivityTypeEnum activityType;
    private final String identifier;
    private final Location location;
}
