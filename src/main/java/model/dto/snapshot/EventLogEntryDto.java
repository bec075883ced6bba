package model.dto.snapshot;

import common.consts.EventTypeEnum;
import lombok.Data;

/**
 * 离散事件日志条目 DTO
 */
@Data
public class EventLogEntryDto {
    /**
     * 事件触发时间（仿真时间）
     */
    private long simTime;

    /**
     * 事件类型
     */
    private EventTypeEnum type;

    private String eventId;

    /**
     * 父事件ID（初始事件为空，用于构建因果链）
     */
    private String parentEventId;

    private String riderId;
    private String driverId;

    /**
     * 事件的可读描述
     */
    private String description;

    /**
     * 本事件产生的新事件数
     */
    private int spawnedCount;
}
