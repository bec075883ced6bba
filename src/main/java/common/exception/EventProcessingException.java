package common.exception;

import common.consts.EventTypeEnum;

/**
 * 事件处理异常
 * 处理器违反实体前置条件等编程契约时抛出，仿真随即停止，不跳过事件
 */
public class EventProcessingException extends BusinessException {
    private final String eventId;
    private final EventTypeEnum eventType;
    private final long simTime;

    public EventProcessingException(String message, String eventId, EventTypeEnum eventType,
                                    long simTime, Throwable cause) {
        super(message, cause);
        this.eventId = eventId;
        this.eventType = eventType;
        this.simTime = simTime;
    }

    public String getEventId() {
        return eventId;
    }

    public EventTypeEnum getEventType() {
        return eventType;
    }

    public long getSimTime() {
        return simTime;
    }
}
