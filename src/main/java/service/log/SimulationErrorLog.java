package service.log;

import common.consts.EventTypeEnum;
import lombok.Data;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 仿真错误日志服务
 * 记录事件处理异常和死循环信息，供接口查询
 * 只保留当前仿真的错误，装载新仿真或重置时清空
 */
@Component
public class SimulationErrorLog {

    private static final int DEFAULT_CAPACITY = 500;

    private final Deque<ErrorLogEntry> errorBuffer = new ArrayDeque<>(DEFAULT_CAPACITY);

    /**
     * 记录事件处理异常
     */
    public synchronized void recordEventProcessingError(String simulationId, String eventId, EventTypeEnum eventType,
                                                        long simTime, String message, Throwable cause) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(ErrorType.EVENT_PROCESSING_ERROR);
        entry.setSimulationId(simulationId);
        entry.setSimTime(simTime);
        entry.setEventId(eventId);
        entry.setEventType(eventType);
        entry.setMessage(message);
        entry.setCause(cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : null);
        entry.setRecordedAt(LocalDateTime.now());

        addEntry(entry);
    }

    /**
     * 记录死循环错误
     */
    public synchronized void recordDeadLoopError(String simulationId, long simTime, int eventCount,
                                                 int threshold, String message) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(ErrorType.DEAD_LOOP);
        entry.setSimulationId(simulationId);
        entry.setSimTime(simTime);
        entry.setMessage(message);
        entry.setEventCount(eventCount);
        entry.setThreshold(threshold);
        entry.setRecordedAt(LocalDateTime.now());

        addEntry(entry);
    }

    private void addEntry(ErrorLogEntry entry) {
        if (errorBuffer.size() >= DEFAULT_CAPACITY) {
            errorBuffer.removeFirst();
        }
        errorBuffer.addLast(entry);
    }

    /**
     * 查询指定仿真时间之后的错误日志
     */
    public synchronized List<ErrorLogEntry> listSince(long sinceSimTime) {
        List<ErrorLogEntry> result = new ArrayList<>();
        for (ErrorLogEntry entry : errorBuffer) {
            if (entry.getSimTime() >= sinceSimTime) {
                result.add(entry);
            }
        }
        return result;
    }

    public synchronized List<ErrorLogEntry> listAll() {
        return new ArrayList<>(errorBuffer);
    }

    public synchronized void clear() {
        errorBuffer.clear();
    }

    public enum ErrorType {
        EVENT_PROCESSING_ERROR,  // 事件处理异常
        DEAD_LOOP                // 死循环
    }

    @Data
    public static class ErrorLogEntry {
        private ErrorType errorType;
        private String simulationId;     // 出错的仿真
        private long simTime;
        private String eventId;
        private EventTypeEnum eventType;
        private String message;
        private String cause;
        private Integer eventCount;
        private Integer threshold;
        private LocalDateTime recordedAt;
    }
}
