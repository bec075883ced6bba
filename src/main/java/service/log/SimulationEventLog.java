package service.log;

import model.dto.snapshot.EventLogEntryDto;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 简单的内存事件日志（最近 N 条），每个仿真一份
 */
public class SimulationEventLog {

    private final int capacity;
    private final Deque<EventLogEntryDto> buffer;

    public SimulationEventLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("事件日志容量必须为正数: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    public synchronized void append(EventLogEntryDto entry) {
        if (buffer.size() >= capacity) {
            buffer.removeFirst();
        }
        buffer.addLast(entry);
    }

    /**
     * 按仿真时间过滤最近的事件
     */
    public synchronized List<EventLogEntryDto> listSince(long sinceSimTime) {
        List<EventLogEntryDto> result = new ArrayList<>();
        for (EventLogEntryDto dto : buffer) {
            if (dto.getSimTime() >= sinceSimTime) {
                result.add(dto);
            }
        }
        return result;
    }

    public synchronized int size() {
        return buffer.size();
    }
}
