package engine;

import common.exception.EmptyQueueException;

import java.util.PriorityQueue;

/**
 * 仿真事件队列
 * 按时间戳升序出队；时间戳相同时按入队顺序出队，保证回放结果可复现
 */
public class EventQueue {

    private final PriorityQueue<Entry> heap = new PriorityQueue<>();

    // 入队序号 由队列自身维护，与事件创建顺序无关
    private long nextSequence = 0L;

    public void add(SimEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("不能向队列添加空事件");
        }
        heap.add(new Entry(event, nextSequence++));
    }

    /**
     * 取出时间最早的事件
     * @throws EmptyQueueException 队列为空
     */
    public SimEvent removeMin() {
        Entry entry = heap.poll();
        if (entry == null) {
            throw new EmptyQueueException();
        }
        return entry.event;
    }

    /**
     * 查看下一个事件，队列为空时返回 null
     */
    public SimEvent peek() {
        Entry entry = heap.peek();
        return entry == null ? null : entry.event;
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    public int size() {
        return heap.size();
    }

    public void clear() {
        heap.clear();
        nextSequence = 0L;
    }

    private static final class Entry implements Comparable<Entry> {
        private final SimEvent event;
        private final long sequence;

        private Entry(SimEvent event, long sequence) {
            this.event = event;
            this.sequence = sequence;
        }

        @Override
        public int compareTo(Entry other) {
            //  按时间早晚排
            int timeCompare = Long.compare(event.getTimestamp(), other.event.getTimestamp());
            if (timeCompare != 0) {
                return timeCompare;
            }
            //  时间相同 按入队顺序排
            return Long.compare(sequence, other.sequence);
        }
    }
}
