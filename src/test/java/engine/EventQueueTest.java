package engine;

import common.exception.EmptyQueueException;
import model.entity.Driver;
import model.entity.Location;
import model.entity.Rider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("事件队列测试")
class EventQueueTest {

    private static Rider rider(String id) {
        return new Rider(id, new Location(0, 0), new Location(1, 1), 5);
    }

    @Test
    @DisplayName("按时间戳升序出队")
    void testOrderByTimestamp() {
        EventQueue queue = new EventQueue();
        SimEvent late = SimEvent.riderRequest(7, rider("a"));
        SimEvent early = SimEvent.riderRequest(2, rider("b"));
        SimEvent middle = SimEvent.riderRequest(4, rider("c"));
        queue.add(late);
        queue.add(early);
        queue.add(middle);

        assertEquals(3, queue.size());
        assertSame(early, queue.removeMin());
        assertSame(middle, queue.removeMin());
        assertSame(late, queue.removeMin());
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("时间戳相同时按入队顺序出队")
    void testFifoOnEqualTimestamp() {
        EventQueue queue = new EventQueue();
        SimEvent first = SimEvent.riderRequest(3, rider("first"));
        SimEvent second = SimEvent.driverRequest(3, new Driver("second", new Location(0, 0), 1));
        SimEvent third = SimEvent.cancellation(null, 3, rider("third"));
        SimEvent earlier = SimEvent.riderRequest(1, rider("earlier"));
        queue.add(first);
        queue.add(second);
        queue.add(third);
        queue.add(earlier);

        assertSame(earlier, queue.removeMin());
        assertSame(first, queue.removeMin());
        assertSame(second, queue.removeMin());
        assertSame(third, queue.removeMin());
    }

    @Test
    @DisplayName("空队列取事件抛出异常，peek 返回 null")
    void testEmptyQueue() {
        EventQueue queue = new EventQueue();
        assertNull(queue.peek());
        assertThrows(EmptyQueueException.class, queue::removeMin);

        queue.add(SimEvent.riderRequest(0, rider("x")));
        assertNotNull(queue.peek());
        assertEquals(1, queue.size(), "peek 不应移除事件");
        queue.clear();
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("不允许空事件和负时间戳")
    void testRejectInvalidEvent() {
        EventQueue queue = new EventQueue();
        assertThrows(IllegalArgumentException.class, () -> queue.add(null));
        assertThrows(IllegalArgumentException.class, () -> SimEvent.riderRequest(-1, rider("neg")));
        assertThrows(IllegalArgumentException.class, () -> SimEvent.pickup(null, 1, rider("r"), null));
    }
}
