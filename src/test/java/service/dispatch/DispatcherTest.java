package service.dispatch;

import model.entity.Driver;
import model.entity.Location;
import model.entity.Rider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import service.dispatch.impl.NearestDriverAlgorithm;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("派单员测试")
class DispatcherTest {

    private static Rider rider(String id, int row, int col) {
        return new Rider(id, new Location(row, col), new Location(row + 1, col + 1), 10);
    }

    private static List<String> ids(List<Driver> drivers) {
        return drivers.stream().map(Driver::getIdentifier).collect(Collectors.toList());
    }

    private static List<String> riderIds(List<Rider> riders) {
        return riders.stream().map(Rider::getIdentifier).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("派单后释放司机")
    class ReleaseMode {

        private final Dispatcher dispatcher = new Dispatcher(new NearestDriverAlgorithm(), true);

        @Test
        @DisplayName("没有空闲司机时乘客进入等待")
        void testNoIdleDriver() {
            Rider rider = rider("xyz", 1, 1);
            assertNull(dispatcher.requestDriver(rider));
            assertTrue(dispatcher.isWaiting(rider));
            assertEquals(List.of("xyz"), riderIds(dispatcher.getWaitingRiders()));
        }

        @Test
        @DisplayName("选择耗时最短的司机并移出空闲列表")
        void testNearestDriver() {
            Driver amy = new Driver("Amy", new Location(0, 0), 1);
            Driver bob = new Driver("Bob", new Location(4, 4), 2);
            assertNull(dispatcher.requestRider(amy));
            assertNull(dispatcher.requestRider(bob));
            assertEquals(List.of("Amy", "Bob"), ids(dispatcher.getIdleDrivers()));

            Rider r1 = rider("r1", 3, 3);
            assertSame(bob, dispatcher.requestDriver(r1));
            assertEquals(List.of("Amy"), ids(dispatcher.getIdleDrivers()));
            assertEquals(List.of("Amy", "Bob"), ids(dispatcher.getTotalDrivers()));
            assertTrue(dispatcher.isWaiting(r1), "乘客被接到前仍在等待列表");
        }

        @Test
        @DisplayName("耗时相同时选登记最早的司机")
        void testTieBreakByRegistration() {
            Driver first = new Driver("first", new Location(0, 2), 1);
            Driver second = new Driver("second", new Location(2, 0), 1);
            dispatcher.requestRider(first);
            dispatcher.requestRider(second);

            assertSame(first, dispatcher.requestDriver(rider("r", 1, 1)));
        }

        @Test
        @DisplayName("已派单的司机不会被第二个乘客选中")
        void testNoDoubleBooking() {
            Driver driver = new Driver("D", new Location(0, 0), 1);
            dispatcher.requestRider(driver);

            Driver matched = dispatcher.requestDriver(rider("r1", 5, 5));
            matched.startDrive(new Location(5, 5));
            assertNull(dispatcher.requestDriver(rider("r2", 0, 1)));
            assertEquals(List.of("r1", "r2"), riderIds(dispatcher.getWaitingRiders()));
        }

        @Test
        @DisplayName("司机接单返回等待最久的乘客")
        void testRequestRiderReturnsHead() {
            Rider r1 = rider("r1", 1, 1);
            Rider r2 = rider("r2", 2, 2);
            dispatcher.requestDriver(r1);
            dispatcher.requestDriver(r2);

            Driver driver = new Driver("D", new Location(0, 0), 1);
            assertSame(r1, dispatcher.requestRider(driver));
            assertTrue(dispatcher.isRegistered(driver));
            assertFalse(dispatcher.isIdle(driver), "拿到乘客的司机不留在空闲列表");
            assertTrue(dispatcher.isWaiting(r1));
        }

        @Test
        @DisplayName("到达后没有目的地的司机重新回到空闲列表")
        void testReadmitArrivedDriver() {
            Driver driver = new Driver("D", new Location(0, 0), 1);
            dispatcher.requestRider(driver);
            Rider r1 = rider("r1", 3, 3);
            dispatcher.requestDriver(r1);
            driver.startDrive(new Location(3, 3));
            dispatcher.endSuccessfulRide(r1);

            // 行驶中不回空闲列表
            assertNull(dispatcher.requestRider(driver));
            assertFalse(dispatcher.isIdle(driver));

            driver.endDrive();
            assertNull(dispatcher.requestRider(driver));
            assertTrue(dispatcher.isIdle(driver));
            assertEquals(1, dispatcher.getTotalDrivers().size());
        }

        @Test
        @DisplayName("首次登记时非空闲的司机只进入总表")
        void testRegisterBusyDriver() {
            Driver driver = new Driver("D", new Location(0, 0), 1);
            driver.startDrive(new Location(1, 1));
            dispatcher.requestRider(driver);
            assertTrue(dispatcher.isRegistered(driver));
            assertFalse(dispatcher.isIdle(driver));
        }
    }

    @Nested
    @DisplayName("兼容模式")
    class CompatibleMode {

        private final Dispatcher dispatcher = new Dispatcher(new NearestDriverAlgorithm(), false);

        @Test
        @DisplayName("派单不修改空闲列表，同一司机可被重复选中")
        void testDriverStaysIdle() {
            Driver driver = new Driver("D", new Location(0, 0), 1);
            dispatcher.requestRider(driver);

            Driver first = dispatcher.requestDriver(rider("r1", 5, 5));
            first.startDrive(new Location(5, 5));
            Driver second = dispatcher.requestDriver(rider("r2", 0, 1));

            assertSame(driver, first);
            assertSame(driver, second);
            assertTrue(dispatcher.isIdle(driver));
        }

        @Test
        @DisplayName("已登记的司机重新接单不改变分区")
        void testRegisteredDriverUnchanged() {
            Driver driver = new Driver("D", new Location(0, 0), 1);
            driver.startDrive(new Location(1, 1));
            dispatcher.requestRider(driver);
            driver.endDrive();
            dispatcher.requestRider(driver);
            assertFalse(dispatcher.isIdle(driver));
            assertEquals(1, dispatcher.getTotalDrivers().size());
        }
    }

    @Test
    @DisplayName("取消与完成只作用于等待中的乘客")
    void testRiderPartitions() {
        Dispatcher dispatcher = new Dispatcher(new NearestDriverAlgorithm(), true);
        Rider a = rider("a", 0, 0);
        Rider b = rider("b", 1, 1);
        Rider c = rider("c", 2, 2);
        dispatcher.requestDriver(a);
        dispatcher.requestDriver(b);

        dispatcher.endSuccessfulRide(a);
        dispatcher.cancelRide(b);
        // 不在等待列表的乘客不受影响
        dispatcher.cancelRide(a);
        dispatcher.endSuccessfulRide(b);
        dispatcher.cancelRide(c);

        assertTrue(dispatcher.isSatisfied(a));
        assertFalse(dispatcher.isCancelled(a));
        assertTrue(dispatcher.isCancelled(b));
        assertFalse(dispatcher.isSatisfied(b));
        assertFalse(dispatcher.isCancelled(c));
        assertTrue(dispatcher.getWaitingRiders().isEmpty());
    }

    @Test
    @DisplayName("重复叫车不会重复进入等待列表")
    void testRepeatedRequest() {
        Dispatcher dispatcher = new Dispatcher(new NearestDriverAlgorithm(), true);
        Rider a = rider("a", 0, 0);
        dispatcher.requestDriver(a);
        dispatcher.requestDriver(a);
        assertEquals(1, dispatcher.getWaitingRiders().size());
        assertThrows(UnsupportedOperationException.class, () -> dispatcher.getWaitingRiders().clear());
    }
}
