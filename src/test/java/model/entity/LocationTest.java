package model.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("位置测试")
class LocationTest {

    @Test
    @DisplayName("解析 row,col 文本")
    void testParse() {
        Location location = Location.parse("3,12");
        assertEquals(3, location.getRow());
        assertEquals(12, location.getColumn());
        assertEquals(new Location(3, 12), location);
        assertEquals("(3,12)", location.toString());
    }

    @Test
    @DisplayName("非法位置文本")
    void testParseInvalid() {
        assertThrows(IllegalArgumentException.class, () -> Location.parse("3"));
        assertThrows(IllegalArgumentException.class, () -> Location.parse("3,"));
        assertThrows(IllegalArgumentException.class, () -> Location.parse(",3"));
        assertThrows(IllegalArgumentException.class, () -> Location.parse("1,2,3"));
        assertThrows(IllegalArgumentException.class, () -> Location.parse("a,b"));
        assertThrows(IllegalArgumentException.class, () -> Location.parse("-1,2"));
        assertThrows(IllegalArgumentException.class, () -> Location.parse(null));
    }
}
