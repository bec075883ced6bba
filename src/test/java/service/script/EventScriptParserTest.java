package service.script;

import common.consts.EventTypeEnum;
import common.exception.BusinessException;
import common.exception.EventScriptParseException;
import engine.SimEvent;
import model.entity.Location;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("事件脚本解析测试")
class EventScriptParserTest {

    private final EventScriptParser parser = new EventScriptParser();

    @Test
    @DisplayName("解析乘客与司机请求")
    void testParseRequests() {
        List<SimEvent> events = parser.parse("0 DriverRequest Sam 1,1 2\n"
                + "1 RiderRequest xyz 1,1 6,6 4\n");

        assertEquals(2, events.size());
        SimEvent driverEvent = events.get(0);
        assertEquals(EventTypeEnum.DRIVER_REQUEST, driverEvent.getType());
        assertEquals(0L, driverEvent.getTimestamp());
        assertEquals("Sam", driverEvent.getDriver().getIdentifier());
        assertEquals(new Location(1, 1), driverEvent.getDriver().getLocation());
        assertEquals(2, driverEvent.getDriver().getSpeed());
        assertNull(driverEvent.getParentEventId());

        SimEvent riderEvent = events.get(1);
        assertEquals(EventTypeEnum.RIDER_REQUEST, riderEvent.getType());
        assertEquals(1L, riderEvent.getTimestamp());
        assertEquals("xyz", riderEvent.getRider().getIdentifier());
        assertEquals(new Location(6, 6), riderEvent.getRider().getDestination());
        assertEquals(4L, riderEvent.getRider().getPatience());
    }

    @Test
    @DisplayName("忽略空行、注释和多余空白")
    void testSkipBlankAndComments() {
        List<SimEvent> events = parser.parse("# 场景\n\n   3   RiderRequest   r   0,0   1,1   2  \n\t\n");
        assertEquals(1, events.size());
        assertEquals(3L, events.get(0).getTimestamp());
    }

    @Test
    @DisplayName("错误行报告从 1 开始的行号")
    void testLineNumber() {
        EventScriptParseException e = assertThrows(EventScriptParseException.class,
                () -> parser.parse("0 DriverRequest Sam 1,1 2\n\n2 TaxiRequest t 1,1 2\n"));
        assertEquals(3, e.getLineNumber());
        assertEquals("2 TaxiRequest t 1,1 2", e.getLine());
    }

    @Test
    @DisplayName("字段数量、数字与位置格式校验")
    void testMalformedLines() {
        assertThrows(EventScriptParseException.class, () -> parser.parse("0 DriverRequest Sam 1,1"));
        assertThrows(EventScriptParseException.class, () -> parser.parse("0 RiderRequest r 1,1 2,2"));
        assertThrows(EventScriptParseException.class, () -> parser.parse("x DriverRequest Sam 1,1 2"));
        assertThrows(EventScriptParseException.class, () -> parser.parse("-1 DriverRequest Sam 1,1 2"));
        assertThrows(EventScriptParseException.class, () -> parser.parse("0 DriverRequest Sam 1,1 -2"));
        assertThrows(EventScriptParseException.class, () -> parser.parse("0 DriverRequest Sam 1;1 2"));
        assertThrows(EventScriptParseException.class, () -> parser.parse("0 RiderRequest r 1,1 2,2 -4"));
        assertThrows(EventScriptParseException.class, () -> parser.parse("0"));
    }

    @Test
    @DisplayName("空脚本")
    void testEmptyScript() {
        assertThrows(BusinessException.class, () -> parser.parse(""));
        assertThrows(BusinessException.class, () -> parser.parse("   \n"));
        assertTrue(parser.parseLines(List.of("# only comment")).isEmpty());
    }

    @Test
    @DisplayName("从文件解析")
    void testParseFile(@TempDir Path dir) throws IOException {
        Path script = dir.resolve("events.txt");
        Files.write(script, List.of("0 DriverRequest Sam 1,1 2", "1 RiderRequest xyz 1,1 6,6 4"), StandardCharsets.UTF_8);
        assertEquals(2, parser.parse(script).size());

        assertThrows(BusinessException.class, () -> parser.parse(dir.resolve("missing.txt")));
    }
}
