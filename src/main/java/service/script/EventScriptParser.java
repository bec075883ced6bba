package service.script;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import common.exception.EventScriptParseException;
import engine.SimEvent;
import lombok.extern.slf4j.Slf4j;
import model.entity.Driver;
import model.entity.Location;
import model.entity.Rider;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 事件脚本解析
 * <pre>
 * &lt;timestamp&gt; RiderRequest &lt;id&gt; &lt;row,col 上车点&gt; &lt;row,col 目的地&gt; &lt;patience&gt;
 * &lt;timestamp&gt; DriverRequest &lt;id&gt; &lt;row,col 位置&gt; &lt;speed&gt;
 * </pre>
 * 空行和 # 开头的行忽略
 */
@Slf4j
@Component
public class EventScriptParser {

    public static final String RIDER_REQUEST = "RiderRequest";
    public static final String DRIVER_REQUEST = "DriverRequest";

    private static final int RIDER_TOKEN_COUNT = 6;
    private static final int DRIVER_TOKEN_COUNT = 5;

    public List<SimEvent> parse(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<SimEvent> events = parse(reader);
            log.info("事件脚本 {} 解析完成: 事件数={}", path, events.size());
            return events;
        } catch (IOException e) {
            throw new BusinessException(ErrorCodes.SCRIPT_NOT_READABLE + ": " + path, e);
        }
    }

    public List<SimEvent> parse(String script) {
        if (script == null || script.isBlank()) {
            throw new BusinessException(ErrorCodes.SCRIPT_EMPTY);
        }
        return parse(new StringReader(script));
    }

    public List<SimEvent> parse(Reader reader) {
        BufferedReader bufferedReader = reader instanceof BufferedReader
                ? (BufferedReader) reader : new BufferedReader(reader);
        List<String> lines = new ArrayList<>();
        try {
            String line;
            while ((line = bufferedReader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new BusinessException(ErrorCodes.SCRIPT_NOT_READABLE, e);
        }
        return parseLines(lines);
    }

    public List<SimEvent> parseLines(List<String> lines) {
        List<SimEvent> events = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            events.add(parseLine(i + 1, line));
        }
        return events;
    }

    private SimEvent parseLine(int lineNumber, String line) {
        String[] tokens = line.split("\\s+");
        if (tokens.length < 2) {
            throw new EventScriptParseException(lineNumber, line, "缺少事件类型");
        }
        long timestamp = parseNonNegative(lineNumber, line, tokens[0], "时间戳");

        switch (tokens[1]) {
            case RIDER_REQUEST: {
                requireTokenCount(lineNumber, line, tokens, RIDER_TOKEN_COUNT);
                Location origin = parseLocation(lineNumber, line, tokens[3]);
                Location destination = parseLocation(lineNumber, line, tokens[4]);
                long patience = parseNonNegative(lineNumber, line, tokens[5], "耐心值");
                return SimEvent.riderRequest(timestamp, new Rider(tokens[2], origin, destination, patience));
            }
            case DRIVER_REQUEST: {
                requireTokenCount(lineNumber, line, tokens, DRIVER_TOKEN_COUNT);
                Location location = parseLocation(lineNumber, line, tokens[3]);
                long speed = parseNonNegative(lineNumber, line, tokens[4], "速度");
                if (speed > Integer.MAX_VALUE) {
                    throw new EventScriptParseException(lineNumber, line, "速度超出范围: " + tokens[4]);
                }
                return SimEvent.driverRequest(timestamp, new Driver(tokens[2], location, (int) speed));
            }
            default:
                throw new EventScriptParseException(lineNumber, line, "未知的事件类型: " + tokens[1]);
        }
    }

    private static void requireTokenCount(int lineNumber, String line, String[] tokens, int expected) {
        if (tokens.length != expected) {
            throw new EventScriptParseException(lineNumber, line,
                    String.format("%s 需要 %d 个字段，实际 %d 个", tokens[1], expected, tokens.length));
        }
    }

    private static long parseNonNegative(int lineNumber, String line, String token, String field) {
        long value;
        try {
            value = Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new EventScriptParseException(lineNumber, line, field + "不是整数: " + token, e);
        }
        if (value < 0) {
            throw new EventScriptParseException(lineNumber, line, field + "不能为负: " + token);
        }
        return value;
    }

    private static Location parseLocation(int lineNumber, String line, String token) {
        try {
            return Location.parse(token);
        } catch (IllegalArgumentException e) {
            throw new EventScriptParseException(lineNumber, line, e.getMessage(), e);
        }
    }
}
