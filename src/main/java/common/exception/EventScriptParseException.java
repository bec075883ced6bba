package common.exception;

/**
 * 事件脚本解析异常，携带出错的行号（从 1 开始）和原始行内容
 */
public class EventScriptParseException extends BusinessException {
    private final int lineNumber;
    private final String line;

    public EventScriptParseException(int lineNumber, String line, String reason) {
        super(String.format("事件脚本第 %d 行解析失败: %s [%s]", lineNumber, reason, line));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public EventScriptParseException(int lineNumber, String line, String reason, Throwable cause) {
        super(String.format("事件脚本第 %d 行解析失败: %s [%s]", lineNumber, reason, line), cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
