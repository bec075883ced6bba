package common;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 接口统一响应结构
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result {
    public static final int CODE_SUCCESS = 200;
    public static final int CODE_ERROR = 500;

    private Integer code; // 200成功 500失败
    private String msg;   // 消息
    private Object data;  // 数据

    public static Result success() {
        return new Result(CODE_SUCCESS, "操作成功", null);
    }

    public static Result success(Object data) {
        return new Result(CODE_SUCCESS, "操作成功", data);
    }

    public static Result success(String msg, Object data) {
        return new Result(CODE_SUCCESS, msg, data);
    }

    // 失败 (默认 500 状态码)
    public static Result error(String msg) {
        return new Result(CODE_ERROR, msg, null);
    }

    public static Result error(Integer code, String msg) {
        return new Result(code, msg, null);
    }
}
