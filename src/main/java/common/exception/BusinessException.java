package common.exception;

/**
 * 业务异常基类
 * 仿真中可预期的失败（脚本格式错误、统计数据不足、队列为空等）均以此类型抛出
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
