package common.exception;

import common.Result;
import common.consts.ErrorCodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器
 * 捕获接口层异常，记录日志，以统一响应结构返回
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 处理业务异常 (脚本格式错误、统计数据不足、未装载仿真等)
     */
    @ExceptionHandler(BusinessException.class)
    public Result handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        return Result.error(e.getMessage());
    }

    /**
     * 处理仿真死循环异常 错误日志在 SimulationEngine 中记录
     */
    @ExceptionHandler(SimulationDeadLoopException.class)
    public Result handleDeadLoopException(SimulationDeadLoopException e) {
        log.error("仿真死循环异常: {}", e.getMessage());
        return Result.error(Result.CODE_ERROR, "仿真死循环: " + e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Result handleException(Exception e) {
        log.error("系统异常", e);
        return Result.error(ErrorCodes.SYSTEM_ERROR + ": " + e.getMessage());
    }
}
