package common.consts;

/**
 * 全局错误信息常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";

    // 仿真状态错误
    public static final String SIMULATION_NOT_LOADED = "当前没有已装载的仿真，请先调用 /sim/admin/load";
    public static final String EVENT_QUEUE_EMPTY = "事件队列为空，无法取出事件";

    // 脚本错误
    public static final String SCRIPT_EMPTY = "事件脚本内容为空";
    public static final String SCRIPT_NOT_READABLE = "事件脚本读取失败";

    // 统计错误
    public static final String NO_FINISHED_RIDER = "没有已接到或已取消的乘客，无法计算平均等待时间";
    public static final String NO_MOVING_DRIVER = "没有至少两条活动记录的司机，无法计算平均行驶距离";
    public static final String NO_DRIVER = "没有任何司机记录，无法计算平均载客距离";
}
