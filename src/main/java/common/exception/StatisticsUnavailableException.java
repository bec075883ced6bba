package common.exception;

/**
 * 统计数据不足（分母为 0）时抛出
 */
public class StatisticsUnavailableException extends BusinessException {
    private final String statistic;

    public StatisticsUnavailableException(String statistic, String message) {
        super(message);
        this.statistic = statistic;
    }

    public String getStatistic() {
        return statistic;
    }
}
