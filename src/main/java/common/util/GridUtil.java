package common.util;

import model.entity.Location;

public class GridUtil {

    private GridUtil() {}

    /**
     * 计算两点间的曼哈顿距离
     */
    public static long manhattanDistance(Location from, Location to) {
        // 按 long 计算，坐标接近 Integer.MAX_VALUE 时不溢出
        return Math.abs((long) from.getRow() - to.getRow()) + Math.abs((long) from.getColumn() - to.getColumn());
    }

    /**
     * 按速度计算行驶耗时 (仿真时间单位)
     * 结果四舍六入五成双；速度为 0 或任一位置缺失时耗时为 0
     * @param from  出发点
     * @param to    目标点
     * @param speed 每个时间单位行驶的格数
     */
    public static long travelTime(Location from, Location to, int speed) {
        if (from == null || to == null || speed == 0) {
            return 0L;
        }
        return (long) Math.rint((double) manhattanDistance(from, to) / speed);
    }
}
