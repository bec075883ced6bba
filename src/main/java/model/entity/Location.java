package model.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 网格上的位置，行列均为非负整数
 */
@Getter
@EqualsAndHashCode
public final class Location {

    private final int row;
    private final int column;

    public Location(int row, int column) {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException(String.format("坐标必须为非负整数: (%d,%d)", row, column));
        }
        this.row = row;
        this.column = column;
    }

    /**
     * 解析 "row,col" 格式的位置，逗号两侧不允许有空格
     */
    public static Location parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("位置不能为空");
        }
        int comma = text.indexOf(',');
        if (comma <= 0 || comma != text.lastIndexOf(',') || comma == text.length() - 1) {
            throw new IllegalArgumentException("位置格式应为 row,col: " + text);
        }
        try {
            return new Location(Integer.parseInt(text.substring(0, comma)),
                    Integer.parseInt(text.substring(comma + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("位置坐标不是整数: " + text, e);
        }
    }

    @Override
    public String toString() {
        return "(" + row + "," + column + ")";
    }
}
