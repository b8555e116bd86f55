package com.tongji.tsdb.frequency.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * 频次草图形状：depth 行 × width 列计数矩阵 + capacity 容量的精确排行索引。
 * 每次脚本调用都携带这三个参数，服务端不保存形状。
 */
public record SketchParameters(int depth, int width, int capacity) {

    public SketchParameters {
        if (depth < 1 || depth > CountMinScript.MAX_DEPTH || width < 1 || capacity < 1) {
            throw new IllegalArgumentException(
                    "Invalid sketch parameters depth=%d width=%d capacity=%d".formatted(depth, width, capacity));
        }
    }

    /**
     * 组装脚本参数：命令名、depth、width、capacity，之后追加命令自身参数。
     */
    public List<String> arguments(String command) {
        List<String> args = new ArrayList<>();
        args.add(command);
        args.add(String.valueOf(depth));
        args.add(String.valueOf(width));
        args.add(String.valueOf(capacity));
        return args;
    }
}
