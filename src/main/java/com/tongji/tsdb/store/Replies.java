package com.tongji.tsdb.store;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 原始结果解码：Redis 返回 byte[] / Long / List，内存实现可能直接返回 String / Number。
 * 缺失值统一按零或 null 处理。
 */
public final class Replies {

    private Replies() {}

    public static long asLong(Object raw) {
        if (raw == null) {
            return 0L;
        }
        if (raw instanceof Number n) {
            return n.longValue();
        }
        String text = asString(raw);
        return text == null || text.isEmpty() ? 0L : Long.parseLong(text.trim());
    }

    public static double asDouble(Object raw) {
        if (raw == null) {
            return 0.0d;
        }
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        String text = asString(raw);
        return text == null || text.isEmpty() ? 0.0d : Double.parseDouble(text.trim());
    }

    public static String asString(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return raw.toString();
    }

    public static byte[] asBytes(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof byte[] bytes) {
            return bytes;
        }
        return raw.toString().getBytes(StandardCharsets.UTF_8);
    }

    public static List<?> asList(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof List<?> list) {
            return list;
        }
        throw new IllegalStateException("Expected multi-bulk reply but got " + raw.getClass().getSimpleName());
    }
}
