package com.tongji.tsdb.model;

import java.util.Objects;

/**
 * 实体标识：整数或字符串，对引擎而言是不透明的。
 * <p>
 * 整数键按原值参与分片；字符串键会被归一化为定长摘要，详见 {@code KeyCodec}。
 */
public record EntityKey(Long id, String name) {

    public EntityKey {
        if ((id == null) == (name == null)) {
            throw new IllegalArgumentException("EntityKey requires exactly one of id or name");
        }
    }

    public static EntityKey of(long id) {
        return new EntityKey(id, null);
    }

    public static EntityKey of(String name) {
        return new EntityKey(null, Objects.requireNonNull(name, "name"));
    }

    public boolean isNumeric() {
        return id != null;
    }

    @Override
    public String toString() {
        return isNumeric() ? String.valueOf(id) : name;
    }
}
