package com.tongji.tsdb.schema;

/**
 * 计数分片 Hash 的定位：hashKey 编码 (model, rollup, epoch, vnode)，field 编码 (实体, 维度)。
 */
public record CounterKey(String hashKey, String field) {
}
