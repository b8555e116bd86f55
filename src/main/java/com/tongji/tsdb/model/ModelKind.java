package com.tongji.tsdb.model;

/**
 * 模型的存储形态，决定由哪个 Store 读写。
 */
public enum ModelKind {
    /** 精确计数（分片 Hash） */
    COUNTER,
    /** 近似去重计数（HyperLogLog） */
    DISTINCT,
    /** 近似频次表（排行索引 + Count-Min 草图） */
    FREQUENCY
}
