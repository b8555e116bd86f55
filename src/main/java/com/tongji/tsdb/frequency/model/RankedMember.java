package com.tongji.tsdb.frequency.model;

/**
 * 排行结果中的一个成员及其（可能为估计的）分数。
 */
public record RankedMember(String member, double score) {
}
