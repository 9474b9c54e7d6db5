package com.calai.goals.algorithm;

/**
 * 每個演算法列舉都有一個對外 key（偏好設定存的就是它）。
 */
public interface AlgorithmId {

    String key();

    AlgorithmCategory category();
}
