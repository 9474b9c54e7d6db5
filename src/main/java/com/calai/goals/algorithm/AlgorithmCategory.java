package com.calai.goals.algorithm;
public enum AlgorithmCategory {
    BMR,
    BODY_FAT,
    FAT_BREAKDOWN,
    MINERAL,
    VITAMIN,
    SUGAR
}
