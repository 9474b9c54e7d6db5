package com.calai.goals.common;

/**
 * 計算結果違反不變式（巨量營養素百分比加總不是 100、細項超過總量）。
 * 不自動修正。
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
