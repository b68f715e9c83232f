package com.agentrelay.types.enums;

/**
 * 单次中继请求的结束方式。
 */
public enum RelayOutcomeEnum {
    COMPLETED,
    FAILED,
    TIMED_OUT,
    CANCELLED
}
