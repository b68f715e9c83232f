package com.agentrelay.types.enums;

/**
 * 单次中继请求的状态。
 */
public enum RelayStateEnum {
    ACQUIRING,
    SENDING,
    DRAINING,
    FINALIZING,
    RELEASED
}
