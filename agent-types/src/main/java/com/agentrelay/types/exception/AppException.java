package com.agentrelay.types.exception;

import com.agentrelay.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一承载会话池与流中继中的业务异常，包含异常码和异常描述信息。
 * 异常码取自 {@link ResponseCode}，上层据此区分能力不可用、事件格式错误与请求超时。
 * </p>
 *
 * @author agentrelay
 * @since 2026-10-19
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /**
     * 创建包含异常码的 AppException。
     *
     * @param code 异常码
     */
    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    /**
     * 创建包含响应码枚举和描述信息的 AppException。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     */
    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message);
    }

    /**
     * 创建包含响应码枚举、描述信息和原因的 AppException。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(ResponseCode responseCode, String message, Throwable cause) {
        this(responseCode.getCode(), message, cause);
    }

    /**
     * 创建包含异常码和描述信息的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    /**
     * 判断异常码是否与给定响应码一致。
     */
    public boolean is(ResponseCode responseCode) {
        return responseCode != null && responseCode.getCode().equals(code);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "com.agentrelay.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
