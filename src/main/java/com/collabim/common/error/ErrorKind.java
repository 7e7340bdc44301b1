package com.collabim.common.error;

import com.collabim.common.api.ApiCodes;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 业务失败分类。
 *
 * <p>除 {@link #UNAVAILABLE} 以外都是确定性失败，核心层不做任何自动重试。</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, ApiCodes.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN, ApiCodes.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND),
    INVALID_STATE(HttpStatus.CONFLICT, ApiCodes.INVALID_STATE),
    CONFLICT(HttpStatus.CONFLICT, ApiCodes.CONFLICT),
    VALIDATION(HttpStatus.BAD_REQUEST, ApiCodes.BAD_REQUEST),

    /** 存储层连接失败/超时：调用方可按需退避重试。 */
    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, ApiCodes.UNAVAILABLE);

    private final HttpStatus httpStatus;

    private final int code;
}
