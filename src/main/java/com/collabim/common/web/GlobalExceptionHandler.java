package com.collabim.common.web;

import com.collabim.common.api.ApiCodes;
import com.collabim.common.api.Result;
import com.collabim.common.error.ChatException;
import com.collabim.common.error.ErrorKind;
import io.jsonwebtoken.JwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * 全局异常处理：把常见异常“翻译”为统一的 Result JSON。
 *
 * <p>注意：HTTP 状态码仍然会设置（比如 400/401/403/404/409/503），但响应体结构始终一致。</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 核心业务失败。重复会话时 data 带上已有会话 id，客户端可直接跳转。
     */
    @ExceptionHandler(ChatException.class)
    public ResponseEntity<Result<Map<String, Long>>> handleChat(ChatException e) {
        ErrorKind kind = e.getKind();
        if (kind == ErrorKind.UNAVAILABLE) {
            log.warn("store unavailable: {}", e.getCause() == null ? e.toString() : e.getCause().toString());
        }
        Map<String, Long> data = e.getConversationId() == null ? null : Map.of("conversationId", e.getConversationId());
        return ResponseEntity.status(kind.getHttpStatus())
                .body(Result.fail(kind.getCode(), e.getReason(), data));
    }

    /**
     * Spring Validation（@Valid）触发的参数错误。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getAllErrors().isEmpty()
            ? "invalid_request"
            : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Result<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, "bad_" + e.getName()));
    }

    /**
     * JWT 解析失败：通常算未授权。
     */
    @ExceptionHandler(JwtException.class)
    public ResponseEntity<Result<Void>> handleJwt(JwtException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Result.fail(ApiCodes.UNAUTHORIZED, "invalid_token"));
    }

    /**
     * 数据被库拒绝（超长、越界、约束冲突）：是请求本身的问题，重试也不会成功。
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Result<Void>> handleDataIntegrity(DataIntegrityViolationException e) {
        log.warn("data rejected by store: {}", e.toString());
        if (e instanceof DuplicateKeyException) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Result.fail(ApiCodes.CONFLICT, "duplicate"));
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, "invalid_data"));
    }

    /**
     * 存储层故障（连接丢失/超时等）：归为可重试的 UNAVAILABLE，不回传底层细节。
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Result<Void>> handleDataAccess(DataAccessException e) {
        log.error("data access failed: {}", e.toString());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Result.fail(ApiCodes.UNAVAILABLE, "store_unavailable"));
    }

    /**
     * 兜底：避免默认 HTML 错误页。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleAny(Exception e) {
        log.error("unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
    }
}
