package com.ridematch.pool.exception;

import org.springframework.http.HttpStatus;

/**
 * Rejection of a pool operation. The status is what the REST layer answers with.
 */
public class PoolException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    public PoolException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    public PoolException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    public static PoolException badRequest(String code, String message) {
        return new PoolException(code, HttpStatus.BAD_REQUEST, message);
    }

    public static PoolException notFound(String code, String message) {
        return new PoolException(code, HttpStatus.NOT_FOUND, message);
    }

    public static PoolException forbidden(String code, String message) {
        return new PoolException(code, HttpStatus.FORBIDDEN, message);
    }

    public static PoolException conflict(String code, String message) {
        return new PoolException(code, HttpStatus.CONFLICT, message);
    }

    public static PoolException upstream(String code, String message, Throwable cause) {
        return new PoolException(code, HttpStatus.BAD_GATEWAY, message, cause);
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
