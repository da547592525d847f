package com.slb.stake_backend.common.security;

import org.springframework.http.HttpStatus;

/**
 * 鉴权失败类型 / Authentication and authorization failure types.
 */
public enum AuthErrorType {
    MISSING_AUTHORIZATION(HttpStatus.UNAUTHORIZED, "AUTH_MISSING_AUTHZ", "invalid_token", "Authorization header is required",
            "未登录或登录信息缺失，请先登录"),
    BAD_AUTHORIZATION_HEADER(HttpStatus.BAD_REQUEST, "AUTH_BAD_HEADER", "invalid_request", "Malformed Authorization header",
            "登录信息格式错误，请使用 Authorization: Bearer <token>"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "AUTH_INVALID_TOKEN", "invalid_token", "Invalid access token",
            "登录已失效，请重新登录"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "AUTH_TOKEN_EXPIRED", "invalid_token", "Token expired",
            "登录已过期，请重新登录"),
    WRONG_TOKEN_TYPE(HttpStatus.UNAUTHORIZED, "AUTH_WRONG_TOKEN_TYPE", "invalid_token", "Wrong token type for this resource",
            "登录信息类型不匹配，请重新登录"),
    MISSING_SUBJECT(HttpStatus.UNAUTHORIZED, "AUTH_MISSING_SUBJECT", "invalid_token", "Token has no subject",
            "登录信息异常，请重新登录"),
    INSUFFICIENT_SCOPE(HttpStatus.FORBIDDEN, "AUTH_INSUFFICIENT_SCOPE", "insufficient_scope", "Insufficient scope",
            "权限不足");

    private final HttpStatus status;
    private final String code;
    private final String oauthError;
    private final String defaultDetail;
    private final String displayMessage;

    AuthErrorType(HttpStatus status, String code, String oauthError, String defaultDetail, String displayMessage) {
        this.status = status;
        this.code = code;
        this.oauthError = oauthError;
        this.defaultDetail = defaultDetail;
        this.displayMessage = displayMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getOauthError() {
        return oauthError;
    }

    public String getDefaultDetail() {
        return defaultDetail;
    }

    public String getDisplayMessage() {
        return displayMessage;
    }
}
