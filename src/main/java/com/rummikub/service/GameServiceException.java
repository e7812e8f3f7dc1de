package com.rummikub.service;

/**
 * 服务层异常，带稳定的错误代码
 */
public class GameServiceException extends RuntimeException {

    private final String code;

    public GameServiceException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
