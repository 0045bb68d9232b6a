package com.dailyfit.common.exception;

/**
 * 启动期配置缺失（凭证、连接信息），不可按请求恢复
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
