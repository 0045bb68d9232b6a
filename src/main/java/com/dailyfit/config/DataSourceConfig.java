package com.dailyfit.config;

import com.dailyfit.common.exception.ConfigurationException;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 数据源：启动时校验 MYSQL_URL / MYSQL_USERNAME，缺失直接失败
 */
@Slf4j
@Configuration
public class DataSourceConfig {

    @Bean
    public HikariDataSource dataSource(DataSourceProperties properties) {
        requireSetting("MYSQL_URL", properties.getUrl());
        requireSetting("MYSQL_USERNAME", properties.getUsername());

        HikariDataSource dataSource = properties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
        log.info("数据源初始化完成，url={}", properties.getUrl());
        return dataSource;
    }

    private static void requireSetting(String name, String value) {
        if (StringUtils.isBlank(value)) {
            throw new ConfigurationException("Database setting " + name + " is not configured");
        }
    }
}
