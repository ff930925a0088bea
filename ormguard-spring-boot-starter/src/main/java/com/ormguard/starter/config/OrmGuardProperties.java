package com.ormguard.starter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * OrmGuard 配置属性
 */
@Data
@ConfigurationProperties(prefix = "ormguard")
public class OrmGuardProperties {

    /**
     * 是否启用策略引擎。
     */
    private boolean enabled = true;

    /**
     * 策略文档位置，支持 classpath: 与 file: 前缀。
     * 为空时不自动发布，由应用自行调用 PolicyStore#publish。
     */
    private String policyLocation;

    /**
     * 开发模式：监听策略文件并热加载（仅文件系统路径有效）。
     */
    private boolean watch = false;

    /**
     * 热加载防抖间隔。
     */
    private Duration watchDebounce = Duration.ofMillis(500);

    private Audit audit = new Audit();

    private Cost cost = new Cost();

    @Data
    public static class Audit {

        /**
         * 是否为每次评估产生审计记录。
         */
        private boolean enabled = true;

        /**
         * 日志中是否输出脱敏后的请求与决策轨迹。
         */
        private boolean logInputs = false;
    }

    @Data
    public static class Cost {

        /**
         * 是否启用成本闸门。
         */
        private boolean enabled = false;

        /**
         * 单次查询的总成本上限。
         */
        private double maxTotalCost = 1000.0;
    }
}
