package com.barmm.ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {
    /**
     * 存储方式：可选值 "in-memory" 或 "database"
     */
    private String storage = "in-memory";

    /** 判断 report_date 是否“在未来”所用的时区 */
    private ZoneId zone = ZoneId.of("Asia/Manila");

    /** in-memory 模式下预先登记的项目 id（database 模式读 projects 表） */
    private List<String> seedProjects = new ArrayList<>();

    private Append append = new Append();
    private Audit audit = new Audit();

    @Data
    public static class Append {
        /** 等待 scope 锁的上限，超时按 StorageException 处理 */
        private Duration lockTimeout = Duration.ofSeconds(5);
        /** 其他进程抢占同一 seq 时的重读重试次数 */
        private int maxConflictRetries = 3;
    }

    @Data
    public static class Audit {
        private int retentionDays = 90;
        private int maxPageSize = 1000;
    }
}
