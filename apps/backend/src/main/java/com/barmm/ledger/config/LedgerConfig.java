package com.barmm.ledger.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LedgerConfig {

    /** created_at 只由账本时钟赋值；测试里可替换成固定时钟 */
    @Bean
    @ConditionalOnMissingBean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
