package com.barmm.ledger;

import lombok.extern.slf4j.Slf4j;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan(basePackages = "com.barmm.ledger.mapper")
@Slf4j
public class LedgerApplication {

    public static void main(String[] args) {
        log.info("Starting progress ledger application");
        SpringApplication.run(LedgerApplication.class, args);
        log.info("Progress ledger application started");
    }
}
