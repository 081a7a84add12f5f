package com.fritter.freet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Freet Service Application
 *
 * Owns freets and their moderation:
 * - Feed tabs (home, verified, discovery) ranked by best, hot, rising or new
 * - Up/down voting with per-user vote ledgers
 * - Reporting and escalation to timed community audits
 * - Audit resolution with removal or permanent cover
 */
@SpringBootApplication(scanBasePackages = {
    "com.fritter.freet",
    "com.fritter.common"
})
@EnableAsync
@EnableScheduling
@EnableTransactionManagement
public class FreetServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FreetServiceApplication.class, args);
    }
}
