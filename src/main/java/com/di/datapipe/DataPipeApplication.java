package com.di.datapipe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scheduled fetch → landing store → warehouse load → dependency-gated join.
 * The JDBC marker store builds its own pool, so DataSource auto-configuration stays off.
 */
@SpringBootApplication(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class
})
@EnableScheduling
@ConfigurationPropertiesScan
public class DataPipeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataPipeApplication.class, args);
    }
}
