package com.dealgrid.app;

import com.dealgrid.app.config.GridProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * DealGrid: the spreadsheet cell and formula engine behind the deal modeling grid,
 * served as an in-memory JSON API.
 */
@SpringBootApplication
@EnableConfigurationProperties(GridProperties.class)
public class DealGridApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealGridApplication.class, args);
    }
}
