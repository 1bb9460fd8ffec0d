package com.shoptrends.warehouse;

import com.shoptrends.warehouse.config.LoaderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for the Star Schema Loader.
 *
 * This application reads the flat shopping trends CSV, splits it into the
 * Dim_Customer, Dim_Item and Fact_Purchase tables and loads them into the
 * warehouse. The load runs once as a Spring Batch job and the process exits
 * with the job's status.
 */
@SpringBootApplication
@EnableConfigurationProperties(LoaderProperties.class)
public class WarehouseLoaderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
            SpringApplication.run(WarehouseLoaderApplication.class, args)
        ));
    }
}
