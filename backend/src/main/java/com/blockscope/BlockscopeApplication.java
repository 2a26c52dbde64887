package com.blockscope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Block explorer back end. The address index owns its own embedded store, so the Boot-managed
 * DataSource is switched off.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class BlockscopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlockscopeApplication.class, args);
    }
}
