package com.di.dataqc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Data sources are created on demand per request by the postgres connector, so no application
 * {@code DataSource} is auto-configured.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@EnableAspectJAutoProxy
public class DataQcApplication {

	public static void main(String[] args) {
		SpringApplication.run(DataQcApplication.class, args);
	}
}
