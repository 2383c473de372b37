package com.tradeerp.invoicing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TradeErpApplication {

	public static void main(String[] args) {
		SpringApplication.run(TradeErpApplication.class, args);
	}

}
