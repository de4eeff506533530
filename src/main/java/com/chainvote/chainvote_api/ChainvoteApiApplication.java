package com.chainvote.chainvote_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChainvoteApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(ChainvoteApiApplication.class, args);
	}

}
