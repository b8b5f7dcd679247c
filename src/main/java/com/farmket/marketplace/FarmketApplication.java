package com.farmket.marketplace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FarmketApplication {

	public static void main(String[] args) {
		SpringApplication.run(FarmketApplication.class, args);
	}

}
