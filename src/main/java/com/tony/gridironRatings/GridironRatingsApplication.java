package com.tony.gridironRatings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GridironRatingsApplication {

	public static void main(String[] args) {
		SpringApplication.run(GridironRatingsApplication.class, args);
	}

}
