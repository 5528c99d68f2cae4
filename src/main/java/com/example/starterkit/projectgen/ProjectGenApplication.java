package com.example.starterkit.projectgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProjectGenApplication {

	public static void main(String[] args) {
		SpringApplication.run(ProjectGenApplication.class, args);
	}

}
