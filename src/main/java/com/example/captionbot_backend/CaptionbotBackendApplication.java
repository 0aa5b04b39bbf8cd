package com.example.captionbot_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CaptionbotBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(CaptionbotBackendApplication.class, args);
	}

}
