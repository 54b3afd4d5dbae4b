package com.example.brsr;

import com.example.brsr.config.ExtractionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ExtractionProperties.class)
public class BrsrExtractionApplication {

	public static void main(String[] args) {
		SpringApplication.run(BrsrExtractionApplication.class, args);
	}

}
