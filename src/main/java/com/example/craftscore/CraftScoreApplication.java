package com.example.craftscore;

import com.example.craftscore.config.ScoringProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ScoringProperties.class)
public class CraftScoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(CraftScoreApplication.class, args);
	}

}
