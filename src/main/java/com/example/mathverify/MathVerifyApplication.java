package com.example.mathverify;

import com.example.mathverify.config.VerificationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(VerificationProperties.class)
public class MathVerifyApplication {

	public static void main(String[] args) {
		SpringApplication.run(MathVerifyApplication.class, args);
	}

}
