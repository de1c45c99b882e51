package com.onextel.CampaignDialerApplication;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class CampaignDialerApplication {

	public static void main(String[] args) {
		SpringApplication.run(CampaignDialerApplication.class, args);
	}

}
