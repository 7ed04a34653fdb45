package com.baykanat.notifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Uygulama giriş noktası; @EnableScheduling ile ledger temizliği. */
@SpringBootApplication
@EnableScheduling
public class NotificationRelayApplication {

	public static void main(String[] args) {
		SpringApplication.run(NotificationRelayApplication.class, args);
	}

}
