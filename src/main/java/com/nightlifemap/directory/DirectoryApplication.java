package com.nightlifemap.directory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class DirectoryApplication {

	private static final Logger logger = LoggerFactory.getLogger(DirectoryApplication.class);

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(DirectoryApplication.class);
		app.run(args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Directory backend listening on port {}", event.getWebServer().getPort());
	}

}
