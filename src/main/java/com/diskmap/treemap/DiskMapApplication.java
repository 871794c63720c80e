package com.diskmap.treemap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;

import java.lang.management.ManagementFactory;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@SpringBootApplication
public class DiskMapApplication {

	private static final Logger log = LoggerFactory.getLogger(DiskMapApplication.class);
	private static final long startTime = System.currentTimeMillis();
	private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private final Environment environment;

	public DiskMapApplication(Environment environment) {
		this.environment = environment;
	}

	public static void main(String[] args) {
		String pid = String.valueOf(ManagementFactory.getRuntimeMXBean().getPid());

		log.info("=================================================");
		log.info("Disk Map starting...");
		log.info("PID: {}", pid);
		log.info("Start Time: {}", LocalDateTime.now().format(TIMESTAMP));
		log.info("Java Version: {}", System.getProperty("java.version"));
		log.info("=================================================");

		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			log.info("=================================================");
			log.info("Disk Map stopping...");
			log.info("PID: {}", pid);
			log.info("Shutdown Time: {}", LocalDateTime.now().format(TIMESTAMP));
			log.info("Total Uptime: {}", formatUptime(System.currentTimeMillis() - startTime));
			log.info("=================================================");
		}, "ShutdownHook-Logging"));

		SpringApplication.run(DiskMapApplication.class, args);
	}

	static String formatUptime(long millis) {
		long seconds = millis / 1000;
		long minutes = seconds / 60;
		long hours = minutes / 60;
		long days = hours / 24;

		if (days > 0) {
			return String.format("%dd %dh %dm %ds", days, hours % 24, minutes % 60, seconds % 60);
		} else if (hours > 0) {
			return String.format("%dh %dm %ds", hours, minutes % 60, seconds % 60);
		} else if (minutes > 0) {
			return String.format("%dm %ds", minutes, seconds % 60);
		} else {
			return String.format("%ds", seconds);
		}
	}

	@EventListener(ApplicationReadyEvent.class)
	public void logReady() {
		String port = environment.getProperty("local.server.port", environment.getProperty("server.port", "8080"));
		log.info("=================================================");
		log.info("Disk Map API ready at: http://localhost:{}/api/treemap", port);
		log.info("=================================================");
	}

}
