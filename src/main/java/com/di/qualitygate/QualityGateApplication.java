package com.di.qualitygate;

import com.di.qualitygate.batch.BatchRunOrchestrator;
import com.di.qualitygate.config.QualityGateProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class QualityGateApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(QualityGateApplication.class, args);
		// Scheduled deployments set run-on-startup; otherwise runs are triggered over REST.
		if (ctx.getBean(QualityGateProperties.class).getBatch().isRunOnStartup()) {
			ctx.getBean(BatchRunOrchestrator.class).runBatch();
		}
	}
}
