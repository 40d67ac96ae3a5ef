package com.di.bqtarget;

import com.di.bqtarget.exception.ErrorCategory;
import com.di.bqtarget.runner.TargetRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class BqTargetApplication {

	public static void main(String[] args) {
		int exitCode = 0;
		ConfigurableApplicationContext ctx = null;
		try {
			ctx = SpringApplication.run(BqTargetApplication.class, args);
			// Stdin carries the Singer stream; stdout is reserved for checkpoint lines.
			ctx.getBean(TargetRunner.class).run(System.in);
		} catch (Exception e) {
			ErrorCategory category = ErrorCategory.categorize(e);
			log.error("[TARGET] run failed [{}: {}]: {}", category, category.getDescription(), e.getMessage(), e);
			exitCode = 1;
		} finally {
			if (ctx != null) {
				final int code = exitCode;
				exitCode = SpringApplication.exit(ctx, () -> code);
			}
		}
		System.exit(exitCode);
	}
}
