package com.dlfa.util;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.FileAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.message.StringFormatterMessageFactory;

/**
 * Class storing general utility methods.
 */
public class GeneralUtils {

	public static final String LOG_PATTERN = "%d{HH:mm:ss.SSS} [%t] %-5level %logger{36} - %msg%n";

	private static String logPath = null;

	/**
	 * Returns a logger taking printf-style messages, e.g. <code>LOGGER.info("Read %d lines", n)</code>.
	 * @param clazz
	 * @return
	 */
	public static Logger createLogger(Class<?> clazz){
		return LogManager.getLogger(clazz, new StringFormatterMessageFactory());
	}

	/**
	 * Update current loggers to add an additional appender to the specified log file.<br>
	 * Calling this again with the same path does nothing.
	 * @param logPath
	 */
	public static synchronized void updateLogger(String logPath){
		if(logPath == null || logPath.equals(GeneralUtils.logPath)){
			return;
		}
		final LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
		final Configuration config = ctx.getConfiguration();
		PatternLayout layout = PatternLayout.newBuilder()
								.withPattern(LOG_PATTERN)
								.withConfiguration(config)
								.build();
		FileAppender appender = FileAppender.newBuilder()
								.withFileName(logPath)
								.withAppend(true)
								.setName("File-"+logPath)
								.setLayout(layout)
								.setConfiguration(config)
								.build();
		appender.start();
		config.addAppender(appender);
		LoggerConfig rootConfig = config.getRootLogger();
		rootConfig.addAppender(appender, Level.INFO, null);
		ctx.updateLoggers(config);
		GeneralUtils.logPath = logPath;
	}

}
