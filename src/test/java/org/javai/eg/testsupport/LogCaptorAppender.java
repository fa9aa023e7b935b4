package org.javai.eg.testsupport;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.layout.PatternLayout;

/**
 * Log4j2 appender that records the events of one logger so tests can assert on them.
 * <p>
 * Usage:
 * <pre>
 * try (LogCaptorAppender appender = LogCaptorAppender.create(EgEditor.class, Level.DEBUG)) {
 *     editor.mergeLines(a, b);
 *     assertThat(appender.messages()).anyMatch(msg -> msg.contains("Merged line"));
 * }
 * </pre>
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final Level previousLevel;
	private final boolean addedConfig;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(String name, LoggerContext context, LoggerConfig loggerConfig, Level previousLevel,
			boolean addedConfig, Filter filter, Layout<? extends Serializable> layout) {
		super(name, filter, layout, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.previousLevel = previousLevel;
		this.addedConfig = addedConfig;
	}

	public static LogCaptorAppender create(Class<?> loggerClass, Level level) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig loggerConfig = configuration.getLoggerConfig(loggerName);
		boolean added = false;

		if (!loggerConfig.getName().equals(loggerName)) {
			LoggerConfig childConfig = new LoggerConfig(loggerName, level, true);
			configuration.addLogger(loggerName, childConfig);
			loggerConfig = childConfig;
			added = true;
		}

		Level previousLevel = loggerConfig.getLevel();
		loggerConfig.setLevel(level);

		Layout<? extends Serializable> layout = PatternLayout.newBuilder()
				.withPattern(PatternLayout.SIMPLE_CONVERSION_PATTERN)
				.build();

		LogCaptorAppender appender = new LogCaptorAppender(
				"EgLogCaptor-" + System.nanoTime(),
				context,
				loggerConfig,
				previousLevel,
				added,
				null,
				layout
		);
		appender.start();
		loggerConfig.addAppender(appender, level, null);
		context.updateLoggers();
		return appender;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<LogEvent> events() {
		return Collections.unmodifiableList(events);
	}

	public List<String> messages() {
		return events.stream()
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	public List<String> messagesAt(Level level) {
		return events.stream()
				.filter(e -> e.getLevel() == level)
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		if (addedConfig) {
			context.getConfiguration().removeLogger(loggerConfig.getName());
		} else {
			loggerConfig.setLevel(previousLevel);
		}
		context.updateLoggers();
		events.clear();
	}
}
