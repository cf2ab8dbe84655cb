/*
 * Copyright (c) 2016-2024 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package pulse.util;

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Matcher;

import pulse.util.annotation.Nullable;

/**
 * Expose static methods to get a logger depending on the environment. If SLF4J is on the
 * classpath, it will be used. Otherwise a Console logger is used, printing
 * {@link Logger#error(String) ERROR} and {@link Logger#warn(String) WARN} levels to
 * {@link System#err} and levels below to {@link System#out}.
 * <p>
 * The console fallback omits TRACE and DEBUG unless the {@value #FALLBACK_PROPERTY}
 * {@link System#setProperty(String, String) System property} is set to "{@code VERBOSE}".
 * <p>
 * One can also force the implementation by using the "useXXX" static methods:
 * {@link #useConsoleLoggers()}, {@link #useVerboseConsoleLoggers()},
 * {@link #useCustomLoggers(Function)} and {@link #useSl4jLoggers()} (which throws if
 * SLF4J isn't on the classpath).
 */
public abstract class Loggers {

	/**
	 * The system property that determines which fallback implementation to use for loggers
	 * when SLF4J isn't available. Use {@code VERBOSE} for console logging including
	 * TRACE and DEBUG levels, anything else for regular Console logging (the default).
	 */
	public static final String FALLBACK_PROPERTY = "pulse.logging.fallback";

	private static volatile Function<String, ? extends Logger> LOGGER_FACTORY;

	static {
		resetLoggerFactory();
	}

	/**
	 * Attempt to activate the best {@link Logger} factory, by first attempting to use the
	 * SLF4J one, then falling back to Console logging.
	 *
	 * @see #useConsoleLoggers()
	 * @see #useVerboseConsoleLoggers()
	 */
	public static void resetLoggerFactory() {
		try {
			useSl4jLoggers();
		}
		catch (Throwable t) {
			if (isVerboseFallback()) {
				useVerboseConsoleLoggers();
			}
			else {
				useConsoleLoggers();
			}
		}
	}

	static boolean isVerboseFallback() {
		return "VERBOSE".equalsIgnoreCase(System.getProperty(FALLBACK_PROPERTY));
	}

	/**
	 * Force the usage of Console-based {@link Logger Loggers}, even if SLF4J is available
	 * on the classpath. All levels <strong>except TRACE and DEBUG</strong> are
	 * considered enabled.
	 */
	public static void useConsoleLoggers() {
		ConsoleLoggerFactory loggerFactory = new ConsoleLoggerFactory(false);
		LOGGER_FACTORY = loggerFactory;
		loggerFactory.apply(Loggers.class.getName()).debug("Using Console logging");
	}

	/**
	 * Force the usage of Console-based {@link Logger Loggers}, even if SLF4J is available
	 * on the classpath. All levels (including TRACE and DEBUG) are considered enabled.
	 */
	public static void useVerboseConsoleLoggers() {
		ConsoleLoggerFactory loggerFactory = new ConsoleLoggerFactory(true);
		LOGGER_FACTORY = loggerFactory;
		loggerFactory.apply(Loggers.class.getName()).debug("Using Verbose Console logging");
	}

	/**
	 * Use a custom type of {@link Logger} created through the provided {@link Function},
	 * which takes a logger name as input. The function must be thread-safe.
	 *
	 * @param loggerFactory the {@link Function} that provides a (possibly cached) {@link Logger}
	 * given a name.
	 */
	public static void useCustomLoggers(final Function<String, ? extends Logger> loggerFactory) {
		LOGGER_FACTORY = loggerFactory;
		loggerFactory.apply(Loggers.class.getName()).debug("Using custom logging");
	}

	/**
	 * Force the usage of SL4J-based {@link Logger Loggers}, throwing an exception if
	 * SLF4J isn't available on the classpath. Prefer using {@link #resetLoggerFactory()}
	 * as it will fallback in the later case.
	 */
	public static void useSl4jLoggers() {
		Function<String, Logger> loggerFactory = new Slf4JLoggerFactory();
		LOGGER_FACTORY = loggerFactory;
		loggerFactory.apply(Loggers.class.getName()).debug("Using Slf4j logging framework");
	}

	/**
	 * Get a {@link Logger}.
	 *
	 * @param name the category or logger name to use
	 * @return a new {@link Logger} instance
	 */
	public static Logger getLogger(String name) {
		return LOGGER_FACTORY.apply(name);
	}

	/**
	 * Get a {@link Logger} named after the given class.
	 *
	 * @param cls the source {@link Class} to derive the logger name from.
	 * @return a new {@link Logger} instance
	 */
	public static Logger getLogger(Class<?> cls) {
		return LOGGER_FACTORY.apply(cls.getName());
	}

	private static class Slf4JLoggerFactory implements Function<String, Logger> {

		@Override
		public Logger apply(String name) {
			return new Slf4JLogger(org.slf4j.LoggerFactory.getLogger(name));
		}
	}

	private static class Slf4JLogger implements Logger {

		private final org.slf4j.Logger logger;

		Slf4JLogger(org.slf4j.Logger logger) {
			this.logger = logger;
		}

		@Override
		public String getName() {
			return logger.getName();
		}

		@Override
		public boolean isTraceEnabled() {
			return logger.isTraceEnabled();
		}

		@Override
		public void trace(String msg) {
			logger.trace(msg);
		}

		@Override
		public void trace(String format, Object... arguments) {
			logger.trace(format, arguments);
		}

		@Override
		public void trace(String msg, Throwable t) {
			logger.trace(msg, t);
		}

		@Override
		public boolean isDebugEnabled() {
			return logger.isDebugEnabled();
		}

		@Override
		public void debug(String msg) {
			logger.debug(msg);
		}

		@Override
		public void debug(String format, Object... arguments) {
			logger.debug(format, arguments);
		}

		@Override
		public void debug(String msg, Throwable t) {
			logger.debug(msg, t);
		}

		@Override
		public boolean isInfoEnabled() {
			return logger.isInfoEnabled();
		}

		@Override
		public void info(String msg) {
			logger.info(msg);
		}

		@Override
		public void info(String format, Object... arguments) {
			logger.info(format, arguments);
		}

		@Override
		public void info(String msg, Throwable t) {
			logger.info(msg, t);
		}

		@Override
		public boolean isWarnEnabled() {
			return logger.isWarnEnabled();
		}

		@Override
		public void warn(String msg) {
			logger.warn(msg);
		}

		@Override
		public void warn(String format, Object... arguments) {
			logger.warn(format, arguments);
		}

		@Override
		public void warn(String msg, Throwable t) {
			logger.warn(msg, t);
		}

		@Override
		public boolean isErrorEnabled() {
			return logger.isErrorEnabled();
		}

		@Override
		public void error(String msg) {
			logger.error(msg);
		}

		@Override
		public void error(String format, Object... arguments) {
			logger.error(format, arguments);
		}

		@Override
		public void error(String msg, Throwable t) {
			logger.error(msg, t);
		}
	}

	/**
	 * A {@link Logger} that has all levels enabled, except TRACE and DEBUG unless
	 * verbose. Error and warn go to the error stream, everything else to the log stream.
	 */
	static final class ConsoleLogger implements Logger {

		private final String      name;
		private final boolean     verbose;
		private final PrintStream log;
		private final PrintStream err;

		ConsoleLogger(String name, boolean verbose, PrintStream log, PrintStream err) {
			this.name = name;
			this.verbose = verbose;
			this.log = log;
			this.err = err;
		}

		@Override
		public String getName() {
			return name;
		}

		@Nullable
		static String format(@Nullable String from, @Nullable Object... arguments) {
			if (from == null || arguments == null || arguments.length == 0) {
				return from;
			}
			String computed = from;
			for (Object argument : arguments) {
				computed = computed.replaceFirst("\\{\\}", Matcher.quoteReplacement(String.valueOf(argument)));
			}
			return computed;
		}

		synchronized void print(PrintStream stream, String level, @Nullable String msg, @Nullable Throwable t) {
			if (t == null) {
				stream.format("[%s] (%s) %s\n", level, Thread.currentThread().getName(), msg);
			}
			else {
				stream.format("[%s] (%s) %s - %s\n", level, Thread.currentThread().getName(), msg, t);
				t.printStackTrace(stream);
			}
		}

		@Override
		public boolean isTraceEnabled() {
			return verbose;
		}

		@Override
		public void trace(String msg) {
			if (verbose) {
				print(log, "TRACE", msg, null);
			}
		}

		@Override
		public void trace(String format, Object... arguments) {
			if (verbose) {
				print(log, "TRACE", format(format, arguments), null);
			}
		}

		@Override
		public void trace(String msg, Throwable t) {
			if (verbose) {
				print(log, "TRACE", msg, t);
			}
		}

		@Override
		public boolean isDebugEnabled() {
			return verbose;
		}

		@Override
		public void debug(String msg) {
			if (verbose) {
				print(log, "DEBUG", msg, null);
			}
		}

		@Override
		public void debug(String format, Object... arguments) {
			if (verbose) {
				print(log, "DEBUG", format(format, arguments), null);
			}
		}

		@Override
		public void debug(String msg, Throwable t) {
			if (verbose) {
				print(log, "DEBUG", msg, t);
			}
		}

		@Override
		public boolean isInfoEnabled() {
			return true;
		}

		@Override
		public void info(String msg) {
			print(log, " INFO", msg, null);
		}

		@Override
		public void info(String format, Object... arguments) {
			print(log, " INFO", format(format, arguments), null);
		}

		@Override
		public void info(String msg, Throwable t) {
			print(log, " INFO", msg, t);
		}

		@Override
		public boolean isWarnEnabled() {
			return true;
		}

		@Override
		public void warn(String msg) {
			print(err, " WARN", msg, null);
		}

		@Override
		public void warn(String format, Object... arguments) {
			print(err, " WARN", format(format, arguments), null);
		}

		@Override
		public void warn(String msg, Throwable t) {
			print(err, " WARN", msg, t);
		}

		@Override
		public boolean isErrorEnabled() {
			return true;
		}

		@Override
		public void error(String msg) {
			print(err, "ERROR", msg, null);
		}

		@Override
		public void error(String format, Object... arguments) {
			print(err, "ERROR", format(format, arguments), null);
		}

		@Override
		public void error(String msg, Throwable t) {
			print(err, "ERROR", msg, t);
		}
	}

	static final class ConsoleLoggerFactory implements Function<String, Logger> {

		final boolean verbose;

		final Map<String, Logger> loggers = new ConcurrentHashMap<>();

		ConsoleLoggerFactory(boolean verbose) {
			this.verbose = verbose;
		}

		@Override
		public Logger apply(String name) {
			return loggers.computeIfAbsent(name,
					n -> new ConsoleLogger(n, verbose, System.out, System.err));
		}
	}

	Loggers() {
	}
}
