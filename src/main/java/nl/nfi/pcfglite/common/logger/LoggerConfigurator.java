package nl.nfi.pcfglite.common.logger;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.tyler.TylerConfiguratorBase;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeAndTimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;

import java.net.InetAddress;
import java.net.UnknownHostException;

// stdout carries candidates and scores, so logging goes to stderr or, when a
// LOG_DIRECTORY_PATH system property is given, to rolling files per host
public final class LoggerConfigurator extends TylerConfiguratorBase implements Configurator {

    static {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
    }

    public static final String LOG_DIRECTORY_PROPERTY = "LOG_DIRECTORY_PATH";

    private static final String LOG_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} -%kvp- %msg%n";

    @Override
    public ExecutionStatus configure(final LoggerContext loggerContext) {
        setContext(loggerContext);

        final String logDirectoryPath = System.getProperty(LOG_DIRECTORY_PROPERTY);
        final Appender<ILoggingEvent> appender = logDirectoryPath == null
                ? createConsoleAppender()
                : createFileAppender(logDirectoryPath);

        final Logger root = setupLogger("ROOT", logDirectoryPath == null ? "INFO" : "DEBUG", null);
        root.addAppender(appender);

        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    private Appender<ILoggingEvent> createConsoleAppender() {
        final ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("CONSOLE");
        appender.setTarget("System.err");
        return startWithEncoder(appender);
    }

    private Appender<ILoggingEvent> createFileAppender(final String logDirectoryPath) {
        final String host = hostname();

        final RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(logDirectoryPath + "/" + host + ".log");

        final SizeAndTimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new SizeAndTimeBasedRollingPolicy<>();
        rollingPolicy.setContext(context);
        rollingPolicy.setFileNamePattern(logDirectoryPath + "/" + host + ".%d{yyyy-MM-dd}.%i.gz");
        rollingPolicy.setMaxFileSize(FileSize.valueOf("1GB"));
        rollingPolicy.setMaxHistory(30);
        rollingPolicy.setTotalSizeCap(FileSize.valueOf("1GB"));
        rollingPolicy.setParent(appender);
        rollingPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        return startWithEncoder(appender);
    }

    private Appender<ILoggingEvent> startWithEncoder(final OutputStreamAppender<ILoggingEvent> appender) {
        final PatternLayoutEncoder layoutEncoder = new PatternLayoutEncoder();
        layoutEncoder.setContext(context);
        layoutEncoder.setPattern(LOG_PATTERN);
        layoutEncoder.setParent(appender);
        layoutEncoder.start();

        appender.setEncoder(layoutEncoder);
        appender.start();
        return appender;
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (final UnknownHostException e) {
            // only used to name the log file
            return "localhost";
        }
    }
}
