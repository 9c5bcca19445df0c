package com.farmerworking.datyl.in.java.report.impl;

import com.farmerworking.datyl.in.java.report.ReportLogger;
import com.farmerworking.datyl.in.java.report.Severity;
import com.google.gson.Gson;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.slf4j.LoggerFactory;
import org.slf4j.impl.Log4jLoggerAdapter;

import java.lang.reflect.Field;

public class Slf4jReportLogger implements ReportLogger {
    static final String PATTERN = "%d %-5p [%c{1}] %m%n";

    private final Gson gson;
    private final org.slf4j.Logger logger;

    public Slf4jReportLogger(String name) {
        this.logger = LoggerFactory.getLogger(name);
        this.gson = new Gson();
    }

    // Send everything logged under this name to logFile instead of the configured appenders.
    public Slf4jReportLogger(String name, String logFile) {
        this(name);

        try {
            if (this.logger instanceof Log4jLoggerAdapter) {
                Log4jLoggerAdapter adapter = (Log4jLoggerAdapter) this.logger;
                Field field = Log4jLoggerAdapter.class.getDeclaredField("logger");
                field.setAccessible(true);

                Logger log4jLogger = (Logger) field.get(adapter);
                log4jLogger.removeAllAppenders();
                log4jLogger.setAdditivity(false);
                log4jLogger.setLevel(Level.INFO);

                FileAppender appender = new FileAppender();
                appender.setName(name);
                appender.setFile(logFile);
                appender.setLayout(new PatternLayout(PATTERN));
                appender.setThreshold(Level.INFO);
                appender.setAppend(true);
                appender.activateOptions();

                log4jLogger.addAppender(appender);
            }
        } catch (Exception e) {
            throw new RuntimeException("create report logger error", e);
        }
    }

    @Override
    public void log(Severity severity, String msg, String... args) {
        String line = args.length == 0 ? msg : String.format("%s, args: %s", msg, gson.toJson(args));

        switch (severity) {
            case INFO:
                logger.info(line);
                break;
            case WARN:
                logger.warn(line);
                break;
            default:
                logger.error(line);
        }
    }
}
