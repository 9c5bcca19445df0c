package com.farmerworking.datyl.in.java.reconcile;

import com.farmerworking.datyl.in.java.api.Fields;
import com.farmerworking.datyl.in.java.common.Status;
import com.farmerworking.datyl.in.java.common.StreamException;
import com.farmerworking.datyl.in.java.config.Config;
import com.farmerworking.datyl.in.java.file.Env;
import com.farmerworking.datyl.in.java.file.LineSource;
import com.farmerworking.datyl.in.java.file.impl.DefaultEnv;
import com.farmerworking.datyl.in.java.report.Reporter;
import com.farmerworking.datyl.in.java.report.impl.Slf4jReportLogger;
import com.farmerworking.datyl.in.java.stream.Streams;
import com.farmerworking.datyl.in.java.stream.UniqueStream;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

// Usage: ReconcileTool <left-file> <right-file> [<config-file> [<section>]]
public class ReconcileTool {
    private static final Logger logger = LoggerFactory.getLogger(ReconcileTool.class);

    static final int IDENTICAL = 0;
    static final int DIFFERENT = 1;
    static final int ERROR = 2;

    static final String DEFAULT_SECTION = "reconcile";
    static final String MAX_REPORT_LINES = "max_report_lines";

    private final Env env;
    private final PrintStream out;
    private final PrintStream err;

    public ReconcileTool(Env env, PrintStream out, PrintStream err) {
        this.env = env;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new ReconcileTool(new DefaultEnv(), System.out, System.err).run(args));
    }

    // The configured report size applies to this run only.
    public int run(String... args) {
        int maxLinesToWrite = Reporter.getMaxLinesToWrite();
        try {
            return doRun(args);
        } finally {
            Reporter.setMaxLinesToWrite(maxLinesToWrite);
        }
    }

    private int doRun(String... args) {
        if (args.length < 2 || args.length > 4) {
            err.println("usage: ReconcileTool <left-file> <right-file> [<config-file> [<section>]]");
            return ERROR;
        }

        if (args.length >= 3) {
            Status status = configure(args[2], args.length == 4 ? args[3] : DEFAULT_SECTION);
            if (status.isNotOk()) {
                err.println(status);
                return ERROR;
            }
        }

        LineSource leftSource = null;
        LineSource rightSource = null;
        try {
            Pair<Status, LineSource> leftPair = env.newLineSource(args[0]);
            if (leftPair.getKey().isNotOk()) {
                err.println(leftPair.getKey());
                return ERROR;
            }
            leftSource = leftPair.getValue();

            Pair<Status, LineSource> rightPair = env.newLineSource(args[1]);
            if (rightPair.getKey().isNotOk()) {
                err.println(rightPair.getKey());
                return ERROR;
            }
            rightSource = rightPair.getValue();

            return reconcile(args[0], leftSource, args[1], rightSource);
        } finally {
            if (leftSource != null) {
                warnIfNotOk(args[0], leftSource.close());
            }
            if (rightSource != null) {
                warnIfNotOk(args[1], rightSource.close());
            }
        }
    }

    private void warnIfNotOk(String name, Status status) {
        if (status.isNotOk()) {
            logger.warn("close {} failed: {}", name, status);
        }
    }

    private int reconcile(String leftName, LineSource leftSource, String rightName, LineSource rightSource) {
        UniqueStream<String, Fields> left = Streams.unique(Streams.dataFile(leftSource));
        UniqueStream<String, Fields> right = Streams.unique(Streams.dataFile(rightSource));

        Reporter reporter;
        try {
            reporter = new Reporter("Reconcile", leftName + " vs " + rightName, env,
                    new Slf4jReportLogger(Reporter.class.getName()));
        } catch (StreamException e) {
            err.println(e.getMessage());
            return ERROR;
        }

        try {
            ReconcileStats stats = new Reconciler(reporter).reconcile(leftName, left, rightName, right);
            reporter.done();
            logger.info("reconciled {} against {}: {}", leftName, rightName, stats);

            reporter.info(String.format("%d matched, %d changed, %d only in %s, %d only in %s",
                    stats.getMatched(), stats.getChanged(), stats.getLeftOnly(), leftName, stats.getRightOnly(), rightName));
            reporter.write(out);
            return stats.isIdentical() ? IDENTICAL : DIFFERENT;
        } catch (StreamException e) {
            logger.error("reconcile {} against {} failed", leftName, rightName, e);
            err.println(e.getMessage());
            return ERROR;
        } finally {
            warnIfNotOk("report playback file", reporter.close());
        }
    }

    private Status configure(String configFile, String section) {
        Pair<Status, Config> pair = Config.load(env, configFile, section);
        if (pair.getKey().isNotOk()) {
            return pair.getKey();
        }

        Config config = pair.getValue();
        if (config.containsKey(MAX_REPORT_LINES)) {
            Long max;
            try {
                max = config.getLong(MAX_REPORT_LINES);
            } catch (IllegalArgumentException e) {
                return Status.InvalidArgument(e.getMessage());
            }
            if (max == null || max <= 0 || max > Integer.MAX_VALUE) {
                return Status.InvalidArgument(String.format("%s must be a positive integer, got %s", MAX_REPORT_LINES, max));
            }
            Reporter.setMaxLinesToWrite(max.intValue());
        }
        return Status.OK();
    }
}
