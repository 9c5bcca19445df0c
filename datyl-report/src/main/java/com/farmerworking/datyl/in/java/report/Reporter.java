package com.farmerworking.datyl.in.java.report;

import com.farmerworking.datyl.in.java.common.Status;
import com.farmerworking.datyl.in.java.common.StreamException;
import com.farmerworking.datyl.in.java.file.Env;
import com.farmerworking.datyl.in.java.file.LineSource;
import com.farmerworking.datyl.in.java.file.WritableFile;
import com.farmerworking.datyl.in.java.file.impl.DefaultEnv;
import com.farmerworking.datyl.in.java.report.impl.Slf4jReportLogger;
import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Logs report lines as they arrive and keeps a playback copy, so an
 * abbreviated written report can be produced at the end.
 *
 * <p>Every non-empty line is logged as {@code "<title>: <line>"}; the subtitle
 * only shows up in the written report. When more than
 * {@link #getMaxLinesToWrite()} lines were reported, the written report keeps
 * the first and last halves and elides the middle.
 */
public class Reporter {
    private static int maxLinesToWrite = 2000;

    private final String title;
    private final String subtitle;
    private final Env env;
    private final ReportLogger logger;
    private final String playbackFile;
    private final WritableFile playback;
    private final long start;

    private int counter;
    private long finish;
    private boolean closed;

    public Reporter(String title) {
        this(title, null);
    }

    public Reporter(String title, String subtitle) {
        this(title, subtitle, new DefaultEnv(), new Slf4jReportLogger(Reporter.class.getName()));
    }

    public Reporter(String title, String subtitle, Env env, ReportLogger logger) {
        this.title = Preconditions.checkNotNull(title, "title");
        this.subtitle = subtitle;
        this.env = env;
        this.logger = logger;
        this.start = System.nanoTime();
        this.finish = -1;
        this.counter = 0;
        this.closed = false;

        Pair<Status, String> tempPair = env.newTempFile(playbackPrefix(title));
        if (tempPair.getKey().isNotOk()) {
            logger.log(Severity.ERROR, "Fatal error in reporter: " + tempPair.getKey());
            throw new StreamException(tempPair.getKey());
        }
        this.playbackFile = tempPair.getValue();

        Pair<Status, WritableFile> filePair = env.newWritableFile(playbackFile);
        if (filePair.getKey().isNotOk()) {
            logger.log(Severity.ERROR, "Fatal error in reporter: " + filePair.getKey());
            env.delete(playbackFile);
            throw new StreamException(filePair.getKey());
        }
        this.playback = filePair.getValue();
    }

    static String playbackPrefix(String title) {
        return "report-" + Arrays.stream(StringUtils.split(title))
                .map(word -> word.replaceAll("[^a-zA-Z0-9]", "").toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("-")) + "-";
    }

    public static int getMaxLinesToWrite() {
        return maxLinesToWrite;
    }

    public static void setMaxLinesToWrite(int max) {
        Preconditions.checkArgument(max > 0, "max lines to write must be positive, got %s", max);
        maxLinesToWrite = max;
    }

    public String getTitle() {
        return title;
    }

    public String getSubtitle() {
        return subtitle;
    }

    // Number of lines reported so far.
    public int getCounter() {
        return counter;
    }

    public boolean isInteresting() {
        return counter > 0;
    }

    public void info(String... lines) {
        report(Severity.INFO, lines);
    }

    public void warn(String... lines) {
        report(Severity.WARN, lines);
    }

    public void err(String... lines) {
        report(Severity.ERROR, lines);
    }

    // Stamp the report as finished; the heading then carries the elapsed time.
    public void done() {
        finish = System.nanoTime();
    }

    public String heading() {
        StringBuilder builder = new StringBuilder(title);
        if (subtitle != null) {
            builder.append(": ").append(subtitle);
        }
        if (finish >= 0) {
            builder.append(String.format(Locale.ROOT, " (%3.2f seconds)", (finish - start) / 1e9));
        }
        return builder.toString();
    }

    /**
     * Yield the written report line by line: the heading, its underline, the
     * body (possibly truncated in the middle) and a trailing blank line.
     */
    public void each(Consumer<String> visitor) {
        checkOpen();
        Status status = playback.flush();
        if (status.isNotOk()) {
            throw new StreamException(status);
        }

        String heading = heading();
        visitor.accept(heading);
        visitor.accept(StringUtils.repeat(':', heading.length()));

        int max = maxLinesToWrite;
        int top = max / 2 + max % 2;
        int bottom = max / 2;
        boolean truncate = counter > max;

        if (truncate) {
            visitor.accept(String.format("Note: %d of %d lines were discarded - see the system log for the complete report.",
                    counter - max, counter));
        }

        Pair<Status, LineSource> sourcePair = env.newLineSource(playbackFile);
        if (sourcePair.getKey().isNotOk()) {
            throw new StreamException(sourcePair.getKey());
        }

        LineSource source = sourcePair.getValue();
        try {
            int index = 0;
            while (!source.isEof()) {
                Pair<Status, String> linePair = source.readLine();
                if (linePair.getKey().isNotOk()) {
                    throw new StreamException(linePair.getKey());
                }
                if (linePair.getValue() == null) {
                    break;
                }

                if (!truncate || index < top || index >= counter - bottom) {
                    visitor.accept(linePair.getValue());
                }
                if (truncate && index == top - 1) {
                    visitor.accept(" ...");
                }
                index++;
            }
        } finally {
            source.close();
        }

        visitor.accept("");
    }

    public void write(PrintStream out) {
        each(out::println);
    }

    public static void note(String message, PrintStream out) {
        note(new Slf4jReportLogger(Reporter.class.getName()), message, out);
    }

    public static void note(ReportLogger logger, String message, PrintStream out) {
        logger.log(Severity.INFO, message);
        out.println(message);
    }

    // Drop the playback copy. The report can not be written afterwards.
    public Status close() {
        if (closed) {
            return Status.OK();
        }
        closed = true;

        Status status = playback.close();
        Status deleteStatus = env.delete(playbackFile).getKey();
        return status.isOk() ? deleteStatus : status;
    }

    public boolean isClosed() {
        return closed;
    }

    private void report(Severity severity, String... lines) {
        checkOpen();
        if (lines.length == 0) {
            append("");
            return;
        }

        for (String line : lines) {
            if (StringUtils.isNotEmpty(line)) {
                logger.log(severity, title + ": " + line);
            }
            append(line == null ? "" : line);
        }
    }

    private void append(String line) {
        Status status = playback.append(line + "\n");
        if (status.isNotOk()) {
            throw new StreamException(status);
        }
        counter++;
    }

    private void checkOpen() {
        if (closed) {
            throw new StreamException(Status.UsageError(String.format("report %s has been closed", title)));
        }
    }
}
