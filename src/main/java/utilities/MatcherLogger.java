package utilities;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Static logging facade over java.util.logging. Console output is INFO and above; setting the
 * system property {@value #LOG_FILE_PROPERTY} also appends every level to that file.
 */
public final class MatcherLogger {

    public static final String LOG_FILE_PROPERTY = "ahocorasick.log.file";

    private static final Logger logger = Logger.getLogger(MatcherLogger.class.getName());

    static {
        logger.setUseParentHandlers(false);

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        logger.addHandler(consoleHandler);

        String logFile = System.getProperty(LOG_FILE_PROPERTY);
        if (logFile != null && !logFile.isBlank()) {
            try {
                FileHandler fileHandler = new FileHandler(logFile, true); // append
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
            } catch (Exception e) {
                logger.log(Level.WARNING, "Failed to open log file " + logFile, e);
            }
        }

        logger.setLevel(Level.ALL);
    }

    private MatcherLogger() {
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }
}
