package Common;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Logger da console condiviso da Index Server e Peer.
 * Formato: [HH:mm:ss][LIVELLO][thread] messaggio
 */
public final class Logger {
    private static final DateTimeFormatter formatter = DateTimeFormatter.ofPattern("HH:mm:ss");

    private Logger() {
    }

    public static void info(String msg) {
        System.out.println(format("INFO", msg));
    }

    public static void warn(String msg) {
        System.out.println(format("WARN", msg));
    }

    public static void error(String msg) {
        System.err.println(format("ERROR", msg));
    }

    private static String format(String level, String msg) {
        return "[" + LocalDateTime.now().format(formatter) + "][" + level + "][" + Thread.currentThread().getName() + "] " + msg;
    }
}
