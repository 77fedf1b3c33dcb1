package com.securefile.logging;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bridges {@code System.out}/{@code System.err} into the shared logger, one record per line.
 * Each record carries {@link #STDOUT} or {@link #STDERR} as its source class so console noise
 * can be told apart from the application's own records.
 */
final class ConsoleOutputRedirector {

    static final String STDOUT = "System.out";
    static final String STDERR = "System.err";

    private static final Object LOCK = new Object();
    private static PrintStream originalOut;
    private static PrintStream originalErr;

    private ConsoleOutputRedirector() {
    }

    static void redirect(Logger logger) {
        synchronized (LOCK) {
            if (originalOut != null) {
                return;
            }
            originalOut = System.out;
            originalErr = System.err;
            System.setOut(bridge(logger, Level.INFO, STDOUT));
            System.setErr(bridge(logger, Level.SEVERE, STDERR));
        }
    }

    /**
     * Emits any unterminated line and puts the original console streams back.
     */
    static void restore() {
        synchronized (LOCK) {
            if (originalOut == null) {
                return;
            }
            System.out.flush();
            System.err.flush();
            System.setOut(originalOut);
            System.setErr(originalErr);
            originalOut = null;
            originalErr = null;
        }
    }

    static PrintStream bridge(Logger logger, Level level, String origin) {
        return new PrintStream(new ConsoleLineStream(logger, level, origin), true, StandardCharsets.UTF_8);
    }

    /**
     * Splits bytes on LF, CR or CRLF. Bytes are kept until the line ends, so multi-byte
     * characters are decoded whole.
     */
    private static final class ConsoleLineStream extends OutputStream {
        private final Logger logger;
        private final Level level;
        private final String origin;
        private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);
        private boolean afterCarriageReturn;

        ConsoleLineStream(Logger logger, Level level, String origin) {
            this.logger = logger;
            this.level = level;
            this.origin = origin;
        }

        @Override
        public synchronized void write(int b) {
            if (b == '\n') {
                if (!afterCarriageReturn) {
                    endLine();
                }
                afterCarriageReturn = false;
            } else if (b == '\r') {
                endLine();
                afterCarriageReturn = true;
            } else {
                afterCarriageReturn = false;
                line.write(b);
            }
        }

        @Override
        public synchronized void write(byte[] b, int off, int len) {
            for (int i = off; i < off + len; i++) {
                write(b[i]);
            }
        }

        @Override
        public synchronized void flush() {
            endLine();
        }

        private void endLine() {
            if (line.size() == 0) {
                return;
            }
            String text = line.toString(StandardCharsets.UTF_8);
            line.reset();
            logger.logp(level, origin, null, text);
        }
    }
}
