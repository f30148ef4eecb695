package org.matrixpng.imageio;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility for logging timing info around image reads and writes
 *
 * @author tonyj
 */
class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    private Timed() {
    }

    /**
     * Run an operation and log how long it took. The elapsed milliseconds are
     * appended to <code>args</code> when formatting the message.
     */
    static <T> T execute(IOOperation<T> operation, String message, Object... args) throws IOException {
        long start = System.nanoTime();
        try {
            return operation.call();
        } finally {
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            LOG.log(DEFAULT_LOG_LEVEL, () -> String.format(message, append(args, elapsed)));
        }
    }

    private static Object[] append(Object[] args, Object... arg) {
        Object[] result = new Object[args.length + arg.length];
        System.arraycopy(args, 0, result, 0, args.length);
        System.arraycopy(arg, 0, result, args.length, arg.length);
        return result;
    }

    @FunctionalInterface
    interface IOOperation<T> {

        T call() throws IOException;
    }
}
