package de.zeus.planner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Copyright 2025 Guido Zeuner - https://tiny-tool.de
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Class-scoped logging with suppression of identical messages. Planning cycles repeat every few minutes
 * with mostly unchanged input, so a message is written once per window and repeats are only counted.
 * DEBUG messages are never suppressed.
 */
public final class LogFilter {

    private static final long SUPPRESSION_WINDOW_MS = TimeUnit.MINUTES.toMillis(5);

    private static final Map<String, Window> windows = new ConcurrentHashMap<>();

    private LogFilter() {
    }

    public static void logInfo(Class<?> callingClass, String message, Object... args) {
        log(callingClass, Level.INFO, message, args);
    }

    public static void logWarn(Class<?> callingClass, String message, Object... args) {
        log(callingClass, Level.WARN, message, args);
    }

    public static void logError(Class<?> callingClass, String message, Object... args) {
        log(callingClass, Level.ERROR, message, args);
    }

    public static void logDebug(Class<?> callingClass, String message, Object... args) {
        log(callingClass, Level.DEBUG, message, args);
    }

    /**
     * Writes the message unless the same class logged the same message with the same arguments within the
     * suppression window.
     *
     * @param callingClass class whose logger is used
     * @param level        SLF4J level
     * @param message      message template with {} placeholders
     * @param args         template arguments
     */
    public static void log(Class<?> callingClass, Level level, String message, Object... args) {
        Logger logger = LoggerFactory.getLogger(callingClass);
        if (level == Level.DEBUG) {
            if (logger.isDebugEnabled()) {
                logger.debug(message, args);
            }
            return;
        }

        long now = System.currentTimeMillis();
        windows.values().removeIf(w -> now - w.openedAt > SUPPRESSION_WINDOW_MS);

        String key = callingClass.getName() + '|' + message + '|' + Arrays.deepHashCode(args);
        Window window = windows.computeIfAbsent(key, k -> new Window(now));
        int seen = window.hit();
        if (seen > 1) {
            return;
        }
        switch (level) {
            case ERROR:
                logger.error(message, args);
                break;
            case WARN:
                logger.warn(message, args);
                break;
            default:
                logger.info(message, args);
                break;
        }
    }

    /** Number of times the message was requested in its current window, 0 if none is open. */
    public static int occurrences(Class<?> callingClass, String message, Object... args) {
        Window window = windows.get(callingClass.getName() + '|' + message + '|' + Arrays.deepHashCode(args));
        return window == null ? 0 : window.count;
    }

    public static void clearCache() {
        windows.clear();
    }

    private static final class Window {
        private final long openedAt;
        private volatile int count;

        private Window(long openedAt) {
            this.openedAt = openedAt;
        }

        private synchronized int hit() {
            return ++count;
        }
    }
}
