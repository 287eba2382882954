/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.spi.AbstractLogger;
import org.apache.logging.log4j.spi.ExtendedLoggerWrapper;

import java.io.Serializable;

/**
 * Logger with two families of methods:
 * <ul>
 *     <li>{@code xxxOp} methods log in the scope of the operator itself</li>
 *     <li>{@code xxxCr} methods log in the scope of a single reconciliation. The message is prefixed with the
 *     reconciliation description and the reconciliation marker is attached to the log event.</li>
 * </ul>
 */
public class ReconciliationLogger implements Serializable {
    private static final long serialVersionUID = 4517393065391474212L;

    private static final String FQCN = ReconciliationLogger.class.getName();

    /**
     * Wrapped logger which we extend
     */
    private final ExtendedLoggerWrapper logger;

    protected ReconciliationLogger(final Logger logger) {
        this.logger = new ExtendedLoggerWrapper((AbstractLogger) logger, logger.getName(), logger.getMessageFactory());
    }

    /**
     * Returns a custom Logger using the fully qualified name of the Class as the Logger name.
     *
     * @param loggerName The Class whose name should be used as the Logger name.
     *
     * @return The custom Logger.
     */
    public static ReconciliationLogger create(final Class<?> loggerName) {
        return new ReconciliationLogger(LogManager.getLogger(loggerName));
    }

    /**
     * Returns a custom Logger with the specified name.
     *
     * @param name The logger name.
     *
     * @return The custom Logger.
     */
    public static ReconciliationLogger create(final String name) {
        return new ReconciliationLogger(LogManager.getLogger(name));
    }

    private void logOp(final Level level, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, level, null, message, params);
    }

    private void logOp(final Level level, final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, level, null, message, t);
    }

    private void logCr(final Level level, final Reconciliation reconciliation, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, level, reconciliation.getMarker(), reconciliation.toString() + ": " + message, params);
    }

    private void logCr(final Level level, final Reconciliation reconciliation, final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, level, reconciliation.getMarker(), reconciliation.toString() + ": " + message, t);
    }

    //////////////////////////////
    // Operator scope
    //////////////////////////////

    public void traceOp(final String message, final Object... params) {
        logOp(Level.TRACE, message, params);
    }

    public void debugOp(final String message, final Object... params) {
        logOp(Level.DEBUG, message, params);
    }

    public void debugOp(final String message, final Throwable t) {
        logOp(Level.DEBUG, message, t);
    }

    public void infoOp(final String message, final Object... params) {
        logOp(Level.INFO, message, params);
    }

    public void warnOp(final String message, final Object... params) {
        logOp(Level.WARN, message, params);
    }

    public void warnOp(final String message, final Throwable t) {
        logOp(Level.WARN, message, t);
    }

    public void errorOp(final String message, final Object... params) {
        logOp(Level.ERROR, message, params);
    }

    public void errorOp(final String message, final Throwable t) {
        logOp(Level.ERROR, message, t);
    }

    //////////////////////////////
    // Reconciliation scope
    //////////////////////////////

    public void traceCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.TRACE, reconciliation, message, params);
    }

    public void debugCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.DEBUG, reconciliation, message, params);
    }

    public void debugCr(final Reconciliation reconciliation, final String message, final Throwable t) {
        logCr(Level.DEBUG, reconciliation, message, t);
    }

    public void infoCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.INFO, reconciliation, message, params);
    }

    public void warnCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.WARN, reconciliation, message, params);
    }

    public void warnCr(final Reconciliation reconciliation, final String message, final Throwable t) {
        logCr(Level.WARN, reconciliation, message, t);
    }

    public void errorCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.ERROR, reconciliation, message, params);
    }

    public void errorCr(final Reconciliation reconciliation, final String message, final Throwable t) {
        logCr(Level.ERROR, reconciliation, message, t);
    }

    /**
     * @return  True if debug logging is enabled. False otherwise.
     */
    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    /**
     * @return  True if trace logging is enabled. False otherwise.
     */
    public boolean isTraceEnabled() {
        return logger.isTraceEnabled();
    }
}
