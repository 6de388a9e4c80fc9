/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.util;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import org.slf4j.MDC;

/**
 * Manages the Mapped Diagnostic Context (MDC) properties that identify the connector on whose behalf a thread logs.
 */
public class LoggingContext {

    /**
     * The key for the connector type MDC property.
     */
    public static final String CONNECTOR_TYPE = "logrepl.connectorType";
    /**
     * The key for the connector logical name MDC property.
     */
    public static final String CONNECTOR_NAME = "logrepl.connectorName";
    /**
     * The key for the connector context MDC property.
     */
    public static final String CONNECTOR_CONTEXT = "logrepl.connectorContext";

    private LoggingContext() {
    }

    /**
     * A snapshot of an MDC context that can be {@link #restore() restored} later.
     */
    public static final class PreviousContext {
        private static final Map<String, String> EMPTY_CONTEXT = Collections.emptyMap();
        private final Map<String, String> context;

        PreviousContext() {
            Map<String, String> context = MDC.getCopyOfContextMap();
            this.context = context != null ? context : EMPTY_CONTEXT;
        }

        public void restore() {
            MDC.setContextMap(context);
        }
    }

    /**
     * Configure the MDC of the calling thread for the given connector.
     *
     * @param connectorType the type of connector; may not be null
     * @param connectorName the logical name of the connector; may not be null
     * @param contextName the name of the context, e.g. {@code streaming}; may not be null
     * @return the previous MDC context; never null
     */
    public static PreviousContext forConnector(String connectorType, String connectorName, String contextName) {
        Objects.requireNonNull(connectorType, "The MDC value for the connector type may not be null");
        Objects.requireNonNull(connectorName, "The MDC value for the connector name may not be null");
        Objects.requireNonNull(contextName, "The MDC value for the connector context may not be null");

        PreviousContext previous = new PreviousContext();
        MDC.put(CONNECTOR_TYPE, connectorType);
        MDC.put(CONNECTOR_NAME, connectorName);
        MDC.put(CONNECTOR_CONTEXT, contextName);
        return previous;
    }

    /**
     * Capture the MDC of the calling thread without changing it.
     */
    public static PreviousContext current() {
        return new PreviousContext();
    }
}
