package org.flowvault.logging;

import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

/**
 * Records the log events of each test on the root logger and injects them as a
 * {@link CapturedLogs} parameter, so a test can assert the warnings it expects.
 * <p>
 * Only events that pass the configured logger levels are recorded ({@code logback-test.xml}
 * keeps WARN and above).
 */
public class LogCaptureExtension implements BeforeEachCallback, AfterEachCallback, ParameterResolver {

    private static final ExtensionContext.Namespace NAMESPACE =
        ExtensionContext.Namespace.create(LogCaptureExtension.class);
    private static final String APPENDER_KEY = "appender";

    @Override
    public void beforeEach(ExtensionContext context) {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.setName("captured-" + context.getUniqueId());
        appender.start();
        rootLogger().addAppender(appender);
        context.getStore(NAMESPACE).put(APPENDER_KEY, appender);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        ListAppender<?> appender = context.getStore(NAMESPACE).remove(APPENDER_KEY, ListAppender.class);
        if (appender != null) {
            rootLogger().detachAppender(appender.getName());
            appender.stop();
        }
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return parameterContext.getParameter().getType() == CapturedLogs.class;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return new CapturedLogs(extensionContext.getStore(NAMESPACE).get(APPENDER_KEY, ListAppender.class));
    }

    private static Logger rootLogger() {
        return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
}
