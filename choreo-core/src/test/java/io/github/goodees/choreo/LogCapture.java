package io.github.goodees.choreo;

/*-
 * #%L
 * choreo
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import org.junit.rules.ExternalResource;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects log events of a logger at or above given level for the duration of a test.
 */
public class LogCapture extends ExternalResource {
    private final String loggerName;
    private final Level threshold;
    private final List<ILoggingEvent> events = new ArrayList<>();
    private final AppenderBase<ILoggingEvent> appender = new AppenderBase<ILoggingEvent>() {
        @Override
        protected void append(ILoggingEvent event) {
            if (event.getLevel().isGreaterOrEqual(threshold)) {
                synchronized (events) {
                    events.add(event);
                }
            }
        }
    };

    public LogCapture(Class<?> loggerClass, Level threshold) {
        this(loggerClass.getName(), threshold);
    }

    public LogCapture(String loggerName, Level threshold) {
        this.loggerName = loggerName;
        this.threshold = threshold;
    }

    private Logger logger() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        return ctx.getLogger(loggerName);
    }

    @Override
    protected void before() {
        appender.start();
        logger().addAppender(appender);
    }

    @Override
    protected void after() {
        logger().detachAppender(appender);
        appender.stop();
    }

    public List<String> messages(Level level) {
        synchronized (events) {
            return events.stream()
                    .filter(e -> e.getLevel() == level)
                    .map(ILoggingEvent::getFormattedMessage)
                    .collect(Collectors.toList());
        }
    }
}
