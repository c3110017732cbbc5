package com.phillippitts.windpressure.testutil;

import com.phillippitts.windpressure.service.orchestration.event.CorrectionCompletedEvent;
import com.phillippitts.windpressure.service.orchestration.event.CorrectionProgressEvent;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 *
 * <p>Thread-safe implementation using CopyOnWriteArrayList for concurrent test scenarios.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    /**
     * @return completion events in publication order
     */
    public List<CorrectionCompletedEvent> completedEvents() {
        return events.stream()
                .filter(e -> e instanceof CorrectionCompletedEvent)
                .map(e -> (CorrectionCompletedEvent) e)
                .toList();
    }

    /**
     * @return stages of the captured progress events in publication order
     */
    public List<CorrectionProgressEvent.Stage> progressStages() {
        return events.stream()
                .filter(e -> e instanceof CorrectionProgressEvent)
                .map(e -> ((CorrectionProgressEvent) e).stage())
                .toList();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
