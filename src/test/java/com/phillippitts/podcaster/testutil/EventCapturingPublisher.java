package com.phillippitts.podcaster.testutil;

import com.phillippitts.podcaster.service.orchestration.event.PodcastFinishedEvent;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
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

    public List<PodcastFinishedEvent> finishedEvents() {
        return events.stream()
                .filter(e -> e instanceof PodcastFinishedEvent)
                .map(e -> (PodcastFinishedEvent) e)
                .toList();
    }

    public void clear() {
        events.clear();
    }
}
