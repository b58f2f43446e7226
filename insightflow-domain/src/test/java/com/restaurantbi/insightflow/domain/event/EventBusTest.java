package com.restaurantbi.insightflow.domain.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    @Test
    void testDeliversMatchingEventsInOrderAndIsolatesFailingListeners() {
        EventBus bus = new EventBus();
        List<String> succeeded = new ArrayList<>();
        List<Long> all = new ArrayList<>();
        bus.subscribe(event -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe(EventMatcher.ofType(Event.TASK_SUCCEEDED), event -> succeeded.add(event.getTaskId()));
        bus.subscribe(event -> all.add(event.getSequence()));

        bus.publish(Event.builder().type("task.running").taskId("forecast").sequence(1).build());
        bus.publish(Event.builder().type(Event.TASK_SUCCEEDED).taskId("forecast").sequence(2).build());

        assertEquals(List.of("forecast"), succeeded);
        assertEquals(List.of(1L, 2L), all);
    }

    @Test
    void testTypeNamesFollowStates() {
        assertEquals("run.retraining_queued",
                Event.runType(com.restaurantbi.insightflow.domain.run.RunState.RETRAINING_QUEUED));
        assertEquals("task.retry_wait", Event.taskType(com.restaurantbi.insightflow.domain.run.TaskState.RETRY_WAIT));
    }
}
