package com.buildingsync.service;

import com.buildingsync.model.ChangeKind;
import com.buildingsync.model.ChangeNotification;
import com.buildingsync.model.ChangeRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeNotifierTest {
    
    private static ChangeNotification notification(long cycle, String... keys) {
        List<ChangeRecord> changes = new ArrayList<>();
        for (String key : keys) {
            changes.add(ChangeRecord.of(key, ChangeKind.NEW, null));
        }
        return ChangeNotification.of(cycle, Instant.EPOCH, changes);
    }
    
    @Test
    void testListenersCalledInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        ChangeNotifier notifier = new ChangeNotifier();
        notifier.subscribe(n -> calls.add("first"));
        notifier.subscribe(n -> calls.add("second"));
        
        notifier.publish(notification(1, "A"));
        
        assertEquals(List.of("first", "second"), calls);
        assertEquals(1, notifier.getLastNotification().orElseThrow().getCycle());
    }
    
    @Test
    void testEmptyNotificationIsNotPublished() {
        List<ChangeNotification> received = new ArrayList<>();
        ChangeNotifier notifier = new ChangeNotifier(List.of(received::add));
        
        notifier.publish(notification(1));
        notifier.publish(null);
        
        assertTrue(received.isEmpty());
        assertTrue(notifier.getLastNotification().isEmpty());
    }
    
    @Test
    void testFailingListenerDoesNotStopOthers() {
        List<ChangeNotification> received = new ArrayList<>();
        ChangeNotifier notifier = new ChangeNotifier();
        notifier.subscribe(n -> {
            throw new IllegalStateException("renderer gone");
        });
        notifier.subscribe(received::add);
        
        notifier.publish(notification(7, "A", "B"));
        
        assertEquals(1, received.size());
        assertEquals(List.of("A", "B"), received.get(0).getKeys());
    }
    
    @Test
    void testUnsubscribe() {
        List<ChangeNotification> received = new ArrayList<>();
        ChangeListener listener = received::add;
        ChangeNotifier notifier = new ChangeNotifier();
        notifier.subscribe(listener);
        
        assertTrue(notifier.unsubscribe(listener));
        notifier.publish(notification(1, "A"));
        
        assertTrue(received.isEmpty());
        assertEquals(0, notifier.listenerCount());
    }
}
