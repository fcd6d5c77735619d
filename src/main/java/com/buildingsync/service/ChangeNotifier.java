package com.buildingsync.service;

import com.buildingsync.model.ChangeNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publish surface for change notifications. Listeners are called synchronously,
 * in registration order, on the sync thread; a failing listener does not stop
 * the others.
 */
@Component
@Slf4j
public class ChangeNotifier {
    
    private final List<ChangeListener> listeners = new CopyOnWriteArrayList<>();
    
    private volatile ChangeNotification lastNotification;
    
    public ChangeNotifier() {
    }
    
    @Autowired(required = false)
    public ChangeNotifier(List<ChangeListener> listeners) {
        if (listeners != null) {
            this.listeners.addAll(listeners);
        }
    }
    
    public void subscribe(ChangeListener listener) {
        listeners.add(listener);
    }
    
    public boolean unsubscribe(ChangeListener listener) {
        return listeners.remove(listener);
    }
    
    public void publish(ChangeNotification notification) {
        if (notification == null || notification.getKeys().isEmpty()) {
            return;
        }
        lastNotification = notification;
        log.info("Cycle {}: {} building(s) changed", notification.getCycle(), notification.getKeys().size());
        
        for (ChangeListener listener : listeners) {
            try {
                listener.onChanges(notification);
            } catch (RuntimeException e) {
                log.error("Change listener {} failed for cycle {}", listener, notification.getCycle(), e);
            }
        }
    }
    
    public Optional<ChangeNotification> getLastNotification() {
        return Optional.ofNullable(lastNotification);
    }
    
    public int listenerCount() {
        return listeners.size();
    }
}
