package com.buildingsync.service;

import com.buildingsync.model.ChangeNotification;

/**
 * Consumer of change notifications (renderer, UI)
 */
@FunctionalInterface
public interface ChangeListener {
    
    void onChanges(ChangeNotification notification);
}
