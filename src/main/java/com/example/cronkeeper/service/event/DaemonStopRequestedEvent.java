package com.example.cronkeeper.service.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published once the daemon status has been flipped to stopped.
 */
public class DaemonStopRequestedEvent extends ApplicationEvent {

    public DaemonStopRequestedEvent(Object source) {
        super(source);
    }
}
