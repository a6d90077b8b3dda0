package com.phillippitts.sodam.service.room;

/**
 * Receives room events on the transport's delivery thread.
 */
@FunctionalInterface
public interface RoomEventListener {

    void onEvent(RoomEvent event);
}
