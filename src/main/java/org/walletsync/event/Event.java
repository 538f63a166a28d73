package org.walletsync.event;

public interface Event {
}
