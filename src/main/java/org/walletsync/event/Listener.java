package org.walletsync.event;

@FunctionalInterface
public interface Listener {

	void listen(Event event);

}
