package org.walletsync.event;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

public enum EventBus {
	INSTANCE;

	private static final Logger LOGGER = LogManager.getLogger(EventBus.class);

	private final List<Listener> listeners = new ArrayList<>();

	public void addListener(Listener newListener) {
		synchronized (this.listeners) {
			this.listeners.add(newListener);
		}
	}

	public void removeListener(Listener listener) {
		synchronized (this.listeners) {
			this.listeners.remove(listener);
		}
	}

	/**
	 * <b>WARNING:</b> before calling this method,
	 * make sure repository holds no locks, e.g. by calling
	 * <tt>repository.discardChanges()</tt> or <tt>repository.saveChanges()</tt>.
	 * <p>
	 * Listeners are called on the notifying thread. A failing listener
	 * doesn't stop delivery to the others.
	 */
	public void notify(Event event) {
		List<Listener> clonedListeners;

		synchronized (this.listeners) {
			clonedListeners = new ArrayList<>(this.listeners);
		}

		for (Listener listener : clonedListeners) {
			try {
				listener.listen(event);
			} catch (RuntimeException e) {
				LOGGER.warn(String.format("Listener failed to handle %s: %s", event.getClass().getSimpleName(), e.getMessage()), e);
			}
		}
	}
}
