package org.walletsync.utils;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class NamedThreadFactory implements ThreadFactory {

	private final String name;
	private final AtomicInteger threadNumber = new AtomicInteger(1);
	private final int priority;
	private final boolean daemon;

	public NamedThreadFactory(String name, int priority) {
		this(name, priority, false);
	}

	public NamedThreadFactory(String name, int priority, boolean daemon) {
		this.name = name;
		this.priority = priority;
		this.daemon = daemon;
	}

	@Override
	public Thread newThread(Runnable runnable) {
		Thread thread = Executors.defaultThreadFactory().newThread(runnable);
		thread.setName(this.name + "-" + this.threadNumber.getAndIncrement());
		thread.setPriority(this.priority);
		thread.setDaemon(this.daemon);

		return thread;
	}

}
