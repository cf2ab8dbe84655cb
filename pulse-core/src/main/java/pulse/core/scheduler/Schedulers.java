/*
 * Copyright (c) 2016-2024 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package pulse.core.scheduler;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

import pulse.core.Disposable;
import pulse.core.Exceptions;
import pulse.util.Logger;
import pulse.util.Loggers;
import pulse.util.annotation.Nullable;

/**
 * {@link Schedulers} provides various {@link Scheduler} flavors usable by
 * {@link pulse.core.signal.SignalProducer#startOn(Scheduler) startOn},
 * {@link pulse.core.signal.SignalProducer#observeOn(Scheduler) observeOn} and the
 * time-based operators.
 * <p>
 * Factories prefixed with {@code new} (eg. {@link #newSingle(String)}) return a new
 * instance of their flavor of {@link Scheduler}, while other factories like
 * {@link #single()} return a shared instance.
 * <ul>
 *     <li>{@link #immediate()}: runs every task on the caller thread, not time-capable.</li>
 *     <li>{@link #single()}: a shared daemon thread, named after the
 *     {@value #SINGLE_NAME_PROPERTY} system property ("single" by default).</li>
 *     <li>{@link #fromExecutorService(ScheduledExecutorService)}: wraps a user-provided
 *     executor.</li>
 * </ul>
 * Threads created by the {@code single} flavors are {@link NonBlocking}: blocking
 * reducers refuse to run on them.
 */
public abstract class Schedulers {

	/**
	 * System property naming the threads of the shared {@link #single()} scheduler.
	 */
	public static final String SINGLE_NAME_PROPERTY = "pulse.schedulers.single.name";

	static final String IMMEDIATE = "immediate";
	static final String SINGLE    = "single";
	static final String FROM_EXECUTOR_SERVICE = "fromExecutorService";

	static final AtomicReference<CachedScheduler> CACHED_SINGLE = new AtomicReference<>();

	static final AtomicLong COUNTER = new AtomicLong();

	@Nullable
	static volatile BiConsumer<Thread, ? super Throwable> onHandleErrorHook;

	/**
	 * Executes tasks immediately instead of scheduling them.
	 * <p>
	 * As a consequence tasks run on the thread that submitted them (eg. the
	 * thread on which an operator is currently processing its events). This scheduler
	 * is not time-capable.
	 *
	 * @return a reusable {@link Scheduler}
	 */
	public static Scheduler immediate() {
		return ImmediateScheduler.instance();
	}

	/**
	 * The common <em>single</em> instance, a {@link Scheduler} that hosts a single-threaded
	 * ExecutorService-based worker. This scheduler is time-capable (can schedule with delay
	 * / periodically).
	 * <p>
	 * Disposing the returned instance is a no-op, see {@link #shutdownNow()}.
	 *
	 * @return the common <em>single</em> instance, a {@link Scheduler} that hosts a single-threaded
	 * ExecutorService-based worker
	 */
	public static Scheduler single() {
		CachedScheduler s = CACHED_SINGLE.get();
		if (s != null) {
			return s;
		}
		CachedScheduler created = new CachedScheduler(SINGLE,
				newSingle(System.getProperty(SINGLE_NAME_PROPERTY, SINGLE), true));
		if (CACHED_SINGLE.compareAndSet(null, created)) {
			return created;
		}
		//the race was lost
		created._dispose();
		return CACHED_SINGLE.get();
	}

	/**
	 * {@link Scheduler} that hosts a single-threaded ExecutorService-based worker. This
	 * scheduler is time-capable (can schedule with delay / periodically).
	 *
	 * @param name Component and thread name prefix
	 * @return a new {@link Scheduler} that hosts a single-threaded ExecutorService-based
	 * worker
	 */
	public static Scheduler newSingle(String name) {
		return newSingle(name, false);
	}

	/**
	 * {@link Scheduler} that hosts a single-threaded ExecutorService-based worker. This
	 * scheduler is time-capable (can schedule with delay / periodically).
	 *
	 * @param name Component and thread name prefix
	 * @param daemon false if the {@link Scheduler} requires an explicit {@link
	 * Scheduler#dispose()} to exit the VM.
	 * @return a new {@link Scheduler} that hosts a single-threaded ExecutorService-based
	 * worker
	 */
	public static Scheduler newSingle(String name, boolean daemon) {
		return newSingle(new PulseThreadFactory(name, COUNTER, daemon));
	}

	/**
	 * {@link Scheduler} that hosts a single-threaded ExecutorService-based worker. This
	 * scheduler is time-capable (can schedule with delay / periodically).
	 *
	 * @param threadFactory a {@link ThreadFactory} to use for the unique thread of the
	 * {@link Scheduler}
	 * @return a new {@link Scheduler} that hosts a single-threaded ExecutorService-based
	 * worker
	 */
	public static Scheduler newSingle(ThreadFactory threadFactory) {
		ScheduledThreadPoolExecutor e =
				(ScheduledThreadPoolExecutor) Executors.newScheduledThreadPool(1, threadFactory);
		e.setRemoveOnCancelPolicy(true);
		e.setMaximumPoolSize(1);
		String name = threadFactory instanceof PulseThreadFactory
				? SINGLE + "(\"" + ((PulseThreadFactory) threadFactory).prefix + "\")"
				: SINGLE + "()";
		return new ExecutorServiceScheduler(e, name);
	}

	/**
	 * Create a {@link Scheduler} which uses a backing {@link ScheduledExecutorService} to
	 * schedule Runnables. Disposing the scheduler shuts the executor down.
	 *
	 * @param executorService a {@link ScheduledExecutorService}
	 * @return a new {@link Scheduler}
	 */
	public static Scheduler fromExecutorService(ScheduledExecutorService executorService) {
		Objects.requireNonNull(executorService, "executorService");
		return new ExecutorServiceScheduler(executorService, FROM_EXECUTOR_SERVICE);
	}

	/**
	 * Define a hook anonymous part that is executed alongside keyed parts when a {@link Scheduler} has
	 * {@link #handleError(Throwable) handled an error}. Note that it is executed if
	 * the error is not fatal.
	 *
	 * @param c the new hook to set.
	 */
	public static void onHandleError(BiConsumer<Thread, ? super Throwable> c) {
		if (log.isDebugEnabled()) {
			log.debug("Hooking new default: onHandleError");
		}
		onHandleErrorHook = Objects.requireNonNull(c, "onHandleError");
	}

	/**
	 * Reset the {@link #onHandleError(BiConsumer)} hook to the default no-op behavior.
	 */
	public static void resetOnHandleError() {
		if (log.isDebugEnabled()) {
			log.debug("Reset to factory defaults: onHandleError");
		}
		onHandleErrorHook = null;
	}

	/**
	 * Check if calling a Pulse blocking API in the current {@link Thread} is forbidden
	 * or not, by checking if the thread implements {@link NonBlocking} (in which case it is
	 * forbidden and this method returns {@code true}).
	 *
	 * @return {@code true} if blocking is forbidden in this thread, {@code false} otherwise
	 */
	public static boolean isInNonBlockingThread() {
		return Thread.currentThread() instanceof NonBlocking;
	}

	/**
	 * Check if calling a Pulse blocking API in the given {@link Thread} is forbidden
	 * or not, by checking if the thread implements {@link NonBlocking} (in which case it is
	 * forbidden and this method returns {@code true}).
	 *
	 * @param t the thread to check
	 * @return {@code true} if blocking is forbidden in that thread, {@code false} otherwise
	 */
	public static boolean isNonBlockingThread(Thread t) {
		return t instanceof NonBlocking;
	}

	/**
	 * Clear the cached {@link #single()} scheduler and dispose it. The next call
	 * re-creates it.
	 */
	public static void shutdownNow() {
		CachedScheduler s = CACHED_SINGLE.getAndSet(null);
		if (s != null) {
			s._dispose();
		}
	}

	static final Logger log = Loggers.getLogger(Schedulers.class);

	static void defaultUncaughtException(Thread t, Throwable e) {
		Schedulers.log.error("Scheduler worker in group " + t.getThreadGroup().getName()
				+ " failed with an uncaught exception", e);
	}

	static void handleError(Throwable ex) {
		Exceptions.throwIfFatal(ex);
		Thread thread = Thread.currentThread();
		Throwable t = Exceptions.unwrap(ex);
		Thread.UncaughtExceptionHandler x = thread.getUncaughtExceptionHandler();
		if (x != null) {
			x.uncaughtException(thread, t);
		}
		else {
			log.error("Scheduler worker failed with an uncaught exception", t);
		}
		BiConsumer<Thread, ? super Throwable> hook = onHandleErrorHook;
		if (hook != null) {
			hook.accept(thread, t);
		}
	}

	static class CachedScheduler implements Scheduler {

		final Scheduler cached;
		final String    stringRepresentation;

		CachedScheduler(String key, Scheduler cached) {
			this.cached = cached;
			this.stringRepresentation = "Schedulers." + key + "()";
		}

		@Override
		public Disposable schedule(Runnable task) {
			return cached.schedule(task);
		}

		@Override
		public Disposable schedule(Runnable task, long delay, TimeUnit unit) {
			return cached.schedule(task, delay, unit);
		}

		@Override
		public Disposable schedulePeriodically(Runnable task,
				long initialDelay,
				long period,
				TimeUnit unit) {
			return cached.schedulePeriodically(task, initialDelay, period, unit);
		}

		@Override
		public long now(TimeUnit unit) {
			return cached.now(unit);
		}

		@Override
		public String toString() {
			return stringRepresentation;
		}

		@Override
		public boolean isDisposed() {
			return cached.isDisposed();
		}

		@Override
		public void dispose() {
		}

		/**
		 * Dispose the underlying {@link Scheduler}, bypassing the no-op of {@link #dispose()}.
		 */
		void _dispose() {
			cached.dispose();
		}
	}

	Schedulers() {
	}
}
