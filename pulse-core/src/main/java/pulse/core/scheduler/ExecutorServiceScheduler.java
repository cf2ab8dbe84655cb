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

import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import pulse.core.Disposable;
import pulse.core.Disposables;
import pulse.util.annotation.Nullable;

/**
 * A time-capable {@link Scheduler} backed by a {@link ScheduledExecutorService}. Every
 * task is tracked by its own {@link ScheduledTask} so it can be cancelled before it runs.
 */
final class ExecutorServiceScheduler implements Scheduler {

	final ScheduledExecutorService executor;
	final String                   name;

	ExecutorServiceScheduler(ScheduledExecutorService executor, String name) {
		this.executor = executor;
		this.name = name;
	}

	@Override
	public Disposable schedule(Runnable task) {
		return schedule(task, 0L, TimeUnit.MILLISECONDS);
	}

	@Override
	public Disposable schedule(Runnable task, long delay, TimeUnit unit) {
		ScheduledTask scheduled = new ScheduledTask(task, false);
		//RejectedExecutionException are propagated up
		Future<?> f = delay <= 0L
				? executor.submit(scheduled)
				: executor.schedule(scheduled, delay, unit);
		scheduled.bind(f);
		return scheduled;
	}

	@Override
	public Disposable schedulePeriodically(Runnable task, long initialDelay, long period, TimeUnit unit) {
		if (period <= 0L) {
			throw new IllegalArgumentException("period > 0 required but it was " + period);
		}
		ScheduledTask scheduled = new ScheduledTask(task, true);
		scheduled.bind(executor.scheduleAtFixedRate(scheduled, initialDelay, period, unit));
		return scheduled;
	}

	@Override
	public boolean isDisposed() {
		return executor.isShutdown();
	}

	@Override
	public void dispose() {
		executor.shutdownNow();
	}

	@Override
	public String toString() {
		return name;
	}

	/**
	 * A task handed to the executor. Its {@link Future} is only known once submitted, so
	 * the cancellation sits in a {@link Disposable.Swap}: disposing the task first
	 * cancels the future as soon as it is bound. Failures go to
	 * {@link Schedulers#handleError(Throwable)}, which keeps a periodic task running.
	 */
	static final class ScheduledTask implements Runnable, Disposable {

		final Runnable        task;
		final boolean         periodic;
		final Disposable.Swap cancellation = Disposables.swap();

		volatile boolean done;

		@Nullable
		volatile Thread runner;

		ScheduledTask(Runnable task, boolean periodic) {
			this.task = task;
			this.periodic = periodic;
		}

		void bind(Future<?> future) {
			// no interruption of the thread disposing its own task
			cancellation.replace(() -> future.cancel(runner != Thread.currentThread()));
		}

		@Override
		public void run() {
			if (cancellation.isDisposed()) {
				return;
			}
			runner = Thread.currentThread();
			try {
				task.run();
			}
			catch (Throwable ex) {
				Schedulers.handleError(ex);
			}
			finally {
				runner = null;
				if (!periodic) {
					done = true;
				}
			}
		}

		@Override
		public boolean isDisposed() {
			return done || cancellation.isDisposed();
		}

		@Override
		public void dispose() {
			if (!done) {
				cancellation.dispose();
			}
		}
	}
}
