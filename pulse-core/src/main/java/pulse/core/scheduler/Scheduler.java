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

import java.util.concurrent.TimeUnit;

import pulse.core.Disposable;
import pulse.core.Exceptions;

/**
 * Provides an abstract asynchronous boundary to operators.
 * <p>
 * Implementations that use an underlying {@link java.util.concurrent.ExecutorService}
 * or {@link java.util.concurrent.ScheduledExecutorService} should decorate it with the
 * relevant {@link Schedulers} hook.
 * <p>
 * A Scheduler that can run tasks after a delay, periodically, or read a clock is said
 * to be time-capable. Time-based operators ({@code delay}, {@code throttle},
 * {@code timeoutWithError}, {@code timer}) require one.
 */
public interface Scheduler extends Disposable {

	/**
	 * Schedules the non-delayed execution of the given task on this scheduler.
	 * <p>
	 * This method is safe to be called from multiple threads but there are no
	 * ordering guarantees between tasks.
	 *
	 * @param task the task to execute
	 * @return the {@link Disposable} instance that let's one cancel this particular task.
	 * @throws java.util.concurrent.RejectedExecutionException if the Scheduler is not capable of scheduling the task
	 */
	Disposable schedule(Runnable task);

	/**
	 * Schedules the execution of the given task with the given delay amount.
	 * <p>
	 * This method is safe to be called from multiple threads but there are no
	 * ordering guarantees between tasks.
	 *
	 * @param task the task to schedule
	 * @param delay the delay amount, non-positive values indicate non-delayed scheduling
	 * @param unit the unit of measure of the delay amount
	 * @return the {@link Disposable} that let's one cancel this particular delayed task.
	 * @throws java.util.concurrent.RejectedExecutionException if the Scheduler is not capable of scheduling with delay.
	 */
	default Disposable schedule(Runnable task, long delay, TimeUnit unit) {
		throw Exceptions.failWithRejectedNotTimeCapable();
	}

	/**
	 * Schedules a periodic execution of the given task with the given initial delay and period.
	 * <p>
	 * This method is safe to be called from multiple threads but there are no
	 * ordering guarantees between tasks.
	 * <p>
	 * The periodic execution is at a fixed rate, that is, the first execution will be after the initial
	 * delay, the second after initialDelay + period, the third after initialDelay + 2 * period, and so on.
	 *
	 * @param task the task to schedule
	 * @param initialDelay the initial delay amount, non-positive values indicate non-delayed scheduling
	 * @param period the period at which the task should be re-executed, must be positive
	 * @param unit the unit of measure of the delay amount
	 * @return the {@link Disposable} that let's one cancel this particular delayed task.
	 * @throws java.util.concurrent.RejectedExecutionException if the Scheduler is not capable of scheduling periodically.
	 */
	default Disposable schedulePeriodically(Runnable task, long initialDelay, long period, TimeUnit unit) {
		throw Exceptions.failWithRejectedNotTimeCapable();
	}

	/**
	 * Returns the "current time" notion of this scheduler.
	 *
	 * <p>
	 *     <strong>Implementation Note:</strong> The default implementation uses {@link System#currentTimeMillis()}
	 *     when requested with a {@code TimeUnit} of {@link TimeUnit#MILLISECONDS milliseconds} or coarser, and
	 *     {@link System#nanoTime()} otherwise. As a consequence, results should not be interpreted as absolute timestamps
	 *     in the latter case, only monotonicity inside the current JVM can be expected.
	 * </p>
	 * @param unit the target unit of the current time
	 * @return the current time value in the target unit of measure
	 */
	default long now(TimeUnit unit) {
		if (unit.compareTo(TimeUnit.MILLISECONDS) >= 0) {
			return unit.convert(System.currentTimeMillis(), TimeUnit.MILLISECONDS);
		}
		else {
			return unit.convert(System.nanoTime(), TimeUnit.NANOSECONDS);
		}
	}

	/**
	 * Instructs this Scheduler to release all resources and reject
	 * any new tasks to be executed.
	 *
	 * <p>The operation is thread-safe.
	 */
	@Override
	default void dispose() {
	}
}
