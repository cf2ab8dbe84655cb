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

package pulse.core.signal;

import java.util.concurrent.TimeUnit;

import pulse.core.Disposable;
import pulse.core.Disposables;
import pulse.core.scheduler.Scheduler;
import pulse.util.annotation.Nullable;

/**
 * Observes a signal and forwards at most one value per interval, the latest one, on a
 * {@link Scheduler}. Terminal events are forwarded on the scheduler right away,
 * replacing any pending value.
 *
 * @param <T> the value type
 * @param <E> the error type
 */
final class SignalThrottle<T, E> implements Disposable {

	final Observer<T, E>       actual;
	final long                 intervalNanos;
	final Scheduler            scheduler;
	final Disposable.Swap      scheduled  = Disposables.swap();
	final Disposable.Composite disposable = Disposables.composite();

	@Nullable
	T    pendingValue;
	long previousNanos = Long.MIN_VALUE;

	SignalThrottle(Signal<T, E> source, Observer<T, E> actual, long intervalNanos, Scheduler scheduler) {
		this.actual = actual;
		this.intervalNanos = intervalNanos;
		this.scheduler = scheduler;
		disposable.add(scheduled);
		disposable.add(source.observe(this::onEvent));
	}

	void onEvent(Event<T, E> event) {
		if (event.getType() != Event.Type.NEXT) {
			scheduled.update(scheduler.schedule(() -> actual.onEvent(event)));
			return;
		}
		long now = scheduler.now(TimeUnit.NANOSECONDS);
		long scheduleNanos;
		synchronized (this) {
			pendingValue = event.get();
			scheduleNanos = previousNanos == Long.MIN_VALUE
					? now
					: Math.max(previousNanos + intervalNanos, now);
		}
		scheduled.update(scheduler.schedule(() -> emitPending(scheduleNanos),
				scheduleNanos - now, TimeUnit.NANOSECONDS));
	}

	void emitPending(long scheduleNanos) {
		T value;
		synchronized (this) {
			value = pendingValue;
			if (value != null) {
				pendingValue = null;
				previousNanos = scheduleNanos;
			}
		}
		if (value != null) {
			actual.sendNext(value);
		}
	}

	@Override
	public void dispose() {
		disposable.dispose();
	}

	@Override
	public boolean isDisposed() {
		return disposable.isDisposed();
	}
}
