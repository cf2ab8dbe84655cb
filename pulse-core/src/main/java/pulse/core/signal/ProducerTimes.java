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

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import pulse.core.Disposable;
import pulse.core.Disposables;

/**
 * Restarts the source each time it completes, until it completed {@code count} times.
 * Any other event is forwarded and ends the repetition.
 * <p>
 * Restarts are trampolined: a source completing synchronously from within its own
 * start does not grow the stack.
 *
 * @param <T> the value type
 * @param <E> the error type
 */
final class ProducerTimes<T, E> implements SignalProducer.StartHandler<T, E> {

	final SignalProducer<T, E> source;
	final int                  count;

	ProducerTimes(SignalProducer<T, E> source, int count) {
		this.source = source;
		this.count = count;
	}

	@Override
	public void start(Observer<T, E> observer, Disposable.Composite disposable) {
		Disposable.Swap serialDisposable = Disposables.swap();
		disposable.add(serialDisposable);
		new TimesState<>(source, count, observer, serialDisposable).resubscribe();
	}

	static final class TimesState<T, E> {

		final SignalProducer<T, E> source;
		final Observer<T, E>       actual;
		final Disposable.Swap      serialDisposable;

		int remaining;

		volatile int wip;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<TimesState> WIP =
				AtomicIntegerFieldUpdater.newUpdater(TimesState.class, "wip");

		TimesState(SignalProducer<T, E> source, int count, Observer<T, E> actual, Disposable.Swap serialDisposable) {
			this.source = source;
			this.remaining = count;
			this.actual = actual;
			this.serialDisposable = serialDisposable;
		}

		void resubscribe() {
			if (WIP.getAndIncrement(this) == 0) {
				do {
					if (serialDisposable.isDisposed()) {
						return;
					}
					source.startWithSignal((signal, signalDisposable) -> {
						serialDisposable.update(signalDisposable);
						signal.observe(this::onEvent);
					});
				}
				while (WIP.decrementAndGet(this) != 0);
			}
		}

		void onEvent(Event<T, E> event) {
			if (event.getType() == Event.Type.COMPLETED) {
				if (--remaining > 0) {
					resubscribe();
				}
				else {
					actual.sendCompleted();
				}
			}
			else {
				actual.onEvent(event);
			}
		}
	}
}
