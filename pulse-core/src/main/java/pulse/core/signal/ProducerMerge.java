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

/**
 * Starts every inner producer as soon as it arrives and forwards its events as they
 * come. Completes once the outer producer and every inner producer have completed.
 *
 * @param <T> the value type of the inner producers
 * @param <E> the error type
 */
final class ProducerMerge<T, E> implements SignalProducer.StartHandler<T, E> {

	final SignalProducer<SignalProducer<T, E>, E> source;

	ProducerMerge(SignalProducer<SignalProducer<T, E>, E> source) {
		this.source = source;
	}

	@Override
	public void start(Observer<T, E> observer, Disposable.Composite disposable) {
		MergeState<T, E> state = new MergeState<>(observer, disposable);
		source.startWithSignal((signal, signalDisposable) -> {
			disposable.add(signalDisposable);
			signal.observe(state::onOuterEvent);
		});
	}

	static final class MergeState<T, E> {

		final Observer<T, E>       actual;
		final Disposable.Composite disposable;

		/**
		 * Number of running producers, the outer one included.
		 */
		volatile int inFlight = 1;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<MergeState> IN_FLIGHT =
				AtomicIntegerFieldUpdater.newUpdater(MergeState.class, "inFlight");

		MergeState(Observer<T, E> actual, Disposable.Composite disposable) {
			this.actual = actual;
			this.disposable = disposable;
		}

		void onOuterEvent(Event<SignalProducer<T, E>, E> event) {
			switch (event.getType()) {
				case NEXT:
					startInner(event.get());
					break;
				case ERROR:
					actual.sendError(event.getError());
					break;
				case COMPLETED:
					decrementInFlight();
					break;
				case INTERRUPTED:
					actual.sendInterrupted();
					break;
			}
		}

		void startInner(SignalProducer<T, E> producer) {
			producer.startWithSignal((innerSignal, innerDisposable) -> {
				// counted before the inner producer can possibly complete
				IN_FLIGHT.incrementAndGet(this);

				Disposable.Composite.Handle handle = disposable.add(innerDisposable);

				innerSignal.observe(event -> {
					switch (event.getType()) {
						case COMPLETED:
						case INTERRUPTED:
							handle.remove();
							decrementInFlight();
							break;
						default:
							actual.onEvent(event);
					}
				});
			});
		}

		void decrementInFlight() {
			if (IN_FLIGHT.getAndDecrement(this) == 1) {
				actual.sendCompleted();
			}
		}
	}
}
