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

import java.util.concurrent.atomic.AtomicReference;

import pulse.core.Disposable;
import pulse.core.Disposables;

/**
 * Forwards the events of the latest inner producer only, disposing the previous one
 * when a new one arrives. Completes once the outer producer and the latest inner
 * producer have completed.
 *
 * @param <T> the value type of the inner producers
 * @param <E> the error type
 */
final class ProducerSwitchToLatest<T, E> implements SignalProducer.StartHandler<T, E> {

	final SignalProducer<SignalProducer<T, E>, E> source;

	ProducerSwitchToLatest(SignalProducer<SignalProducer<T, E>, E> source) {
		this.source = source;
	}

	@Override
	public void start(Observer<T, E> observer, Disposable.Composite disposable) {
		Disposable.Swap latestInnerDisposable = Disposables.swap();
		disposable.add(latestInnerDisposable);

		AtomicReference<LatestState> state = new AtomicReference<>(LatestState.INITIAL);

		source.startWithSignal((signal, signalDisposable) -> {
			disposable.add(signalDisposable);

			signal.observe(event -> {
				switch (event.getType()) {
					case NEXT:
						startInner(event.get(), observer, latestInnerDisposable, state);
						break;
					case ERROR:
						observer.sendError(event.getError());
						break;
					case COMPLETED:
						if (state.getAndUpdate(LatestState::outerCompleted).innerComplete) {
							observer.sendCompleted();
						}
						break;
					case INTERRUPTED:
						observer.sendInterrupted();
						break;
				}
			});
		});
	}

	static <T, E> void startInner(SignalProducer<T, E> producer,
			Observer<T, E> observer,
			Disposable.Swap latestInnerDisposable,
			AtomicReference<LatestState> state) {
		producer.startWithSignal((innerSignal, innerDisposable) -> {
			// bumped before the previous inner is disposed, so its interruption is stale
			long generation = state.updateAndGet(LatestState::replaced).generation;
			latestInnerDisposable.update(innerDisposable);

			innerSignal.observe(event -> {
				switch (event.getType()) {
					case COMPLETED:
					case INTERRUPTED: {
						LatestState original = state.getAndUpdate(s -> s.innerCompleted(generation));
						if (original.generation == generation && original.outerComplete) {
							observer.sendCompleted();
						}
						break;
					}
					default:
						observer.onEvent(event);
				}
			});
		});
	}

	/**
	 * Immutable snapshot of the switching state, swapped atomically. Terminal events
	 * only count for the inner producer of the current {@code generation}.
	 */
	static final class LatestState {

		static final LatestState INITIAL = new LatestState(false, true, 0L);

		final boolean outerComplete;
		final boolean innerComplete;
		final long    generation;

		LatestState(boolean outerComplete, boolean innerComplete, long generation) {
			this.outerComplete = outerComplete;
			this.innerComplete = innerComplete;
			this.generation = generation;
		}

		LatestState outerCompleted() {
			return new LatestState(true, innerComplete, generation);
		}

		LatestState innerCompleted(long innerGeneration) {
			if (innerGeneration != generation) {
				return this;
			}
			return new LatestState(outerComplete, true, generation);
		}

		LatestState replaced() {
			return new LatestState(outerComplete, false, generation + 1);
		}

		@Override
		public String toString() {
			return "LatestState{outerComplete=" + outerComplete + ", innerComplete=" + innerComplete
					+ ", generation=" + generation + "}";
		}
	}
}
