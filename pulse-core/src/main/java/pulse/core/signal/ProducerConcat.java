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

import java.util.ArrayList;
import java.util.List;

import pulse.core.Disposable;
import pulse.util.annotation.Nullable;

/**
 * Starts inner producers one at a time, in the order they arrived, each one once the
 * previous one completed or was interrupted. Completion of the outer producer queues a
 * last producer whose only job is to complete the aggregate.
 *
 * @param <T> the value type of the inner producers
 * @param <E> the error type
 */
final class ProducerConcat<T, E> implements SignalProducer.StartHandler<T, E> {

	final SignalProducer<SignalProducer<T, E>, E> source;

	ProducerConcat(SignalProducer<SignalProducer<T, E>, E> source) {
		this.source = source;
	}

	@Override
	public void start(Observer<T, E> observer, Disposable.Composite disposable) {
		ConcatState<T, E> state = new ConcatState<>(observer, disposable);
		source.startWithSignal((signal, signalDisposable) -> {
			disposable.add(signalDisposable);
			signal.observe(event -> {
				switch (event.getType()) {
					case NEXT:
						state.enqueue(event.get());
						break;
					case ERROR:
						observer.sendError(event.getError());
						break;
					case COMPLETED:
						state.enqueue(new SignalProducer<T, E>((innerObserver, ignored) -> {
							innerObserver.sendCompleted();
							observer.sendCompleted();
						}));
						break;
					case INTERRUPTED:
						observer.sendInterrupted();
						break;
				}
			});
		});
	}

	static final class ConcatState<T, E> {

		final Observer<T, E>       actual;
		final Disposable.Composite disposable;

		/**
		 * The active producer at the head, followed by the ones waiting to start.
		 */
		final List<SignalProducer<T, E>> queue = new ArrayList<>();

		ConcatState(Observer<T, E> actual, Disposable.Composite disposable) {
			this.actual = actual;
			this.disposable = disposable;
		}

		void enqueue(SignalProducer<T, E> producer) {
			if (disposable.isDisposed()) {
				return;
			}
			boolean shouldStart;
			synchronized (queue) {
				// an empty queue means no producer is active
				shouldStart = queue.isEmpty();
				queue.add(producer);
			}
			if (shouldStart) {
				startNext(producer);
			}
		}

		@Nullable
		SignalProducer<T, E> dequeue() {
			if (disposable.isDisposed()) {
				return null;
			}
			synchronized (queue) {
				if (!queue.isEmpty()) {
					queue.remove(0);
				}
				return queue.isEmpty() ? null : queue.get(0);
			}
		}

		void startNext(SignalProducer<T, E> producer) {
			producer.startWithSignal((signal, signalDisposable) -> {
				Disposable.Composite.Handle handle = disposable.add(signalDisposable);

				signal.observe(event -> {
					switch (event.getType()) {
						case COMPLETED:
						case INTERRUPTED:
							handle.remove();
							SignalProducer<T, E> next = dequeue();
							if (next != null) {
								startNext(next);
							}
							break;
						default:
							actual.onEvent(event);
					}
				});
			});
		}
	}
}
