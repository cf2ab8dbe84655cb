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

import java.util.function.Function;

import pulse.core.Disposable;
import pulse.core.Disposables;

/**
 * Forwards the source until it fails, then starts the producer returned by the error
 * handler in its place.
 *
 * @param <T> the value type
 * @param <E> the error type of the source
 * @param <F> the error type of the replacement
 */
final class ProducerFlatMapError<T, E, F> implements SignalProducer.StartHandler<T, F> {

	final SignalProducer<T, E>                            source;
	final Function<? super E, ? extends SignalProducer<T, F>> handler;

	ProducerFlatMapError(SignalProducer<T, E> source,
			Function<? super E, ? extends SignalProducer<T, F>> handler) {
		this.source = source;
		this.handler = handler;
	}

	@Override
	public void start(Observer<T, F> observer, Disposable.Composite disposable) {
		Disposable.Swap serialDisposable = Disposables.swap();
		disposable.add(serialDisposable);

		source.startWithSignal((signal, signalDisposable) -> {
			serialDisposable.update(signalDisposable);

			signal.observe(event -> {
				switch (event.getType()) {
					case NEXT:
						observer.sendNext(event.get());
						break;
					case ERROR:
						handler.apply(event.getError()).startWithSignal((replacement, replacementDisposable) -> {
							serialDisposable.update(replacementDisposable);
							replacement.observe(observer);
						});
						break;
					case COMPLETED:
						observer.sendCompleted();
						break;
					case INTERRUPTED:
						observer.sendInterrupted();
						break;
				}
			});
		});
	}
}
