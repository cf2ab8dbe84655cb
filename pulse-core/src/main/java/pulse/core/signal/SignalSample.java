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

import pulse.core.Disposable;
import pulse.core.Disposables;
import pulse.util.annotation.Nullable;

/**
 * Observes a signal and a sampler, sending the latest value of the signal each time
 * the sampler sends a value.
 *
 * @param <T> the value type
 * @param <E> the error type
 */
final class SignalSample<T, E> implements Disposable {

	final Observer<T, E>       actual;
	final Disposable.Composite disposable = Disposables.composite();

	@Nullable
	T       latestValue;
	boolean signalCompleted;
	boolean samplerCompleted;

	SignalSample(Signal<T, E> source, Signal<?, NoError> sampler, Observer<T, E> actual) {
		this.actual = actual;
		disposable.add(source.observe(event -> {
			switch (event.getType()) {
				case NEXT:
					synchronized (this) {
						latestValue = event.get();
					}
					break;
				case COMPLETED:
					onCompleted(true);
					break;
				default:
					actual.onEvent(event);
			}
		}));
		disposable.add(sampler.observe(event -> {
			switch (event.getType()) {
				case NEXT:
					onSample();
					break;
				case COMPLETED:
					onCompleted(false);
					break;
				case INTERRUPTED:
					actual.sendInterrupted();
					break;
				default:
					break;
			}
		}));
	}

	synchronized void onSample() {
		T value = latestValue;
		if (value != null) {
			actual.sendNext(value);
		}
	}

	synchronized void onCompleted(boolean signal) {
		if (signal) {
			signalCompleted = true;
		}
		else {
			samplerCompleted = true;
		}
		if (signalCompleted && samplerCompleted) {
			actual.sendCompleted();
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
