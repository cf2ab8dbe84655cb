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

import java.util.ArrayDeque;

import pulse.core.Disposable;
import pulse.core.Disposables;
import pulse.util.function.Tuple2;
import pulse.util.function.Tuples;

/**
 * Observes two signals and pairs their values by index. Values waiting for their
 * counterpart are queued.
 *
 * @param <T> the value type of the left signal
 * @param <U> the value type of the right signal
 * @param <E> the error type
 */
final class SignalZip<T, U, E> implements Disposable {

	final Observer<Tuple2<T, U>, E> actual;
	final Disposable.Composite      disposable = Disposables.composite();

	final ArrayDeque<T> leftValues  = new ArrayDeque<>();
	final ArrayDeque<U> rightValues = new ArrayDeque<>();

	boolean leftCompleted;
	boolean rightCompleted;

	SignalZip(Signal<T, E> left, Signal<U, E> right, Observer<Tuple2<T, U>, E> actual) {
		this.actual = actual;
		disposable.add(left.observe(event -> {
			switch (event.getType()) {
				case NEXT:
					synchronized (this) {
						leftValues.addLast(event.get());
						flush();
					}
					break;
				case COMPLETED:
					synchronized (this) {
						leftCompleted = true;
						flush();
					}
					break;
				default:
					actual.onEvent(event.retype());
			}
		}));
		disposable.add(right.observe(event -> {
			switch (event.getType()) {
				case NEXT:
					synchronized (this) {
						rightValues.addLast(event.get());
						flush();
					}
					break;
				case COMPLETED:
					synchronized (this) {
						rightCompleted = true;
						flush();
					}
					break;
				default:
					actual.onEvent(event.retype());
			}
		}));
	}

	// guarded by this
	void flush() {
		while (!leftValues.isEmpty() && !rightValues.isEmpty()) {
			actual.sendNext(Tuples.of(leftValues.removeFirst(), rightValues.removeFirst()));
		}
		if ((leftCompleted && leftValues.isEmpty()) || (rightCompleted && rightValues.isEmpty())) {
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
