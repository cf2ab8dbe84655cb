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
import pulse.util.function.Tuple2;
import pulse.util.function.Tuples;

/**
 * Observes two signals and sends a pair of their latest values each time either one
 * sends a value, once both have sent at least one.
 *
 * @param <T> the value type of the left signal
 * @param <U> the value type of the right signal
 * @param <E> the error type
 */
final class SignalCombineLatest<T, U, E> implements Disposable {

	final Observer<Tuple2<T, U>, E> actual;
	final Disposable.Composite      disposable = Disposables.composite();

	@Nullable
	T       latestLeft;
	@Nullable
	U       latestRight;
	boolean leftCompleted;
	boolean rightCompleted;

	SignalCombineLatest(Signal<T, E> left, Signal<U, E> right, Observer<Tuple2<T, U>, E> actual) {
		this.actual = actual;
		disposable.add(left.observe(event -> {
			switch (event.getType()) {
				case NEXT:
					onLeft(event.get());
					break;
				case COMPLETED:
					onCompleted(true);
					break;
				default:
					actual.onEvent(event.retype());
			}
		}));
		disposable.add(right.observe(event -> {
			switch (event.getType()) {
				case NEXT:
					onRight(event.get());
					break;
				case COMPLETED:
					onCompleted(false);
					break;
				default:
					actual.onEvent(event.retype());
			}
		}));
	}

	synchronized void onLeft(T value) {
		latestLeft = value;
		U right = latestRight;
		if (right != null) {
			actual.sendNext(Tuples.of(value, right));
		}
	}

	synchronized void onRight(U value) {
		latestRight = value;
		T left = latestLeft;
		if (left != null) {
			actual.sendNext(Tuples.of(left, value));
		}
	}

	synchronized void onCompleted(boolean left) {
		if (left) {
			leftCompleted = true;
		}
		else {
			rightCompleted = true;
		}
		if (leftCompleted && rightCompleted) {
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
