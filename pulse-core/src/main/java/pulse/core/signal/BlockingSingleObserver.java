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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import pulse.core.Disposable;
import pulse.core.Exceptions;
import pulse.core.scheduler.Schedulers;
import pulse.util.Result;
import pulse.util.annotation.Nullable;

/**
 * The one-shot gate behind the blocking reducers of {@link SignalProducer}. Records a
 * tentative result from the events it observes, and opens on the first terminal event.
 * <p>
 * A second value makes the result ambiguous (null). An error replaces the result with
 * a failure.
 *
 * @param <T> the value type
 * @param <E> the error type
 */
final class BlockingSingleObserver<T, E> extends CountDownLatch
		implements Observer<T, E>, Disposable {

	// published to the blocked thread by countDown()
	@Nullable
	Result<T, E> result;
	int          values;

	@Nullable
	volatile Disposable cancel;
	volatile boolean    cancelled;

	BlockingSingleObserver() {
		super(1);
	}

	@Override
	public void onEvent(Event<T, E> event) {
		switch (event.getType()) {
			case NEXT:
				// move into the ambiguous state after receiving another value
				result = ++values == 1 ? Result.success(event.get()) : null;
				break;
			case ERROR:
				result = Result.failure(event.getError());
				countDown();
				break;
			default:
				countDown();
		}
	}

	void setCancel(Disposable cancel) {
		this.cancel = cancel;
		if (cancelled) {
			cancel.dispose();
		}
	}

	@Override
	public void dispose() {
		cancelled = true;
		Disposable d = cancel;
		if (d != null) {
			d.dispose();
		}
	}

	@Override
	public boolean isDisposed() {
		return cancelled || getCount() == 0;
	}

	/**
	 * Block until a terminal event arrives and return the recorded result.
	 *
	 * @return the single value or error, null if there was no value or more than one
	 */
	@Nullable
	Result<T, E> blockingGet() {
		if (Schedulers.isInNonBlockingThread()) {
			throw new IllegalStateException("single()/first()/last()/await() are blocking, which is not supported in thread " + Thread.currentThread().getName());
		}
		if (getCount() != 0) {
			try {
				await();
			}
			catch (InterruptedException ex) {
				dispose();
				Thread.currentThread().interrupt();
				throw Exceptions.propagate(ex);
			}
		}
		return result;
	}

	/**
	 * Block until a terminal event arrives and return the recorded result, cancelling
	 * the run and throwing if it takes longer than the given timeout.
	 *
	 * @param timeout the timeout to wait
	 * @param unit the time unit
	 * @return the single value or error, null if there was no value or more than one
	 */
	@Nullable
	Result<T, E> blockingGet(long timeout, TimeUnit unit) {
		if (Schedulers.isInNonBlockingThread()) {
			throw new IllegalStateException("single()/first()/last()/await() are blocking, which is not supported in thread " + Thread.currentThread().getName());
		}
		if (getCount() != 0) {
			try {
				if (!await(timeout, unit)) {
					dispose();
					throw new IllegalStateException("Timeout on blocking read for " + timeout + " " + unit);
				}
			}
			catch (InterruptedException ex) {
				dispose();
				RuntimeException re = Exceptions.propagate(ex);
				//this is ok, as re is always a new non-singleton instance
				re.addSuppressed(new Exception("#single has been interrupted"));
				Thread.currentThread().interrupt();
				throw re;
			}
		}
		return result;
	}
}
