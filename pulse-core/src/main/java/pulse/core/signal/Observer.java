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

import java.util.function.Consumer;

import pulse.util.annotation.Nullable;

/**
 * A sink of {@link Event events}. Observers handed out by a {@link Signal} honor "first
 * terminal wins": anything sent after a terminal event is dropped.
 *
 * @param <T> the value type
 * @param <E> the error type
 */
@FunctionalInterface
public interface Observer<T, E> {

	/**
	 * Receive one event.
	 *
	 * @param event the event
	 */
	void onEvent(Event<T, E> event);

	default void sendNext(T value) {
		onEvent(Event.next(value));
	}

	default void sendError(E error) {
		onEvent(Event.error(error));
	}

	default void sendCompleted() {
		onEvent(Event.completed());
	}

	default void sendInterrupted() {
		onEvent(Event.interrupted());
	}

	/**
	 * Create an {@link Observer} dispatching each event type to its own callback. Any
	 * callback can be null, in which case the matching events are ignored.
	 *
	 * @param onNext called with each value
	 * @param onError called with the error
	 * @param onCompleted called on completion
	 * @param onInterrupted called on interruption
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link Observer}
	 */
	static <T, E> Observer<T, E> of(@Nullable Consumer<? super T> onNext,
			@Nullable Consumer<? super E> onError,
			@Nullable Runnable onCompleted,
			@Nullable Runnable onInterrupted) {
		return event -> {
			switch (event.getType()) {
				case NEXT:
					if (onNext != null) {
						onNext.accept(event.get());
					}
					break;
				case ERROR:
					if (onError != null) {
						onError.accept(event.getError());
					}
					break;
				case COMPLETED:
					if (onCompleted != null) {
						onCompleted.run();
					}
					break;
				case INTERRUPTED:
					if (onInterrupted != null) {
						onInterrupted.run();
					}
					break;
			}
		};
	}
}
