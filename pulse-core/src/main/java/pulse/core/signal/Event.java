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

import java.util.Objects;
import java.util.function.Function;

import pulse.util.annotation.Nullable;

/**
 * A domain representation of a stream event: a value ({@link Type#NEXT}), a failure
 * ({@link Type#ERROR}), a successful completion ({@link Type#COMPLETED}) or a
 * cancellation ({@link Type#INTERRUPTED}).
 * <p>
 * The last three are terminal: a started stream delivers at most one of them, and
 * nothing after it. Values and errors are never null.
 *
 * @param <T> the value type
 * @param <E> the error type
 */
public final class Event<T, E> {

	/**
	 * The kind of an {@link Event}.
	 */
	public enum Type {
		NEXT,
		ERROR,
		COMPLETED,
		INTERRUPTED;

		/**
		 * @return true for every type but {@link #NEXT}
		 */
		public boolean isTerminating() {
			return this != NEXT;
		}
	}

	static final Event<?, ?> COMPLETED   = new Event<>(Type.COMPLETED, null, null);
	static final Event<?, ?> INTERRUPTED = new Event<>(Type.INTERRUPTED, null, null);

	/**
	 * Creates a {@link Type#NEXT} event carrying the given value.
	 *
	 * @param value the value, not null
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link Event}
	 */
	public static <T, E> Event<T, E> next(T value) {
		return new Event<>(Type.NEXT, Objects.requireNonNull(value, "value"), null);
	}

	/**
	 * Creates an {@link Type#ERROR} event carrying the given error.
	 *
	 * @param error the error, not null
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link Event}
	 */
	public static <T, E> Event<T, E> error(E error) {
		return new Event<>(Type.ERROR, null, Objects.requireNonNull(error, "error"));
	}

	/**
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return the shared {@link Type#COMPLETED} event
	 */
	@SuppressWarnings("unchecked")
	public static <T, E> Event<T, E> completed() {
		return (Event<T, E>) COMPLETED;
	}

	/**
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return the shared {@link Type#INTERRUPTED} event
	 */
	@SuppressWarnings("unchecked")
	public static <T, E> Event<T, E> interrupted() {
		return (Event<T, E>) INTERRUPTED;
	}

	final Type type;
	@Nullable
	final T    value;
	@Nullable
	final E    error;

	Event(Type type, @Nullable T value, @Nullable E error) {
		this.type = type;
		this.value = value;
		this.error = error;
	}

	public Type getType() {
		return type;
	}

	public boolean isTerminating() {
		return type.isTerminating();
	}

	/**
	 * @return the value of a {@link Type#NEXT} event, null otherwise
	 */
	@Nullable
	public T get() {
		return value;
	}

	/**
	 * @return the error of an {@link Type#ERROR} event, null otherwise
	 */
	@Nullable
	public E getError() {
		return error;
	}

	/**
	 * Transform the value of a {@link Type#NEXT} event, keeping other events as is.
	 *
	 * @param mapper the value transformation
	 * @param <U> the new value type
	 * @return the transformed event
	 */
	@SuppressWarnings("unchecked")
	public <U> Event<U, E> map(Function<? super T, ? extends U> mapper) {
		if (type == Type.NEXT) {
			return next(mapper.apply(value));
		}
		return (Event<U, E>) this;
	}

	/**
	 * Transform the error of an {@link Type#ERROR} event, keeping other events as is.
	 *
	 * @param mapper the error transformation
	 * @param <F> the new error type
	 * @return the transformed event
	 */
	@SuppressWarnings("unchecked")
	public <F> Event<T, F> mapError(Function<? super E, ? extends F> mapper) {
		if (type == Type.ERROR) {
			return error(mapper.apply(error));
		}
		return (Event<T, F>) this;
	}

	/**
	 * Re-type a terminal event, which carries no value.
	 */
	@SuppressWarnings("unchecked")
	<U> Event<U, E> retype() {
		if (type == Type.NEXT) {
			throw new IllegalStateException("A NEXT event cannot change its value type");
		}
		return (Event<U, E>) this;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Event)) {
			return false;
		}
		Event<?, ?> other = (Event<?, ?>) o;
		return type == other.type
				&& Objects.equals(value, other.value)
				&& Objects.equals(error, other.error);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, value, error);
	}

	@Override
	public String toString() {
		switch (type) {
			case NEXT:
				return "NEXT(" + value + ")";
			case ERROR:
				return "ERROR(" + error + ")";
			default:
				return type.name();
		}
	}
}
