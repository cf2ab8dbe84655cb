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

package pulse.util;

import java.util.Objects;
import java.util.function.Function;

import pulse.util.annotation.Nullable;

/**
 * The outcome of a synchronous operation: either a success carrying a value, or a
 * failure carrying an error.
 * <p>
 * Success values are non-null, except for {@code Result<Void, E>} where
 * {@link #success(Object) success(null)} is the only possible success.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the failure
 */
public abstract class Result<T, E> {

	/**
	 * Create a successful {@link Result}.
	 *
	 * @param value the success value
	 * @param <T> the type of the success value
	 * @param <E> the type of the failure
	 * @return a successful result
	 */
	public static <T, E> Result<T, E> success(@Nullable T value) {
		return new Success<>(value);
	}

	/**
	 * Create a failed {@link Result}.
	 *
	 * @param error the failure, not null
	 * @param <T> the type of the success value
	 * @param <E> the type of the failure
	 * @return a failed result
	 */
	public static <T, E> Result<T, E> failure(E error) {
		return new Failure<>(Objects.requireNonNull(error, "error"));
	}

	Result() {
	}

	public abstract boolean isSuccess();

	public final boolean isFailure() {
		return !isSuccess();
	}

	/**
	 * @return the success value, or null if this is a failure
	 */
	@Nullable
	public abstract T value();

	/**
	 * @return the failure, or null if this is a success
	 */
	@Nullable
	public abstract E error();

	/**
	 * Dispatch on the variant of this result.
	 *
	 * @param ifSuccess applied to the value of a success
	 * @param ifFailure applied to the error of a failure
	 * @param <R> the type of the outcome
	 * @return the outcome of whichever function was applied
	 */
	public abstract <R> R fold(Function<? super T, ? extends R> ifSuccess,
			Function<? super E, ? extends R> ifFailure);

	public final <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
		return fold(v -> success(mapper.apply(v)), Result::failure);
	}

	public final <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
		return fold(Result::success, e -> failure(mapper.apply(e)));
	}

	static final class Success<T, E> extends Result<T, E> {

		@Nullable
		final T value;

		Success(@Nullable T value) {
			this.value = value;
		}

		@Override
		public boolean isSuccess() {
			return true;
		}

		@Override
		@Nullable
		public T value() {
			return value;
		}

		@Override
		@Nullable
		public E error() {
			return null;
		}

		@Override
		public <R> R fold(Function<? super T, ? extends R> ifSuccess,
				Function<? super E, ? extends R> ifFailure) {
			return ifSuccess.apply(value);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Success && Objects.equals(value, ((Success<?, ?>) o).value);
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(value);
		}

		@Override
		public String toString() {
			return "Success(" + value + ")";
		}
	}

	static final class Failure<T, E> extends Result<T, E> {

		final E error;

		Failure(E error) {
			this.error = error;
		}

		@Override
		public boolean isSuccess() {
			return false;
		}

		@Override
		@Nullable
		public T value() {
			return null;
		}

		@Override
		public E error() {
			return error;
		}

		@Override
		public <R> R fold(Function<? super T, ? extends R> ifSuccess,
				Function<? super E, ? extends R> ifFailure) {
			return ifFailure.apply(error);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Failure && error.equals(((Failure<?, ?>) o).error);
		}

		@Override
		public int hashCode() {
			return 31 + error.hashCode();
		}

		@Override
		public String toString() {
			return "Failure(" + error + ")";
		}
	}
}
