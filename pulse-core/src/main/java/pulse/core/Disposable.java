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

package pulse.core;

import java.util.function.Supplier;

import pulse.util.annotation.Nullable;

/**
 * Indicates that a task or resource can be cancelled/disposed.
 * <p>Call to dispose is expected to be idempotent.
 */
@FunctionalInterface
public interface Disposable {

	/**
	 * Cancel or dispose the underlying task or resource.
	 * <p>
	 * Implementations are required to make this method idempotent.
	 */
	void dispose();

	/**
	 * Optionally return {@literal true} when the resource or task is disposed.
	 * <p>
	 * Implementations are not required to track disposition and as such may never
	 * return {@literal true} even when disposed. However, they MUST only return true
	 * when there's a guarantee the resource or task is disposed.
	 *
	 * @return {@literal true} when there's a guarantee the resource or task is disposed.
	 */
	default boolean isDisposed() {
		return false;
	}

	/**
	 * A {@link Disposable} container that allows updating/replacing its inner Disposable
	 * atomically and with respect of disposing the container itself.
	 * <p>
	 * This is the "serial" slot of the disposal tree: switch-to-latest and
	 * error recovery keep their current inner run in one.
	 */
	interface Swap extends Disposable, Supplier<Disposable> {

		/**
		 * Atomically set the next {@link Disposable} on this container and dispose the previous
		 * one (if any) or dispose next if the container has been disposed.
		 *
		 * @param next the {@link Disposable} to set, may be null
		 * @return true if the operation succeeded, false if the container has been disposed
		 * @see #replace(Disposable)
		 */
		boolean update(@Nullable Disposable next);

		/**
		 * Atomically set the next {@link Disposable} on this container but don't dispose the previous
		 * one (if any) or dispose next if the container has been disposed.
		 *
		 * @param next the {@link Disposable} to set, may be null
		 * @return true if the operation succeeded, false if the container has been disposed
		 * @see #update(Disposable)
		 */
		boolean replace(@Nullable Disposable next);
	}

	/**
	 * A container of {@link Disposable} that is itself {@link Disposable}. Accumulate
	 * disposables and dispose them all in one go by using {@link #dispose()}. Using
	 * {@link #add(Disposable)} after the container has been disposed disposes the added
	 * value immediately.
	 * <p>
	 * Each addition hands back a {@link Handle} that removes that specific child without
	 * disposing it. Disposing the container disposes every child still registered,
	 * exactly once, even when several threads race to dispose.
	 */
	interface Composite extends Disposable {

		/**
		 * Add a {@link Disposable} to this container, if it is not {@link #isDisposed() disposed}.
		 * Otherwise d is disposed immediately.
		 *
		 * @param d the {@link Disposable} to add.
		 * @return the {@link Handle} removing d from this container, a no-op handle if d
		 * was disposed instead
		 */
		Handle add(Disposable d);

		/**
		 * Atomically mark the container as {@link #isDisposed() disposed}, clear it and then
		 * dispose all the previously contained Disposables. From there on the container
		 * cannot be reused, as {@link #add(Disposable)} will immediately dispose the new
		 * values.
		 * <p>
		 * Exceptions thrown by children are collected and rethrown once every child has
		 * been disposed.
		 */
		@Override
		void dispose();

		/**
		 * Indicates if the container has already been disposed.
		 *
		 * @return true if the container has been disposed, false otherwise.
		 */
		@Override
		boolean isDisposed();

		/**
		 * Returns the number of currently held Disposables.
		 *
		 * @return the number of currently held Disposables
		 */
		int size();

		/**
		 * Removes one child of a {@link Composite} without disposing it.
		 */
		@FunctionalInterface
		interface Handle {

			/**
			 * A {@link Handle} that does nothing, returned for additions to an already
			 * disposed container.
			 */
			Handle EMPTY = () -> { };

			/**
			 * Remove the child this handle was created for. Removing twice, or after the
			 * container was disposed, has no effect.
			 */
			void remove();
		}
	}
}
