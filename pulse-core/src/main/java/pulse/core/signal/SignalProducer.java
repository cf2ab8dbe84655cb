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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import pulse.core.Disposable;
import pulse.core.Disposables;
import pulse.core.scheduler.Scheduler;
import pulse.util.Logger;
import pulse.util.Loggers;
import pulse.util.Result;
import pulse.util.annotation.Nullable;
import pulse.util.function.Tuple2;
import pulse.util.function.Tuple3;
import pulse.util.function.Tuple4;
import pulse.util.function.Tuple5;
import pulse.util.function.Tuple6;
import pulse.util.function.Tuples;

/**
 * A cold, restartable factory of event streams. Building a producer has no side
 * effect: the work it describes runs each time it is started, and every start creates
 * a fresh {@link Signal} whose observers see the full history of that run.
 * <p>
 * Each start owns a disposal tree rooted in a {@link Disposable.Composite}. The root is
 * disposed once the run delivered its terminal event, or when the {@link Disposable}
 * returned by {@code start} is disposed, in which case the run is interrupted first.
 * <p>
 * Stream-level operators of {@link Signal} are available here through
 * {@link #lift(Function)} and {@link #lift(SignalProducer, BiFunction)}, which apply
 * them to every started signal.
 *
 * @param <T> the value type
 * @param <E> the error type
 */
public final class SignalProducer<T, E> {

	/**
	 * The work of a {@link SignalProducer}, run once per start.
	 *
	 * @param <T> the value type
	 * @param <E> the error type
	 */
	@FunctionalInterface
	public interface StartHandler<T, E> {

		/**
		 * Start the work, sending its events to {@code observer}.
		 *
		 * @param observer the observer of this run
		 * @param disposable the disposal root of this run, where resources of the work
		 * are registered
		 */
		void start(Observer<T, E> observer, Disposable.Composite disposable);
	}

	/**
	 * The producer and observer pair returned by {@link SignalProducer#buffer(int)}.
	 *
	 * @param <T> the value type
	 * @param <E> the error type
	 */
	public static final class Buffer<T, E> {

		final SignalProducer<T, E> producer;
		final Observer<T, E>       observer;

		Buffer(SignalProducer<T, E> producer, Observer<T, E> observer) {
			this.producer = producer;
			this.observer = observer;
		}

		/**
		 * @return the producer replaying the buffered events then following live ones
		 */
		public SignalProducer<T, E> producer() {
			return producer;
		}

		/**
		 * @return the observer feeding the buffer
		 */
		public Observer<T, E> observer() {
			return observer;
		}
	}

	static final SignalProducer<?, ?> EMPTY = new SignalProducer<>((observer, disposable) -> observer.sendCompleted());

	static final SignalProducer<?, ?> NEVER = new SignalProducer<>((observer, disposable) -> { });

	final StartHandler<T, E> startHandler;

	/**
	 * Create a producer running the given handler each time it is started.
	 *
	 * @param startHandler the work of the producer
	 */
	public SignalProducer(StartHandler<T, E> startHandler) {
		this.startHandler = Objects.requireNonNull(startHandler, "startHandler");
	}

	/**
	 * Create a producer running the given handler each time it is started.
	 *
	 * @param startHandler the work of the producer
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link SignalProducer}
	 */
	public static <T, E> SignalProducer<T, E> create(StartHandler<T, E> startHandler) {
		return new SignalProducer<>(startHandler);
	}

	/**
	 * Create a producer sending the given value then completing.
	 *
	 * @param value the value
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link SignalProducer}
	 */
	public static <T, E> SignalProducer<T, E> value(T value) {
		Objects.requireNonNull(value, "value");
		return new SignalProducer<>((observer, disposable) -> {
			observer.sendNext(value);
			observer.sendCompleted();
		});
	}

	/**
	 * Create a producer failing with the given error.
	 *
	 * @param error the error
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link SignalProducer}
	 */
	public static <T, E> SignalProducer<T, E> error(E error) {
		Objects.requireNonNull(error, "error");
		return new SignalProducer<>((observer, disposable) -> observer.sendError(error));
	}

	/**
	 * Create a producer sending the value of a successful result then completing, or
	 * failing with the error of a failed result.
	 *
	 * @param result the result
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link SignalProducer}
	 */
	public static <T, E> SignalProducer<T, E> result(Result<T, E> result) {
		if (result.isSuccess()) {
			return value(Objects.requireNonNull(result.value(), "value"));
		}
		return error(Objects.requireNonNull(result.error(), "error"));
	}

	/**
	 * Create a producer sending each element of the given {@link Iterable} then
	 * completing. Iteration stops early if the run is disposed.
	 *
	 * @param values the values
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link SignalProducer}
	 */
	public static <T, E> SignalProducer<T, E> fromIterable(Iterable<? extends T> values) {
		Objects.requireNonNull(values, "values");
		return new SignalProducer<>((observer, disposable) -> {
			for (T value : values) {
				observer.sendNext(value);
				if (disposable.isDisposed()) {
					return;
				}
			}
			observer.sendCompleted();
		});
	}

	/**
	 * Create a producer sending each of the given values then completing.
	 *
	 * @param values the values
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link SignalProducer}
	 */
	@SafeVarargs
	public static <T, E> SignalProducer<T, E> values(T... values) {
		return fromIterable(Arrays.asList(values));
	}

	/**
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a producer completing immediately
	 */
	@SuppressWarnings("unchecked")
	public static <T, E> SignalProducer<T, E> empty() {
		return (SignalProducer<T, E>) EMPTY;
	}

	/**
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a producer sending nothing, ever
	 */
	@SuppressWarnings("unchecked")
	public static <T, E> SignalProducer<T, E> never() {
		return (SignalProducer<T, E>) NEVER;
	}

	/**
	 * Create a producer running the given operation on each start, sending its value
	 * then completing on success, failing with its error otherwise.
	 *
	 * @param operation the operation
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link SignalProducer}
	 */
	public static <T, E> SignalProducer<T, E> attempt(Supplier<? extends Result<T, E>> operation) {
		Objects.requireNonNull(operation, "operation");
		return new SignalProducer<>((observer, disposable) -> {
			Result<T, E> result = operation.get();
			if (result.isSuccess()) {
				observer.sendNext(result.value());
				observer.sendCompleted();
			}
			else {
				observer.sendError(result.error());
			}
		});
	}

	/**
	 * Create an unbounded replay buffer.
	 *
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link Buffer}
	 * @see #buffer(int)
	 */
	public static <T, E> Buffer<T, E> buffer() {
		return buffer(Integer.MAX_VALUE);
	}

	/**
	 * Create a replay buffer: events sent to the returned observer are forwarded to
	 * every started run of the returned producer, and the latest {@code capacity}
	 * values are replayed to runs started later. Once a terminal event was sent, it is
	 * replayed too and further events are ignored. The terminal event does not count
	 * against the capacity.
	 *
	 * @param capacity the maximum number of values replayed
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link Buffer}
	 */
	public static <T, E> Buffer<T, E> buffer(int capacity) {
		if (capacity < 0) {
			throw new IllegalArgumentException("capacity >= 0 required but it was " + capacity);
		}
		ProducerBuffer<T, E> buffer = new ProducerBuffer<>(capacity);
		return new Buffer<>(new SignalProducer<>(buffer), buffer);
	}

	/**
	 * Create a producer sending the current time of the scheduler every
	 * {@code interval}. It never completes, so each run must be disposed.
	 *
	 * @param interval the period, positive
	 * @param scheduler the time-capable scheduler
	 * @return a new {@link SignalProducer}
	 */
	public static SignalProducer<Instant, NoError> timer(Duration interval, Scheduler scheduler) {
		Objects.requireNonNull(scheduler, "scheduler");
		if (interval.isNegative() || interval.isZero()) {
			throw new IllegalArgumentException("interval > 0 required but it was " + interval);
		}
		long nanos = interval.toNanos();
		return new SignalProducer<>((observer, disposable) -> disposable.add(scheduler.schedulePeriodically(
				() -> observer.sendNext(Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS))),
				nanos, nanos, TimeUnit.NANOSECONDS)));
	}

	/**
	 * Create a {@link Signal} for a new run of this producer, hand it to {@code setUp}
	 * along with the {@link Disposable} interrupting the run, then start the work.
	 * <p>
	 * If {@code setUp} already disposed the run, the work is not started.
	 *
	 * @param setUp receives the signal and the interrupting {@link Disposable}
	 */
	public void startWithSignal(BiConsumer<? super Signal<T, E>, ? super Disposable> setUp) {
		Signal.Pipe<T, E> pipe = Signal.pipe();
		Observer<T, E> sink = pipe.observer();

		// disposes of the work of this run and of upstream producers
		Disposable.Composite producerDisposable = Disposables.composite();

		Disposable cancelDisposable = Disposables.action(() -> {
			sink.sendInterrupted();
			producerDisposable.dispose();
		});

		setUp.accept(pipe.signal(), cancelDisposable);

		if (cancelDisposable.isDisposed()) {
			return;
		}

		Observer<T, E> wrapperObserver = event -> {
			sink.onEvent(event);

			if (event.isTerminating()) {
				// after the signal, so disposal always runs last
				producerDisposable.dispose();
			}
		};

		startHandler.start(wrapperObserver, producerDisposable);
	}

	/**
	 * Start a run without observing it.
	 *
	 * @return the {@link Disposable} interrupting the run
	 */
	public Disposable start() {
		return start(event -> { });
	}

	/**
	 * Start a run observed by the given {@link Observer}.
	 *
	 * @param observer the observer
	 * @return the {@link Disposable} interrupting the run
	 */
	public Disposable start(Observer<T, E> observer) {
		Objects.requireNonNull(observer, "observer");
		AtomicReference<Disposable> disposable = new AtomicReference<>();
		startWithSignal((signal, innerDisposable) -> {
			signal.observe(observer);
			disposable.set(innerDisposable);
		});
		return disposable.get();
	}

	/**
	 * Start a run, dispatching its events to the given callbacks. Null callbacks are
	 * ignored.
	 *
	 * @param onNext called with each value
	 * @param onError called with the error
	 * @param onCompleted called on completion
	 * @param onInterrupted called on interruption
	 * @return the {@link Disposable} interrupting the run
	 */
	public Disposable start(@Nullable Consumer<? super T> onNext,
			@Nullable Consumer<? super E> onError,
			@Nullable Runnable onCompleted,
			@Nullable Runnable onInterrupted) {
		return start(Observer.of(onNext, onError, onCompleted, onInterrupted));
	}

	/**
	 * Start a run, calling {@code onNext} with each value.
	 *
	 * @param onNext called with each value
	 * @return the {@link Disposable} interrupting the run
	 */
	public Disposable startWithNext(Consumer<? super T> onNext) {
		Objects.requireNonNull(onNext, "onNext");
		return start(Observer.of(onNext, null, null, null));
	}

	/**
	 * Apply a {@link Signal} operator to every run of this producer.
	 *
	 * @param transform the signal operator
	 * @param <U> the value type of the result
	 * @param <F> the error type of the result
	 * @return a new {@link SignalProducer}
	 */
	public <U, F> SignalProducer<U, F> lift(Function<? super Signal<T, E>, ? extends Signal<U, F>> transform) {
		Objects.requireNonNull(transform, "transform");
		return new SignalProducer<>((observer, outerDisposable) -> startWithSignal((signal, innerDisposable) -> {
			outerDisposable.add(innerDisposable);

			transform.apply(signal).observe(observer);
		}));
	}

	/**
	 * Apply a binary {@link Signal} operator to every run of this producer and a run of
	 * {@code other}, both sharing the disposal tree of the result.
	 *
	 * @param other the other producer
	 * @param transform the signal operator
	 * @param <U> the value type of the other producer
	 * @param <F> the error type of the other producer
	 * @param <V> the value type of the result
	 * @param <G> the error type of the result
	 * @return a new {@link SignalProducer}
	 */
	public <U, F, V, G> SignalProducer<V, G> lift(SignalProducer<U, F> other,
			BiFunction<? super Signal<T, E>, ? super Signal<U, F>, ? extends Signal<V, G>> transform) {
		Objects.requireNonNull(other, "other");
		Objects.requireNonNull(transform, "transform");
		return new SignalProducer<>((observer, outerDisposable) -> startWithSignal((signal, disposable) -> {
			outerDisposable.add(disposable);

			other.startWithSignal((otherSignal, otherDisposable) -> {
				outerDisposable.add(otherDisposable);

				transform.apply(signal, otherSignal).observe(observer);
			});
		}));
	}

	/**
	 * Transform the values of each run by applying a synchronous function to each of them.
	 *
	 * @param mapper the value transformation
	 * @param <U> the new value type
	 * @return a transformed {@link SignalProducer}
	 */
	public <U> SignalProducer<U, E> map(Function<? super T, ? extends U> mapper) {
		Objects.requireNonNull(mapper, "mapper");
		return lift(signal -> signal.map(mapper));
	}

	/**
	 * Transform the error of each run by applying a synchronous function to it.
	 *
	 * @param mapper the error transformation
	 * @param <F> the new error type
	 * @return a transformed {@link SignalProducer}
	 */
	public <F> SignalProducer<T, F> mapError(Function<? super E, ? extends F> mapper) {
		Objects.requireNonNull(mapper, "mapper");
		return lift(signal -> signal.mapError(mapper));
	}

	/**
	 * Evaluate each value against the given {@link Predicate}, forwarding it only if the
	 * predicate holds. Terminal events are always forwarded.
	 *
	 * @param predicate the value filter
	 * @return a filtered {@link SignalProducer}
	 */
	public SignalProducer<T, E> filter(Predicate<? super T> predicate) {
		Objects.requireNonNull(predicate, "predicate");
		return lift(signal -> signal.filter(predicate));
	}

	/**
	 * Forward up to {@code count} values then complete. Taking zero values completes
	 * right away without starting this producer.
	 *
	 * @param count the number of values to take
	 * @return a new {@link SignalProducer}
	 * @see Signal#take(int)
	 */
	public SignalProducer<T, E> take(int count) {
		checkCount(count);
		if (count == 0) {
			return empty();
		}
		return lift(signal -> signal.take(count));
	}

	/**
	 * @param count the number of values to keep
	 * @return a producer forwarding the last {@code count} values upon completion
	 * @see Signal#takeLast(int)
	 */
	public SignalProducer<T, E> takeLast(int count) {
		checkCount(count);
		return lift(signal -> signal.takeLast(count));
	}

	/**
	 * @param count the number of leading values to drop
	 * @return a producer dropping the first {@code count} values
	 */
	public SignalProducer<T, E> skip(int count) {
		checkCount(count);
		return lift(signal -> signal.skip(count));
	}

	/**
	 * Drop values while {@code predicate} holds. Once it first fails, that value and every
	 * following one are forwarded.
	 *
	 * @param predicate the skip condition
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> skipWhile(Predicate<? super T> predicate) {
		Objects.requireNonNull(predicate, "predicate");
		return lift(signal -> signal.skipWhile(predicate));
	}

	/**
	 * Forward values while {@code predicate} holds, completing on the first value that
	 * fails it. That value is not forwarded.
	 *
	 * @param predicate the take condition
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> takeWhile(Predicate<? super T> predicate) {
		Objects.requireNonNull(predicate, "predicate");
		return lift(signal -> signal.takeWhile(predicate));
	}

	/**
	 * @return a producer sending all values as a single {@link List} upon completion
	 */
	public SignalProducer<List<T>, E> collect() {
		return lift(Signal::collect);
	}

	/**
	 * Accumulate the values of each run with {@code accumulator}, sending every
	 * intermediate accumulation. The initial value is not sent.
	 *
	 * @param initial the accumulation the first value is combined with
	 * @param accumulator combines the current accumulation with each value
	 * @param <U> the accumulation type
	 * @return a new {@link SignalProducer}
	 */
	public <U> SignalProducer<U, E> scan(U initial, BiFunction<U, ? super T, U> accumulator) {
		Objects.requireNonNull(accumulator, "accumulator");
		return lift(signal -> signal.scan(initial, accumulator));
	}

	/**
	 * Like {@link #scan(Object, BiFunction)}, but send only the final accumulation, upon
	 * completion. A run completing without values sends {@code initial}.
	 *
	 * @param initial the accumulation the first value is combined with
	 * @param accumulator combines the current accumulation with each value
	 * @param <U> the accumulation type
	 * @return a new {@link SignalProducer}
	 */
	public <U> SignalProducer<U, E> reduce(U initial, BiFunction<U, ? super T, U> accumulator) {
		Objects.requireNonNull(accumulator, "accumulator");
		return lift(signal -> signal.reduce(initial, accumulator));
	}

	/**
	 * Drop each value that {@code isRepeat} considers a repeat of the previous value. The
	 * first value of a run is always forwarded.
	 *
	 * @param isRepeat tests the previous value against the current one
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> skipRepeats(BiPredicate<? super T, ? super T> isRepeat) {
		Objects.requireNonNull(isRepeat, "isRepeat");
		return lift(signal -> signal.skipRepeats(isRepeat));
	}

	/**
	 * @return a producer dropping values {@link Object#equals(Object) equal} to the
	 * previous value
	 */
	public SignalProducer<T, E> skipRepeats() {
		return lift(Signal::skipRepeats);
	}

	/**
	 * Pair each value with the value before it. The first value of a run is paired with
	 * {@code initial}.
	 *
	 * @param initial the previous value of the first value
	 * @return a new {@link SignalProducer} of (previous, current) pairs
	 */
	public SignalProducer<Tuple2<T, T>, E> combinePrevious(T initial) {
		Objects.requireNonNull(initial, "initial");
		return lift(signal -> signal.combinePrevious(initial));
	}

	/**
	 * @return a producer sending every event as a value
	 * @see Signal#materialize()
	 */
	public SignalProducer<Event<T, E>, NoError> materialize() {
		return lift(Signal::materialize);
	}

	/**
	 * Turn a {@link #materialize() materialized} producer back into its events.
	 *
	 * @param producer the materialized producer
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link SignalProducer}
	 */
	public static <T, E> SignalProducer<T, E> dematerialize(SignalProducer<Event<T, E>, NoError> producer) {
		return producer.lift(signal -> Signal.dematerialize(signal));
	}

	/**
	 * Widen a producer that cannot fail to any error type.
	 *
	 * @param producer the producer that cannot fail
	 * @param <T> the value type
	 * @param <F> the new error type
	 * @return a new {@link SignalProducer}
	 */
	public static <T, F> SignalProducer<T, F> promoteErrors(SignalProducer<T, NoError> producer) {
		return producer.lift(signal -> Signal.<T, F>promoteErrors(signal));
	}

	/**
	 * Deliver the events of each run on the given {@link Scheduler}. The start itself
	 * stays on the calling thread, see {@link #startOn(Scheduler)}.
	 *
	 * @param scheduler the scheduler delivering events
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> observeOn(Scheduler scheduler) {
		Objects.requireNonNull(scheduler, "scheduler");
		return lift(signal -> signal.observeOn(scheduler));
	}

	/**
	 * Shift values and completion forward in time by {@code interval}. Errors and
	 * interruption are delivered on {@code scheduler} without delay.
	 *
	 * @param interval the delay, not negative
	 * @param scheduler the time-capable scheduler delivering events
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> delay(Duration interval, Scheduler scheduler) {
		checkInterval(interval);
		Objects.requireNonNull(scheduler, "scheduler");
		return lift(signal -> signal.delay(interval, scheduler));
	}

	/**
	 * Let at least {@code interval} pass between two values, forwarding the latest value
	 * received in each window. A value still pending when the run terminates is dropped.
	 *
	 * @param interval the minimum interval between values, not negative
	 * @param scheduler the time-capable scheduler delivering values
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> throttle(Duration interval, Scheduler scheduler) {
		checkInterval(interval);
		Objects.requireNonNull(scheduler, "scheduler");
		return lift(signal -> signal.throttle(interval, scheduler));
	}

	/**
	 * Fail each run with {@code error} unless it terminates within {@code interval}.
	 *
	 * @param error the error sent on timeout
	 * @param interval the time allowed, not negative
	 * @param scheduler the time-capable scheduler measuring time
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> timeoutWithError(E error, Duration interval, Scheduler scheduler) {
		Objects.requireNonNull(error, "error");
		checkInterval(interval);
		Objects.requireNonNull(scheduler, "scheduler");
		return lift(signal -> signal.timeoutWithError(error, interval, scheduler));
	}

	/**
	 * Run a fallible operation for each value. Values go through unchanged while it
	 * succeeds, and the run fails with the operation's error the first time it fails.
	 *
	 * @param operation the operation applied to each value
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> attempt(Function<? super T, Result<Void, E>> operation) {
		Objects.requireNonNull(operation, "operation");
		return lift(signal -> signal.attempt(operation));
	}

	/**
	 * Map each value through a fallible operation, failing the run with the operation's
	 * error the first time it fails.
	 *
	 * @param operation the operation applied to each value
	 * @param <U> the new value type
	 * @return a new {@link SignalProducer}
	 */
	public <U> SignalProducer<U, E> attemptMap(Function<? super T, Result<U, E>> operation) {
		Objects.requireNonNull(operation, "operation");
		return lift(signal -> signal.attemptMap(operation));
	}

	/**
	 * Combine the latest values of this producer and {@code other}, both started for each
	 * run. Nothing is sent until both sent a value. The run completes once both completed
	 * and fails as soon as either fails.
	 *
	 * @param other the other producer
	 * @param <U> the value type of {@code other}
	 * @return a {@link SignalProducer} of (latest, latest) pairs
	 */
	public <U> SignalProducer<Tuple2<T, U>, E> combineLatestWith(SignalProducer<U, E> other) {
		return lift(other, (signal, otherSignal) -> signal.combineLatestWith(otherSignal));
	}

	/**
	 * Pair the n-th value of this producer with the n-th value of {@code other}, both
	 * started for each run. The run completes once either producer completed and all of
	 * its values were paired.
	 *
	 * @param other the other producer
	 * @param <U> the value type of {@code other}
	 * @return a {@link SignalProducer} of pairs
	 */
	public <U> SignalProducer<Tuple2<T, U>, E> zipWith(SignalProducer<U, E> other) {
		return lift(other, (signal, otherSignal) -> signal.zipWith(otherSignal));
	}

	/**
	 * @param sampler the sampling producer
	 * @return a producer forwarding the latest value each time {@code sampler} sends a value
	 * @see Signal#sampleOn(Signal)
	 */
	public SignalProducer<T, E> sampleOn(SignalProducer<?, NoError> sampler) {
		return lift(sampler, (signal, samplerSignal) -> signal.sampleOn(samplerSignal));
	}

	/**
	 * @param trigger the completion trigger
	 * @return a producer completing when {@code trigger} sends a value or completes
	 * @see Signal#takeUntil(Signal)
	 */
	public SignalProducer<T, E> takeUntil(SignalProducer<?, NoError> trigger) {
		return lift(trigger, (signal, triggerSignal) -> signal.takeUntil(triggerSignal));
	}

	/**
	 * @param replacement the replacing producer
	 * @return a producer switching to {@code replacement} once it sends its first event
	 * @see Signal#takeUntilReplacement(Signal)
	 */
	public SignalProducer<T, E> takeUntilReplacement(SignalProducer<T, E> replacement) {
		return lift(replacement, (signal, replacementSignal) -> signal.takeUntilReplacement(replacementSignal));
	}

	/**
	 * Inject side effects into each run. {@code started} runs before the run starts,
	 * {@code disposed} once its disposal tree is disposed, after the upstream run, and
	 * the event callbacks before each event is forwarded. Any callback can be null.
	 *
	 * @param started called when a run starts
	 * @param event called with every event
	 * @param error called with the error
	 * @param completed called on completion
	 * @param interrupted called on interruption
	 * @param terminated called on any terminal event
	 * @param disposed called when the run is disposed
	 * @param next called with each value
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> on(@Nullable Runnable started,
			@Nullable Consumer<? super Event<T, E>> event,
			@Nullable Consumer<? super E> error,
			@Nullable Runnable completed,
			@Nullable Runnable interrupted,
			@Nullable Runnable terminated,
			@Nullable Runnable disposed,
			@Nullable Consumer<? super T> next) {
		return new SignalProducer<>((observer, compositeDisposable) -> {
			if (started != null) {
				started.run();
			}

			startWithSignal((signal, disposable) -> {
				compositeDisposable.add(disposable);

				signal.observe(receivedEvent -> {
					if (event != null) {
						event.accept(receivedEvent);
					}

					switch (receivedEvent.getType()) {
						case NEXT:
							if (next != null) {
								next.accept(receivedEvent.get());
							}
							break;
						case ERROR:
							if (error != null) {
								error.accept(receivedEvent.getError());
							}
							break;
						case COMPLETED:
							if (completed != null) {
								completed.run();
							}
							break;
						case INTERRUPTED:
							if (interrupted != null) {
								interrupted.run();
							}
							break;
					}

					if (terminated != null && receivedEvent.isTerminating()) {
						terminated.run();
					}

					observer.onEvent(receivedEvent);
				});
			});

			// after the run, so it is disposed last
			if (disposed != null) {
				compositeDisposable.add(Disposables.action(disposed));
			}
		});
	}

	/**
	 * @param started called before each run starts
	 * @return a new {@link SignalProducer}
	 * @see #on(Runnable, Consumer, Consumer, Runnable, Runnable, Runnable, Runnable, Consumer)
	 */
	public SignalProducer<T, E> doOnStarted(Runnable started) {
		Objects.requireNonNull(started, "started");
		return on(started, null, null, null, null, null, null, null);
	}

	/**
	 * Add behavior triggered with every event, before it is forwarded.
	 *
	 * @param event the callback
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> doOnEvent(Consumer<? super Event<T, E>> event) {
		Objects.requireNonNull(event, "event");
		return on(null, event, null, null, null, null, null, null);
	}

	/**
	 * Add behavior triggered with each value, before it is forwarded.
	 *
	 * @param next the callback
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> doOnNext(Consumer<? super T> next) {
		Objects.requireNonNull(next, "next");
		return on(null, null, null, null, null, null, null, next);
	}

	/**
	 * Add behavior triggered with the error of a run, before it is forwarded.
	 *
	 * @param error the callback
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> doOnError(Consumer<? super E> error) {
		Objects.requireNonNull(error, "error");
		return on(null, null, error, null, null, null, null, null);
	}

	/**
	 * Add behavior triggered when a run completes, before completion is forwarded.
	 *
	 * @param completed the callback
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> doOnCompleted(Runnable completed) {
		Objects.requireNonNull(completed, "completed");
		return on(null, null, null, completed, null, null, null, null);
	}

	/**
	 * Add behavior triggered when a run is interrupted, including by its own
	 * cancellation.
	 *
	 * @param interrupted the callback
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> doOnInterrupted(Runnable interrupted) {
		Objects.requireNonNull(interrupted, "interrupted");
		return on(null, null, null, null, interrupted, null, null, null);
	}

	/**
	 * Add behavior triggered by any terminal event: completion, error or interruption.
	 *
	 * @param terminated the callback
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> doOnTerminated(Runnable terminated) {
		Objects.requireNonNull(terminated, "terminated");
		return on(null, null, null, null, null, terminated, null, null);
	}

	/**
	 * Add behavior triggered once the disposal tree of a run is disposed, whether it
	 * terminated or was cancelled.
	 *
	 * @param disposed the callback
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> doOnDisposed(Runnable disposed) {
		Objects.requireNonNull(disposed, "disposed");
		return on(null, null, null, null, null, null, disposed, null);
	}

	/**
	 * Log the lifecycle and events of each run at INFO level, under the
	 * {@value #DEFAULT_LOG_CATEGORY} category.
	 *
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> log() {
		return log(DEFAULT_LOG_CATEGORY);
	}

	/**
	 * Log the lifecycle and events of each run at INFO level.
	 *
	 * @param category the logger category
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> log(String category) {
		Logger logger = Loggers.getLogger(Objects.requireNonNull(category, "category"));
		return on(() -> logger.info("started"),
				event -> logger.info("{}", event),
				null, null, null, null,
				() -> logger.info("disposed"),
				null);
	}

	static final String DEFAULT_LOG_CATEGORY = "pulse.SignalProducer";

	/**
	 * Start each run on the given scheduler. Only the start moves: events are still
	 * sent wherever the work sends them. Disposing the run before the scheduled start
	 * prevents it.
	 *
	 * @param scheduler the scheduler running the start
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> startOn(Scheduler scheduler) {
		Objects.requireNonNull(scheduler, "scheduler");
		return new SignalProducer<>((observer, compositeDisposable) -> compositeDisposable.add(scheduler.schedule(
				() -> startWithSignal((signal, signalDisposable) -> {
					compositeDisposable.add(signalDisposable);
					signal.observe(observer);
				}))));
	}

	/**
	 * Join a producer of producers into a single producer, according to the given
	 * strategy. Errors of the outer or of any inner producer are forwarded immediately;
	 * interruption of an inner producer counts as its completion.
	 *
	 * @param producer the producer of producers
	 * @param strategy the {@link FlattenStrategy}
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link SignalProducer}
	 */
	public static <T, E> SignalProducer<T, E> flatten(SignalProducer<SignalProducer<T, E>, E> producer,
			FlattenStrategy strategy) {
		Objects.requireNonNull(producer, "producer");
		Objects.requireNonNull(strategy, "strategy");
		switch (strategy) {
			case MERGE:
				return new SignalProducer<>(new ProducerMerge<>(producer));
			case CONCAT:
				return new SignalProducer<>(new ProducerConcat<>(producer));
			case LATEST:
				return new SignalProducer<>(new ProducerSwitchToLatest<>(producer));
			default:
				throw new IllegalArgumentException("Unknown strategy " + strategy);
		}
	}

	/**
	 * Map each value to a producer, then {@link #flatten(SignalProducer, FlattenStrategy)
	 * flatten} them with the given strategy.
	 *
	 * @param strategy the {@link FlattenStrategy}
	 * @param transform maps each value to a producer
	 * @param <U> the value type of the result
	 * @return a new {@link SignalProducer}
	 */
	public <U> SignalProducer<U, E> flatMap(FlattenStrategy strategy,
			Function<? super T, ? extends SignalProducer<U, E>> transform) {
		Objects.requireNonNull(transform, "transform");
		SignalProducer<SignalProducer<U, E>, E> producers = map(transform);
		return flatten(producers, strategy);
	}

	/**
	 * Recover from an error by starting the producer returned by {@code handler} in
	 * place of this one.
	 *
	 * @param handler maps the error to a replacement producer
	 * @param <F> the error type of the replacement
	 * @return a new {@link SignalProducer}
	 */
	public <F> SignalProducer<T, F> flatMapError(Function<? super E, ? extends SignalProducer<T, F>> handler) {
		Objects.requireNonNull(handler, "handler");
		return new SignalProducer<>(new ProducerFlatMapError<>(this, handler));
	}

	/**
	 * @param next the producer started once this one completed
	 * @return a producer forwarding this producer then {@code next}
	 */
	public SignalProducer<T, E> concat(SignalProducer<T, E> next) {
		Objects.requireNonNull(next, "next");
		return flatten(SignalProducer.<SignalProducer<T, E>, E>values(this, next), FlattenStrategy.CONCAT);
	}

	/**
	 * Wait for this producer to complete, ignoring its values, then forward
	 * {@code replacement}. An error of this producer is forwarded and
	 * {@code replacement} is never started. Interruption counts as completion, as it
	 * does for {@link #concat(SignalProducer)}.
	 *
	 * @param replacement the producer started on completion
	 * @param <U> the value type of the replacement
	 * @return a new {@link SignalProducer}
	 */
	public <U> SignalProducer<U, E> then(SignalProducer<U, E> replacement) {
		Objects.requireNonNull(replacement, "replacement");
		SignalProducer<U, E> relay = new SignalProducer<>((observer, observerDisposable) ->
				startWithSignal((signal, signalDisposable) -> {
					observerDisposable.add(signalDisposable);

					signal.observe(event -> {
						if (event.getType() != Event.Type.NEXT) {
							observer.onEvent(event.retype());
						}
					});
				}));
		return relay.concat(replacement);
	}

	/**
	 * Repeat this producer {@code count} times in total, restarting it on each
	 * completion. Repeating once is this producer, repeating zero times is
	 * {@link #empty()}.
	 *
	 * @param count the number of runs
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> times(int count) {
		checkCount(count);
		if (count == 0) {
			return empty();
		}
		if (count == 1) {
			return this;
		}
		return new SignalProducer<>(new ProducerTimes<>(this, count));
	}

	/**
	 * Ignore up to {@code count} errors, restarting this producer after each one.
	 *
	 * @param count the number of retries
	 * @return a new {@link SignalProducer}
	 */
	public SignalProducer<T, E> retry(int count) {
		checkCount(count);
		if (count == 0) {
			return this;
		}
		return flatMapError(e -> retry(count - 1));
	}

	/**
	 * Combine the latest values of two producers, see {@link #combineLatestWith(SignalProducer)}.
	 *
	 * @param a the first producer
	 * @param b the second producer
	 * @param <A> the value type of {@code a}
	 * @param <B> the value type of {@code b}
	 * @param <E> the error type
	 * @return a {@link SignalProducer} of {@link pulse.util.function.Tuple2}
	 */
	public static <A, B, E> SignalProducer<Tuple2<A, B>, E> combineLatest(SignalProducer<A, E> a,
			SignalProducer<B, E> b) {
		return a.combineLatestWith(b);
	}

	/**
	 * Combine the latest values of 3 producers. Nothing is sent until each of them
	 * sent a value; the run completes once all of them completed.
	 *
	 * @param a the first producer
	 * @param b the second producer
	 * @param c the third producer
	 * @param <A> the value type of {@code a}
	 * @param <B> the value type of {@code b}
	 * @param <C> the value type of {@code c}
	 * @param <E> the error type
	 * @return a {@link SignalProducer} of {@link pulse.util.function.Tuple3}
	 */
	public static <A, B, C, E> SignalProducer<Tuple3<A, B, C>, E> combineLatest(SignalProducer<A, E> a,
			SignalProducer<B, E> b,
			SignalProducer<C, E> c) {
		return combineLatest(a, b).combineLatestWith(c)
		                          .map(t -> Tuples.append(t.getT1(), t.getT2()));
	}

	/**
	 * Combine the latest values of 4 producers. Nothing is sent until each of them
	 * sent a value; the run completes once all of them completed.
	 *
	 * @param a the first producer
	 * @param b the second producer
	 * @param c the third producer
	 * @param d the fourth producer
	 * @param <A> the value type of {@code a}
	 * @param <B> the value type of {@code b}
	 * @param <C> the value type of {@code c}
	 * @param <D> the value type of {@code d}
	 * @param <E> the error type
	 * @return a {@link SignalProducer} of {@link pulse.util.function.Tuple4}
	 */
	public static <A, B, C, D, E> SignalProducer<Tuple4<A, B, C, D>, E> combineLatest(SignalProducer<A, E> a,
			SignalProducer<B, E> b,
			SignalProducer<C, E> c,
			SignalProducer<D, E> d) {
		return combineLatest(a, b, c).combineLatestWith(d)
		                             .map(t -> Tuples.append(t.getT1(), t.getT2()));
	}

	/**
	 * Combine the latest values of 5 producers. Nothing is sent until each of them
	 * sent a value; the run completes once all of them completed.
	 *
	 * @param a the first producer
	 * @param b the second producer
	 * @param c the third producer
	 * @param d the fourth producer
	 * @param f the fifth producer
	 * @param <A> the value type of {@code a}
	 * @param <B> the value type of {@code b}
	 * @param <C> the value type of {@code c}
	 * @param <D> the value type of {@code d}
	 * @param <F> the value type of {@code f}
	 * @param <E> the error type
	 * @return a {@link SignalProducer} of {@link pulse.util.function.Tuple5}
	 */
	public static <A, B, C, D, F, E> SignalProducer<Tuple5<A, B, C, D, F>, E> combineLatest(SignalProducer<A, E> a,
			SignalProducer<B, E> b,
			SignalProducer<C, E> c,
			SignalProducer<D, E> d,
			SignalProducer<F, E> f) {
		return combineLatest(a, b, c, d).combineLatestWith(f)
		                                .map(t -> Tuples.append(t.getT1(), t.getT2()));
	}

	/**
	 * Combine the latest values of 6 producers. Nothing is sent until each of them
	 * sent a value; the run completes once all of them completed.
	 *
	 * @param a the first producer
	 * @param b the second producer
	 * @param c the third producer
	 * @param d the fourth producer
	 * @param f the fifth producer
	 * @param g the sixth producer
	 * @param <A> the value type of {@code a}
	 * @param <B> the value type of {@code b}
	 * @param <C> the value type of {@code c}
	 * @param <D> the value type of {@code d}
	 * @param <F> the value type of {@code f}
	 * @param <G> the value type of {@code g}
	 * @param <E> the error type
	 * @return a {@link SignalProducer} of {@link pulse.util.function.Tuple6}
	 */
	public static <A, B, C, D, F, G, E> SignalProducer<Tuple6<A, B, C, D, F, G>, E> combineLatest(SignalProducer<A, E> a,
			SignalProducer<B, E> b,
			SignalProducer<C, E> c,
			SignalProducer<D, E> d,
			SignalProducer<F, E> f,
			SignalProducer<G, E> g) {
		return combineLatest(a, b, c, d, f).combineLatestWith(g)
		                                   .map(t -> Tuples.append(t.getT1(), t.getT2()));
	}

	/**
	 * Combine the latest values of all the given producers into a {@link List}, in the
	 * manner of {@link #combineLatestWith(SignalProducer)}.
	 *
	 * @param producers the producers to combine
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link SignalProducer}, {@link #empty()} if there is no producer
	 */
	public static <T, E> SignalProducer<List<T>, E> combineLatest(Iterable<? extends SignalProducer<T, E>> producers) {
		Iterator<? extends SignalProducer<T, E>> iterator = producers.iterator();
		if (!iterator.hasNext()) {
			return empty();
		}
		SignalProducer<List<T>, E> combined = iterator.next().map(Collections::singletonList);
		while (iterator.hasNext()) {
			combined = combined.combineLatestWith(iterator.next()).map(SignalProducer::appendValue);
		}
		return combined;
	}

	/**
	 * Zip the values of two producers, see {@link #zipWith(SignalProducer)}.
	 *
	 * @param a the first producer
	 * @param b the second producer
	 * @param <A> the value type of {@code a}
	 * @param <B> the value type of {@code b}
	 * @param <E> the error type
	 * @return a {@link SignalProducer} of {@link pulse.util.function.Tuple2}
	 */
	public static <A, B, E> SignalProducer<Tuple2<A, B>, E> zip(SignalProducer<A, E> a,
			SignalProducer<B, E> b) {
		return a.zipWith(b);
	}

	/**
	 * Zip the values of 3 producers, pairing them by index. The run completes once
	 * one producer completed and all of its values were zipped.
	 *
	 * @param a the first producer
	 * @param b the second producer
	 * @param c the third producer
	 * @param <A> the value type of {@code a}
	 * @param <B> the value type of {@code b}
	 * @param <C> the value type of {@code c}
	 * @param <E> the error type
	 * @return a {@link SignalProducer} of {@link pulse.util.function.Tuple3}
	 */
	public static <A, B, C, E> SignalProducer<Tuple3<A, B, C>, E> zip(SignalProducer<A, E> a,
			SignalProducer<B, E> b,
			SignalProducer<C, E> c) {
		return zip(a, b).zipWith(c)
		                .map(t -> Tuples.append(t.getT1(), t.getT2()));
	}

	/**
	 * Zip the values of 4 producers, pairing them by index. The run completes once
	 * one producer completed and all of its values were zipped.
	 *
	 * @param a the first producer
	 * @param b the second producer
	 * @param c the third producer
	 * @param d the fourth producer
	 * @param <A> the value type of {@code a}
	 * @param <B> the value type of {@code b}
	 * @param <C> the value type of {@code c}
	 * @param <D> the value type of {@code d}
	 * @param <E> the error type
	 * @return a {@link SignalProducer} of {@link pulse.util.function.Tuple4}
	 */
	public static <A, B, C, D, E> SignalProducer<Tuple4<A, B, C, D>, E> zip(SignalProducer<A, E> a,
			SignalProducer<B, E> b,
			SignalProducer<C, E> c,
			SignalProducer<D, E> d) {
		return zip(a, b, c).zipWith(d)
		                   .map(t -> Tuples.append(t.getT1(), t.getT2()));
	}

	/**
	 * Zip the values of 5 producers, pairing them by index. The run completes once
	 * one producer completed and all of its values were zipped.
	 *
	 * @param a the first producer
	 * @param b the second producer
	 * @param c the third producer
	 * @param d the fourth producer
	 * @param f the fifth producer
	 * @param <A> the value type of {@code a}
	 * @param <B> the value type of {@code b}
	 * @param <C> the value type of {@code c}
	 * @param <D> the value type of {@code d}
	 * @param <F> the value type of {@code f}
	 * @param <E> the error type
	 * @return a {@link SignalProducer} of {@link pulse.util.function.Tuple5}
	 */
	public static <A, B, C, D, F, E> SignalProducer<Tuple5<A, B, C, D, F>, E> zip(SignalProducer<A, E> a,
			SignalProducer<B, E> b,
			SignalProducer<C, E> c,
			SignalProducer<D, E> d,
			SignalProducer<F, E> f) {
		return zip(a, b, c, d).zipWith(f)
		                      .map(t -> Tuples.append(t.getT1(), t.getT2()));
	}

	/**
	 * Zip the values of 6 producers, pairing them by index. The run completes once
	 * one producer completed and all of its values were zipped.
	 *
	 * @param a the first producer
	 * @param b the second producer
	 * @param c the third producer
	 * @param d the fourth producer
	 * @param f the fifth producer
	 * @param g the sixth producer
	 * @param <A> the value type of {@code a}
	 * @param <B> the value type of {@code b}
	 * @param <C> the value type of {@code c}
	 * @param <D> the value type of {@code d}
	 * @param <F> the value type of {@code f}
	 * @param <G> the value type of {@code g}
	 * @param <E> the error type
	 * @return a {@link SignalProducer} of {@link pulse.util.function.Tuple6}
	 */
	public static <A, B, C, D, F, G, E> SignalProducer<Tuple6<A, B, C, D, F, G>, E> zip(SignalProducer<A, E> a,
			SignalProducer<B, E> b,
			SignalProducer<C, E> c,
			SignalProducer<D, E> d,
			SignalProducer<F, E> f,
			SignalProducer<G, E> g) {
		return zip(a, b, c, d, f).zipWith(g)
		                         .map(t -> Tuples.append(t.getT1(), t.getT2()));
	}

	/**
	 * Zip the values of all the given producers into a {@link List}, in the manner of
	 * {@link #zipWith(SignalProducer)}.
	 *
	 * @param producers the producers to zip
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link SignalProducer}, {@link #empty()} if there is no producer
	 */
	public static <T, E> SignalProducer<List<T>, E> zip(Iterable<? extends SignalProducer<T, E>> producers) {
		Iterator<? extends SignalProducer<T, E>> iterator = producers.iterator();
		if (!iterator.hasNext()) {
			return empty();
		}
		SignalProducer<List<T>, E> zipped = iterator.next().map(Collections::singletonList);
		while (iterator.hasNext()) {
			zipped = zipped.zipWith(iterator.next()).map(SignalProducer::appendValue);
		}
		return zipped;
	}

	static <T> List<T> appendValue(Tuple2<List<T>, T> tuple) {
		List<T> values = new ArrayList<>(tuple.getT1().size() + 1);
		values.addAll(tuple.getT1());
		values.add(tuple.getT2());
		return values;
	}

	/**
	 * Start a run and block until it terminates.
	 * <p>
	 * This is a blocking call: it must not be used on a thread the run depends on, and
	 * it throws {@link IllegalStateException} on {@link pulse.core.scheduler.NonBlocking}
	 * threads.
	 *
	 * @return the value if the run sent exactly one value, the error if it failed, null
	 * if it sent no value or more than one
	 */
	@Nullable
	public Result<T, E> single() {
		BlockingSingleObserver<T, E> observer = new BlockingSingleObserver<>();
		observer.setCancel(take(2).start(observer));
		return observer.blockingGet();
	}

	/**
	 * Like {@link #single()}, interrupting the run and throwing
	 * {@link IllegalStateException} if it does not terminate within {@code timeout}.
	 *
	 * @param timeout the maximum time to block
	 * @return the value if the run sent exactly one value, the error if it failed, null
	 * if it sent no value or more than one
	 */
	@Nullable
	public Result<T, E> single(Duration timeout) {
		BlockingSingleObserver<T, E> observer = new BlockingSingleObserver<>();
		observer.setCancel(take(2).start(observer));
		return observer.blockingGet(timeout.toNanos(), TimeUnit.NANOSECONDS);
	}

	/**
	 * Start a run and block until its first value or its termination.
	 *
	 * @return the first value, the error if it failed first, null if it sent no value
	 * @see #single()
	 */
	@Nullable
	public Result<T, E> first() {
		return take(1).single();
	}

	/**
	 * Like {@link #first()}, interrupting the run and throwing
	 * {@link IllegalStateException} if no value arrives within {@code timeout}.
	 *
	 * @param timeout the maximum time to block
	 * @return the first value, the error if it failed first, null if it sent no value
	 */
	@Nullable
	public Result<T, E> first(Duration timeout) {
		return take(1).single(timeout);
	}

	/**
	 * Start a run and block until its termination.
	 *
	 * @return the last value, the error if it failed, null if it sent no value
	 * @see #single()
	 */
	@Nullable
	public Result<T, E> last() {
		return takeLast(1).single();
	}

	/**
	 * Like {@link #last()}, interrupting the run and throwing
	 * {@link IllegalStateException} if it does not terminate within {@code timeout}.
	 *
	 * @param timeout the maximum time to block
	 * @return the last value, the error if it failed, null if it sent no value
	 */
	@Nullable
	public Result<T, E> last(Duration timeout) {
		return takeLast(1).single(timeout);
	}

	/**
	 * Start a run and block until its termination, ignoring its values.
	 *
	 * @return the error if the run failed, a success otherwise
	 * @see #single()
	 */
	public Result<Void, E> await() {
		Result<Void, E> result = then(SignalProducer.<Void, E>empty()).last();
		return result != null ? result : Result.success(null);
	}

	/**
	 * Like {@link #await()}, interrupting the run and throwing
	 * {@link IllegalStateException} if it does not terminate within {@code timeout}.
	 *
	 * @param timeout the maximum time to block
	 * @return the error if the run failed, a success otherwise
	 */
	public Result<Void, E> await(Duration timeout) {
		Result<Void, E> result = then(SignalProducer.<Void, E>empty()).last(timeout);
		return result != null ? result : Result.success(null);
	}

	static void checkCount(int count) {
		if (count < 0) {
			throw new IllegalArgumentException("count >= 0 required but it was " + count);
		}
	}

	static void checkInterval(Duration interval) {
		if (interval.isNegative()) {
			throw new IllegalArgumentException("interval >= 0 required but it was " + interval);
		}
	}
}
