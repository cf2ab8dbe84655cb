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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;

import pulse.core.Disposable;
import pulse.core.Disposables;
import pulse.core.scheduler.Scheduler;
import pulse.util.Logger;
import pulse.util.Loggers;
import pulse.util.Result;
import pulse.util.annotation.Nullable;
import pulse.util.concurrent.Bag;
import pulse.util.function.Tuple2;
import pulse.util.function.Tuples;

/**
 * A hot, multicast, push-based stream of {@link Event events}. Any number of observers
 * can be attached with {@link #observe(Observer)}; each one sees the events sent after
 * it joined.
 * <p>
 * A signal delivers at most one terminal event. Once terminated it drops its observers
 * and disposes the {@link Disposable} returned by its generator; later events are
 * dropped, and observing it only delivers {@link Event.Type#INTERRUPTED}.
 * <p>
 * Event delivery is serialized. An event sent by an observer while it is being
 * delivered another event of the same signal is queued, and delivered once every
 * observer received the current one. An {@link Event.Type#INTERRUPTED} sent while
 * another event is being delivered, from this thread or another one, waits for that
 * delivery to finish and drops the events still queued.
 * <p>
 * Signals are usually obtained from {@link SignalProducer#startWithSignal}, the
 * operators below being lifted to the producer level.
 *
 * @param <T> the value type
 * @param <E> the error type
 */
public final class Signal<T, E> {

	static final Logger log = Loggers.getLogger(Signal.class);

	/**
	 * Create a {@link Signal} and the {@link Observer} feeding it.
	 *
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link Pipe}
	 */
	public static <T, E> Pipe<T, E> pipe() {
		Signal<T, E> signal = new Signal<>();
		return new Pipe<>(signal, signal::send);
	}

	/**
	 * A {@link Signal} along with the {@link Observer} sending its events.
	 *
	 * @param <T> the value type
	 * @param <E> the error type
	 */
	public static final class Pipe<T, E> {

		final Signal<T, E>   signal;
		final Observer<T, E> observer;

		Pipe(Signal<T, E> signal, Observer<T, E> observer) {
			this.signal = signal;
			this.observer = observer;
		}

		public Signal<T, E> signal() {
			return signal;
		}

		public Observer<T, E> observer() {
			return observer;
		}
	}

	final AtomicReference<Bag<Observer<T, E>>> observers = new AtomicReference<>(new Bag<>());
	final ReentrantLock                        sendLock  = new ReentrantLock();
	final Disposable.Swap                      generatorDisposable = Disposables.swap();
	final ArrayDeque<Event<T, E>>              pending   = new ArrayDeque<>();

	volatile boolean interrupted;

	Signal() {
	}

	/**
	 * Create a {@link Signal} whose events are sent by the given generator. The
	 * generator runs immediately, and the {@link Disposable} it returns (if any) is
	 * disposed once the signal terminates.
	 *
	 * @param generator receives the {@link Observer} feeding this signal
	 */
	public Signal(Function<? super Observer<T, E>, ? extends Disposable> generator) {
		Observer<T, E> sink = this::send;
		Disposable d = generator.apply(sink);
		if (d != null) {
			generatorDisposable.update(d);
		}
	}

	/**
	 * Attach an {@link Observer} to this signal. If the signal already terminated, the
	 * observer receives {@link Event.Type#INTERRUPTED} right away.
	 *
	 * @param observer the observer
	 * @return a {@link Disposable} detaching the observer, or a disposed one if the
	 * signal already terminated
	 */
	public Disposable observe(Observer<T, E> observer) {
		Objects.requireNonNull(observer, "observer");
		for (;;) {
			Bag<Observer<T, E>> current = observers.get();
			if (current == null) {
				observer.sendInterrupted();
				return Disposables.disposed();
			}
			Bag<Observer<T, E>> next = current.copy();
			Bag.RemovalToken token = next.insert(observer);
			if (observers.compareAndSet(current, next)) {
				return Disposables.action(() -> removeObserver(token));
			}
		}
	}

	void removeObserver(Bag.RemovalToken token) {
		for (;;) {
			Bag<Observer<T, E>> current = observers.get();
			if (current == null) {
				return;
			}
			Bag<Observer<T, E>> next = current.copy();
			if (!next.remove(token) || observers.compareAndSet(current, next)) {
				return;
			}
		}
	}

	void send(Event<T, E> event) {
		if (event.getType() == Event.Type.INTERRUPTED) {
			interrupted = true;
			if (!sendLock.isHeldByCurrentThread()) {
				tryInterrupt();
			}
			return;
		}

		if (sendLock.isHeldByCurrentThread()) {
			// sent from within a delivery, drained by the delivering frame below
			pending.offer(event);
			return;
		}

		boolean terminated = false;
		sendLock.lock();
		try {
			Event<T, E> next = event;
			while (next != null && !terminated && !interrupted) {
				terminated = deliver(next);
				next = pending.poll();
			}
			pending.clear();
		}
		finally {
			sendLock.unlock();
		}

		if (terminated) {
			generatorDisposable.dispose();
		}
		else if (interrupted) {
			tryInterrupt();
		}
	}

	/**
	 * Deliver one event to the current observers. Must be called under the send lock.
	 *
	 * @return true if the event terminated this signal
	 */
	boolean deliver(Event<T, E> event) {
		Bag<Observer<T, E>> current = event.isTerminating()
				? observers.getAndSet(null)
				: observers.get();
		if (current == null) {
			if (log.isDebugEnabled()) {
				log.debug("Dropping {} sent after termination", event);
			}
			return false;
		}
		for (Observer<T, E> observer : current) {
			observer.onEvent(event);
		}
		return event.isTerminating();
	}

	/**
	 * Deliver the pending interruption unless another delivery is in progress, in
	 * which case that delivery picks it up once done.
	 */
	void tryInterrupt() {
		if (!sendLock.tryLock()) {
			return;
		}
		Bag<Observer<T, E>> current;
		try {
			current = observers.getAndSet(null);
			if (current != null) {
				Event<T, E> event = Event.interrupted();
				for (Observer<T, E> observer : current) {
					observer.onEvent(event);
				}
			}
			pending.clear();
		}
		finally {
			sendLock.unlock();
		}
		if (current != null) {
			generatorDisposable.dispose();
		}
	}

	/**
	 * Map each value to a new value.
	 *
	 * @param mapper the value transformation
	 * @param <U> the new value type
	 * @return a new {@link Signal}
	 */
	public <U> Signal<U, E> map(Function<? super T, ? extends U> mapper) {
		Objects.requireNonNull(mapper, "mapper");
		return new Signal<>(observer -> observe(event -> observer.onEvent(event.map(mapper))));
	}

	/**
	 * Map the error to a new error.
	 *
	 * @param mapper the error transformation
	 * @param <F> the new error type
	 * @return a new {@link Signal}
	 */
	public <F> Signal<T, F> mapError(Function<? super E, ? extends F> mapper) {
		Objects.requireNonNull(mapper, "mapper");
		return new Signal<>(observer -> observe(event -> observer.onEvent(event.mapError(mapper))));
	}

	/**
	 * Forward only the values matching the given predicate.
	 *
	 * @param predicate the value filter
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> filter(Predicate<? super T> predicate) {
		Objects.requireNonNull(predicate, "predicate");
		return new Signal<>(observer -> observe(event -> {
			if (event.getType() != Event.Type.NEXT || predicate.test(event.get())) {
				observer.onEvent(event);
			}
		}));
	}

	/**
	 * Forward up to {@code count} values, then complete.
	 *
	 * @param count the number of values to take
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> take(int count) {
		if (count < 0) {
			throw new IllegalArgumentException("count >= 0 required but it was " + count);
		}
		if (count == 0) {
			return new Signal<>(observer -> {
				observer.sendCompleted();
				return null;
			});
		}
		return new Signal<>(observer -> {
			AtomicInteger taken = new AtomicInteger();
			return observe(event -> {
				if (event.getType() != Event.Type.NEXT) {
					observer.onEvent(event);
					return;
				}
				int n = taken.get();
				if (n < count) {
					taken.set(++n);
					observer.onEvent(event);
				}
				if (n == count) {
					observer.sendCompleted();
				}
			});
		});
	}

	/**
	 * Upon completion, forward the last {@code count} values then complete.
	 *
	 * @param count the number of values to keep
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> takeLast(int count) {
		if (count < 0) {
			throw new IllegalArgumentException("count >= 0 required but it was " + count);
		}
		return new Signal<>(observer -> {
			ArrayDeque<T> buffer = new ArrayDeque<>();
			return observe(event -> {
				switch (event.getType()) {
					case NEXT:
						buffer.addLast(event.get());
						while (buffer.size() > count) {
							buffer.removeFirst();
						}
						break;
					case COMPLETED:
						for (T value : buffer) {
							observer.sendNext(value);
						}
						buffer.clear();
						observer.sendCompleted();
						break;
					default:
						observer.onEvent(event);
				}
			});
		});
	}

	/**
	 * Drop the first {@code count} values.
	 *
	 * @param count the number of values to skip
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> skip(int count) {
		if (count < 0) {
			throw new IllegalArgumentException("count >= 0 required but it was " + count);
		}
		if (count == 0) {
			return this;
		}
		return new Signal<>(observer -> {
			AtomicInteger skipped = new AtomicInteger();
			return observe(event -> {
				if (event.getType() == Event.Type.NEXT && skipped.get() < count) {
					skipped.incrementAndGet();
					return;
				}
				observer.onEvent(event);
			});
		});
	}

	/**
	 * Drop values until the predicate first returns false, then forward everything.
	 *
	 * @param predicate the skip condition
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> skipWhile(Predicate<? super T> predicate) {
		Objects.requireNonNull(predicate, "predicate");
		return new Signal<>(observer -> {
			AtomicBoolean skipping = new AtomicBoolean(true);
			return observe(event -> {
				if (event.getType() == Event.Type.NEXT && skipping.get()) {
					if (predicate.test(event.get())) {
						return;
					}
					skipping.set(false);
				}
				observer.onEvent(event);
			});
		});
	}

	/**
	 * Forward values while the predicate holds, complete on the first one that fails it.
	 *
	 * @param predicate the take condition
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> takeWhile(Predicate<? super T> predicate) {
		Objects.requireNonNull(predicate, "predicate");
		return new Signal<>(observer -> observe(event -> {
			if (event.getType() == Event.Type.NEXT && !predicate.test(event.get())) {
				observer.sendCompleted();
			}
			else {
				observer.onEvent(event);
			}
		}));
	}

	/**
	 * Collect every value in a {@link List}, sent upon completion.
	 *
	 * @return a new {@link Signal}
	 */
	public Signal<List<T>, E> collect() {
		return new Signal<>(observer -> {
			List<T> values = new ArrayList<>();
			return observe(event -> {
				switch (event.getType()) {
					case NEXT:
						values.add(event.get());
						break;
					case COMPLETED:
						observer.sendNext(new ArrayList<>(values));
						observer.sendCompleted();
						break;
					default:
						observer.onEvent(event.retype());
				}
			});
		});
	}

	/**
	 * Accumulate the values, sending every intermediate accumulation.
	 *
	 * @param initial the initial accumulation
	 * @param accumulator combines the accumulation with each value
	 * @param <U> the accumulation type
	 * @return a new {@link Signal}
	 */
	public <U> Signal<U, E> scan(U initial, BiFunction<U, ? super T, U> accumulator) {
		Objects.requireNonNull(accumulator, "accumulator");
		return new Signal<>(observer -> {
			AtomicReference<U> accumulated = new AtomicReference<>(initial);
			return observe(event -> {
				if (event.getType() == Event.Type.NEXT) {
					U next = accumulator.apply(accumulated.get(), event.get());
					accumulated.set(next);
					observer.sendNext(next);
				}
				else {
					observer.onEvent(event.retype());
				}
			});
		});
	}

	/**
	 * Like {@link #scan(Object, BiFunction)}, but only send the final accumulation upon
	 * completion ({@code initial} if there was no value).
	 *
	 * @param initial the initial accumulation
	 * @param accumulator combines the accumulation with each value
	 * @param <U> the accumulation type
	 * @return a new {@link Signal}
	 */
	public <U> Signal<U, E> reduce(U initial, BiFunction<U, ? super T, U> accumulator) {
		Objects.requireNonNull(accumulator, "accumulator");
		return new Signal<>(observer -> {
			AtomicReference<U> accumulated = new AtomicReference<>(initial);
			return observe(event -> {
				switch (event.getType()) {
					case NEXT:
						accumulated.set(accumulator.apply(accumulated.get(), event.get()));
						break;
					case COMPLETED:
						observer.sendNext(accumulated.get());
						observer.sendCompleted();
						break;
					default:
						observer.onEvent(event.retype());
				}
			});
		});
	}

	/**
	 * Drop values that are repeats of the previous one, according to {@code isRepeat}.
	 * The first value is always forwarded.
	 *
	 * @param isRepeat tests the previous value against the current one
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> skipRepeats(BiPredicate<? super T, ? super T> isRepeat) {
		Objects.requireNonNull(isRepeat, "isRepeat");
		return new Signal<>(observer -> {
			AtomicReference<T> previous = new AtomicReference<>();
			return observe(event -> {
				if (event.getType() == Event.Type.NEXT) {
					T value = event.get();
					T last = previous.getAndSet(value);
					if (last != null && isRepeat.test(last, value)) {
						return;
					}
				}
				observer.onEvent(event);
			});
		});
	}

	/**
	 * Drop values {@link Object#equals(Object) equal} to the previous one.
	 *
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> skipRepeats() {
		return skipRepeats(Objects::equals);
	}

	/**
	 * Pair each value with the previous one, {@code initial} standing in for the
	 * previous value of the first one.
	 *
	 * @param initial the previous value of the first value
	 * @return a new {@link Signal}
	 */
	public Signal<Tuple2<T, T>, E> combinePrevious(T initial) {
		Objects.requireNonNull(initial, "initial");
		return new Signal<>(observer -> {
			AtomicReference<T> previous = new AtomicReference<>(initial);
			return observe(event -> observer.onEvent(
					event.map(v -> Tuples.of(previous.getAndSet(v), v))));
		});
	}

	/**
	 * Send every event as a value. A terminal event is sent as a value then followed by
	 * completion, except interruption which is followed by interruption.
	 *
	 * @return a new {@link Signal}
	 */
	public Signal<Event<T, E>, NoError> materialize() {
		return new Signal<>(observer -> observe(event -> {
			observer.sendNext(event);
			switch (event.getType()) {
				case NEXT:
					break;
				case INTERRUPTED:
					observer.sendInterrupted();
					break;
				default:
					observer.sendCompleted();
			}
		}));
	}

	/**
	 * Turn a {@link #materialize() materialized} signal back into its events.
	 *
	 * @param signal the materialized signal
	 * @param <T> the value type
	 * @param <E> the error type
	 * @return a new {@link Signal}
	 */
	public static <T, E> Signal<T, E> dematerialize(Signal<Event<T, E>, NoError> signal) {
		return new Signal<>(observer -> signal.observe(event -> {
			switch (event.getType()) {
				case NEXT:
					observer.onEvent(event.get());
					break;
				case INTERRUPTED:
					observer.sendInterrupted();
					break;
				default:
					observer.sendCompleted();
			}
		}));
	}

	/**
	 * Widen a signal that cannot fail to any error type.
	 *
	 * @param signal the signal that cannot fail
	 * @param <T> the value type
	 * @param <F> the new error type
	 * @return a new {@link Signal}
	 */
	public static <T, F> Signal<T, F> promoteErrors(Signal<T, NoError> signal) {
		return signal.mapError(e -> {
			throw new IllegalStateException("Unexpected error " + e);
		});
	}

	/**
	 * Forward every event on the given {@link Scheduler}.
	 *
	 * @param scheduler the scheduler delivering events
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> observeOn(Scheduler scheduler) {
		Objects.requireNonNull(scheduler, "scheduler");
		return new Signal<>(observer -> observe(event -> scheduler.schedule(() -> observer.onEvent(event))));
	}

	/**
	 * Delay values and completion by the given interval. Errors and interruption are
	 * forwarded on the scheduler without delay.
	 *
	 * @param interval the delay
	 * @param scheduler the time-capable scheduler delivering events
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> delay(Duration interval, Scheduler scheduler) {
		Objects.requireNonNull(scheduler, "scheduler");
		if (interval.isNegative()) {
			throw new IllegalArgumentException("interval >= 0 required but it was " + interval);
		}
		long nanos = interval.toNanos();
		return new Signal<>(observer -> observe(event -> {
			switch (event.getType()) {
				case NEXT:
				case COMPLETED:
					scheduler.schedule(() -> observer.onEvent(event), nanos, TimeUnit.NANOSECONDS);
					break;
				default:
					scheduler.schedule(() -> observer.onEvent(event));
			}
		}));
	}

	/**
	 * Let at least {@code interval} pass between values, forwarding the latest value of
	 * each window on the scheduler. A value still pending on termination is dropped.
	 *
	 * @param interval the minimum interval between values
	 * @param scheduler the time-capable scheduler delivering events
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> throttle(Duration interval, Scheduler scheduler) {
		Objects.requireNonNull(scheduler, "scheduler");
		if (interval.isNegative()) {
			throw new IllegalArgumentException("interval >= 0 required but it was " + interval);
		}
		return new Signal<>(observer -> new SignalThrottle<>(this, observer, interval.toNanos(), scheduler));
	}

	/**
	 * Fail with {@code error} unless this signal terminates within {@code interval}.
	 *
	 * @param error the error sent on timeout
	 * @param interval the time allowed
	 * @param scheduler the time-capable scheduler measuring time
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> timeoutWithError(E error, Duration interval, Scheduler scheduler) {
		Objects.requireNonNull(error, "error");
		Objects.requireNonNull(scheduler, "scheduler");
		if (interval.isNegative()) {
			throw new IllegalArgumentException("interval >= 0 required but it was " + interval);
		}
		return new Signal<>(observer -> Disposables.composite(
				scheduler.schedule(() -> observer.sendError(error), interval.toNanos(), TimeUnit.NANOSECONDS),
				observe(observer)));
	}

	/**
	 * Run a fallible operation on each value, failing with its error when it fails.
	 *
	 * @param operation the operation
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> attempt(Function<? super T, Result<Void, E>> operation) {
		Objects.requireNonNull(operation, "operation");
		return attemptMap(value -> operation.apply(value).map(ignored -> value));
	}

	/**
	 * Map each value through a fallible operation, failing with its error when it fails.
	 *
	 * @param operation the operation
	 * @param <U> the new value type
	 * @return a new {@link Signal}
	 */
	public <U> Signal<U, E> attemptMap(Function<? super T, Result<U, E>> operation) {
		Objects.requireNonNull(operation, "operation");
		return new Signal<>(observer -> observe(event -> {
			if (event.getType() == Event.Type.NEXT) {
				Result<U, E> result = operation.apply(event.get());
				if (result.isSuccess()) {
					observer.sendNext(result.value());
				}
				else {
					observer.sendError(result.error());
				}
			}
			else {
				observer.onEvent(event.retype());
			}
		}));
	}

	/**
	 * Combine the latest value of this signal with the latest value of {@code other}.
	 * Nothing is sent until both have sent a value; completes once both completed.
	 *
	 * @param other the other signal
	 * @param <U> the value type of the other signal
	 * @return a new {@link Signal}
	 */
	public <U> Signal<Tuple2<T, U>, E> combineLatestWith(Signal<U, E> other) {
		Objects.requireNonNull(other, "other");
		return new Signal<>(observer -> new SignalCombineLatest<>(this, other, observer));
	}

	/**
	 * Pair the n-th value of this signal with the n-th value of {@code other}. Completes
	 * once either signal completed and all of its values were paired.
	 *
	 * @param other the other signal
	 * @param <U> the value type of the other signal
	 * @return a new {@link Signal}
	 */
	public <U> Signal<Tuple2<T, U>, E> zipWith(Signal<U, E> other) {
		Objects.requireNonNull(other, "other");
		return new Signal<>(observer -> new SignalZip<>(this, other, observer));
	}

	/**
	 * Forward the latest value of this signal each time {@code sampler} sends a value.
	 * Completes once both completed, interrupts if either is interrupted.
	 *
	 * @param sampler the sampling signal
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> sampleOn(Signal<?, NoError> sampler) {
		Objects.requireNonNull(sampler, "sampler");
		return new Signal<>(observer -> new SignalSample<>(this, sampler, observer));
	}

	/**
	 * Forward events until {@code trigger} sends a value or completes, then complete.
	 *
	 * @param trigger the completion trigger
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> takeUntil(Signal<?, NoError> trigger) {
		Objects.requireNonNull(trigger, "trigger");
		return new Signal<>(observer -> {
			Disposable.Composite disposable = Disposables.composite();
			disposable.add(observe(observer));
			disposable.add(trigger.observe(event -> {
				switch (event.getType()) {
					case NEXT:
					case COMPLETED:
						observer.sendCompleted();
						break;
					default:
						break;
				}
			}));
			return disposable;
		});
	}

	/**
	 * Forward values, errors and interruption of this signal until {@code replacement}
	 * sends its first event, then forward the events of {@code replacement} only.
	 * Completion of this signal is ignored.
	 *
	 * @param replacement the replacing signal
	 * @return a new {@link Signal}
	 */
	public Signal<T, E> takeUntilReplacement(Signal<T, E> replacement) {
		Objects.requireNonNull(replacement, "replacement");
		return new Signal<>(observer -> {
			Disposable.Composite disposable = Disposables.composite();
			Disposable signalDisposable = observe(event -> {
				if (event.getType() != Event.Type.COMPLETED) {
					observer.onEvent(event);
				}
			});
			disposable.add(signalDisposable);
			disposable.add(replacement.observe(event -> {
				signalDisposable.dispose();
				observer.onEvent(event);
			}));
			return disposable;
		});
	}

	@Override
	public String toString() {
		Bag<Observer<T, E>> current = observers.get();
		return "Signal{" + (current == null ? "terminated" : "observers=" + current.size()) + "}";
	}
}
