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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import pulse.core.Disposable;
import pulse.core.scheduler.Scheduler;
import pulse.core.scheduler.Schedulers;
import pulse.test.FakeDisposable;
import pulse.test.observer.TestObserver;
import pulse.util.Result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

public class ProducerFlattenTest {

	SignalProducer.Buffer<SignalProducer<Integer, String>, String> outer;
	Signal.Pipe<Integer, String>                                  a;
	Signal.Pipe<Integer, String>                                  b;
	TestObserver<Integer, String>                                 observer;

	@BeforeEach
	public void setUp() {
		outer = SignalProducer.buffer(0);
		a = Signal.pipe();
		b = Signal.pipe();
		observer = TestObserver.create();
	}

	static SignalProducer<Integer, String> fromPipe(Signal.Pipe<Integer, String> pipe) {
		return new SignalProducer<>((o, d) -> d.add(pipe.signal().observe(o)));
	}

	static SignalProducer<Integer, String> fromPipe(Signal.Pipe<Integer, String> pipe, FakeDisposable resource) {
		return new SignalProducer<>((o, d) -> {
			d.add(resource);
			d.add(pipe.signal().observe(o));
		});
	}

	SignalProducer<Integer, String> flattened(FlattenStrategy strategy) {
		return SignalProducer.flatten(outer.producer(), strategy);
	}

	// merge

	@Test
	public void mergeInterleavesInnerEvents() {
		flattened(FlattenStrategy.MERGE).start(observer);
		outer.observer().sendNext(fromPipe(a));
		outer.observer().sendNext(fromPipe(b));

		a.observer().sendNext(1);
		b.observer().sendNext(2);
		a.observer().sendNext(3);

		assertThat(observer.getReceivedOnNext()).containsExactly(1, 2, 3);
	}

	@Test
	public void mergeCompletesOnceOuterAndEveryInnerCompleted() {
		flattened(FlattenStrategy.MERGE).start(observer);
		outer.observer().sendNext(fromPipe(a));
		outer.observer().sendNext(fromPipe(b));

		a.observer().sendCompleted();
		outer.observer().sendCompleted();
		assertThat(observer.isTerminated()).isFalse();

		b.observer().sendNext(4);
		b.observer().sendCompleted();
		assertThat(observer.getEvents()).containsExactly(Event.next(4), Event.completed());
	}

	@Test
	public void mergeCompletesWhenOuterCompletesLast() {
		flattened(FlattenStrategy.MERGE).start(observer);
		outer.observer().sendNext(fromPipe(a));
		a.observer().sendCompleted();
		assertThat(observer.isTerminated()).isFalse();

		outer.observer().sendCompleted();
		assertThat(observer.isCompleted()).isTrue();
	}

	@Test
	public void mergeCountsInnerInterruptionAsCompletion() {
		flattened(FlattenStrategy.MERGE).start(observer);
		outer.observer().sendNext(fromPipe(a));
		outer.observer().sendCompleted();

		a.observer().sendInterrupted();

		assertThat(observer.getEvents()).containsExactly(Event.completed());
	}

	@Test
	public void mergeInnerErrorDisposesTheOtherInners() {
		FakeDisposable resource = new FakeDisposable();
		flattened(FlattenStrategy.MERGE).start(observer);
		outer.observer().sendNext(fromPipe(a));
		outer.observer().sendNext(fromPipe(b, resource));

		a.observer().sendError("boom");
		b.observer().sendNext(1);

		assertThat(observer.getEvents()).containsExactly(Event.error("boom"));
		assertThat(resource.disposed).hasValue(1);
	}

	@Test
	public void mergeOuterErrorIsForwarded() {
		flattened(FlattenStrategy.MERGE).start(observer);
		outer.observer().sendNext(fromPipe(a));
		outer.observer().sendError("outer");

		assertThat(observer.expectTerminalError()).isEqualTo("outer");
	}

	@Test
	public void mergeStartsInnersImmediately() {
		AtomicBoolean started = new AtomicBoolean();
		flattened(FlattenStrategy.MERGE).start(observer);
		outer.observer().sendNext(fromPipe(a));
		outer.observer().sendNext(fromPipe(b).doOnStarted(() -> started.set(true)));

		assertThat(started).isTrue();
	}

	@RepeatedTest(20)
	public void mergeOfConcurrentInnersCompletesOnceAfterEveryValue() {
		Scheduler pool = Schedulers.fromExecutorService(Executors.newScheduledThreadPool(4));
		try {
			List<SignalProducer<Integer, String>> inners = new ArrayList<>();
			List<Integer> expected = new ArrayList<>();
			for (int i = 0; i < 8; i++) {
				List<Integer> values = new ArrayList<>();
				for (int j = 0; j < 100; j++) {
					values.add(i * 100 + j);
				}
				expected.addAll(values);
				inners.add(SignalProducer.<Integer, String>fromIterable(values).startOn(pool));
			}

			TestObserver<Integer, String> concurrent = TestObserver.create();
			SignalProducer.flatten(SignalProducer.<SignalProducer<Integer, String>, String>fromIterable(inners),
					FlattenStrategy.MERGE)
			              .start(concurrent);

			await().atMost(Duration.ofSeconds(5)).until(concurrent::isTerminated);
			assertThat(concurrent.isCompleted()).isTrue();
			assertThat(concurrent.getReceivedOnNext()).containsExactlyInAnyOrderElementsOf(expected);
			assertThat(concurrent.getProtocolErrors()).isEmpty();
		}
		finally {
			pool.dispose();
		}
	}

	// concat

	@Test
	public void concatStartsInnersOneAfterTheOther() {
		AtomicBoolean secondStarted = new AtomicBoolean();
		flattened(FlattenStrategy.CONCAT).start(observer);
		outer.observer().sendNext(fromPipe(a));
		outer.observer().sendNext(fromPipe(b).doOnStarted(() -> secondStarted.set(true)));

		a.observer().sendNext(1);
		assertThat(secondStarted).isFalse();

		a.observer().sendCompleted();
		assertThat(secondStarted).isTrue();

		b.observer().sendNext(2);
		assertThat(observer.getReceivedOnNext()).containsExactly(1, 2);
	}

	@Test
	public void concatCompletesAfterOuterAndLastInner() {
		flattened(FlattenStrategy.CONCAT).start(observer);
		outer.observer().sendNext(fromPipe(a));
		outer.observer().sendNext(fromPipe(b));
		outer.observer().sendCompleted();

		a.observer().sendCompleted();
		assertThat(observer.isTerminated()).isFalse();

		b.observer().sendCompleted();
		assertThat(observer.getEvents()).containsExactly(Event.completed());
	}

	@Test
	public void concatOfEmptyOuterCompletes() {
		flattened(FlattenStrategy.CONCAT).start(observer);
		outer.observer().sendCompleted();

		assertThat(observer.isCompleted()).isTrue();
	}

	@Test
	public void concatMovesOnWhenAnInnerIsInterrupted() {
		flattened(FlattenStrategy.CONCAT).start(observer);
		outer.observer().sendNext(fromPipe(a));
		outer.observer().sendNext(fromPipe(b));

		a.observer().sendInterrupted();
		b.observer().sendNext(7);

		assertThat(observer.getReceivedOnNext()).containsExactly(7);
		assertThat(observer.isTerminated()).isFalse();
	}

	@Test
	public void concatInnerErrorStopsTheQueue() {
		AtomicBoolean secondStarted = new AtomicBoolean();
		flattened(FlattenStrategy.CONCAT).start(observer);
		outer.observer().sendNext(fromPipe(a));
		outer.observer().sendNext(fromPipe(b).doOnStarted(() -> secondStarted.set(true)));

		a.observer().sendError("boom");

		assertThat(observer.getEvents()).containsExactly(Event.error("boom"));
		assertThat(secondStarted).isFalse();
	}

	@Test
	public void concatOfSynchronousInnersKeepsOrder() {
		Result<List<Integer>, String> result =
				SignalProducer.flatten(SignalProducer.<SignalProducer<Integer, String>, String>values(
						SignalProducer.values(1, 2), SignalProducer.values(3), SignalProducer.values(4, 5)),
						FlattenStrategy.CONCAT)
				              .collect()
				              .single();

		assertThat(result).isEqualTo(Result.success(Arrays.asList(1, 2, 3, 4, 5)));
	}

	// latest

	@Test
	public void latestForwardsOnlyTheNewestInner() {
		FakeDisposable firstResource = new FakeDisposable();
		flattened(FlattenStrategy.LATEST).start(observer);
		outer.observer().sendNext(fromPipe(a, firstResource));
		a.observer().sendNext(1);

		outer.observer().sendNext(fromPipe(b));
		a.observer().sendNext(2);
		b.observer().sendNext(3);

		assertThat(observer.getReceivedOnNext()).containsExactly(1, 3);
		assertThat(firstResource.disposed).hasValue(1);
	}

	@Test
	public void latestReplacementIsNotACompletion() {
		flattened(FlattenStrategy.LATEST).start(observer);
		outer.observer().sendNext(fromPipe(a));
		outer.observer().sendNext(fromPipe(b));
		outer.observer().sendCompleted();
		assertThat(observer.isTerminated()).isFalse();

		b.observer().sendCompleted();
		assertThat(observer.getEvents()).containsExactly(Event.completed());
	}

	@Test
	public void latestCompletesWithOuterWhenNoInnerIsActive() {
		flattened(FlattenStrategy.LATEST).start(observer);
		outer.observer().sendCompleted();

		assertThat(observer.isCompleted()).isTrue();
	}

	@Test
	public void latestCompletesWithOuterAfterInnerCompleted() {
		flattened(FlattenStrategy.LATEST).start(observer);
		outer.observer().sendNext(fromPipe(a));
		a.observer().sendCompleted();
		assertThat(observer.isTerminated()).isFalse();

		outer.observer().sendCompleted();
		assertThat(observer.isCompleted()).isTrue();
	}

	@Test
	public void latestInnerErrorIsForwarded() {
		flattened(FlattenStrategy.LATEST).start(observer);
		outer.observer().sendNext(fromPipe(a));
		a.observer().sendError("boom");

		assertThat(observer.expectTerminalError()).isEqualTo("boom");
	}

	@Test
	public void latestIgnoresADeferredInterruptionOfTheReplacedInner() throws Exception {
		CountDownLatch delivering = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		flattened(FlattenStrategy.LATEST)
				.doOnNext(v -> {
					if (v == 1) {
						delivering.countDown();
						awaitQuietly(release);
					}
				})
				.start(observer);
		outer.observer().sendNext(fromPipe(a));

		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			Future<?> first = executor.submit(() -> a.observer().sendNext(1));
			assertThat(delivering.await(5, TimeUnit.SECONDS)).isTrue();

			// the first inner is still delivering, its interruption is deferred
			outer.observer().sendNext(fromPipe(b));
			outer.observer().sendCompleted();
			release.countDown();
			first.get(5, TimeUnit.SECONDS);
		}
		finally {
			executor.shutdownNow();
		}

		assertThat(observer.isTerminated()).isFalse();
		b.observer().sendNext(2);
		assertThat(observer.getEvents()).containsExactly(Event.next(1), Event.next(2));

		b.observer().sendCompleted();
		assertThat(observer.isCompleted()).isTrue();
	}

	static void awaitQuietly(CountDownLatch latch) {
		try {
			latch.await(5, TimeUnit.SECONDS);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	@Test
	public void disposingTheRunDisposesEveryInner() {
		FakeDisposable first = new FakeDisposable();
		FakeDisposable second = new FakeDisposable();
		flattened(FlattenStrategy.MERGE).start(observer).dispose();
		outer.observer().sendNext(fromPipe(a, first));

		TestObserver<Integer, String> other = TestObserver.create();
		Disposable run = flattened(FlattenStrategy.MERGE).start(other);
		outer.observer().sendNext(fromPipe(b, second));
		run.dispose();

		assertThat(first.disposed).hasValue(0);
		assertThat(second.disposed).hasValue(1);
		assertThat(other.isInterrupted()).isTrue();
	}

	@Test
	public void flatMapAppliesTheStrategy() {
		Result<List<Integer>, String> result = SignalProducer.<Integer, String>values(1, 2, 3)
		                                                     .flatMap(FlattenStrategy.CONCAT,
				                                                     v -> SignalProducer.values(v, v * 10))
		                                                     .collect()
		                                                     .single();

		assertThat(result).isEqualTo(Result.success(Arrays.asList(1, 10, 2, 20, 3, 30)));
	}
}
